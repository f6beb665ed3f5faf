/**
 *
 */
package org.theseed.regflux.expr;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This is a node of a binary expression tree.  A leaf holds an operand (an identifier, a
 * numeric literal, or a relational condition); an internal node holds an operator symbol
 * or a function name.
 *
 * The arity tag describes the shape of an internal node:
 *
 * 0	binary infix operator (a prefix operator has an empty left child)
 * 1	function call with one argument (empty left child, argument on the right)
 * 2	function call with two arguments
 * N	function call with N arguments; the right child is a chain of "," nodes
 *
 * A node owns its children.  The tree is otherwise context-free:  it does not remember
 * the grammar that built it.
 *
 */
public class ExprNode {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ExprNode.class);
    /** node value (operand, operator symbol, or function name) */
    private String value;
    /** left child, or NULL for a leaf */
    private ExprNode left;
    /** right child, or NULL for a leaf */
    private ExprNode right;
    /** arity tag */
    private int arity;

    /** value of the empty-leaf sentinel */
    public static final String EMPTY_LEAF = "@";
    /** value of an argument-chain node */
    public static final String ARG_CHAIN = ",";
    /** arity tag for infix operators */
    public static final int INFIX = 0;
    /** arity tag for one-argument function calls */
    public static final int UNARY_FUNCTION = 1;
    /** arity tag for two-argument function calls */
    public static final int BINARY_FUNCTION = 2;
    /** default display names for canonical operator symbols */
    public static final Map<String, String> DEFAULT_RENAMES = Map.of(Grammar.AND, "and", Grammar.OR, "or",
            Grammar.NOT, "not");
    /** pattern for numeric literals */
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");
    /** pattern for relational conditions */
    private static final Pattern CONDITION = Pattern.compile("[<>=]");

    /**
     * Construct a leaf node.
     *
     * @param value		operand value
     */
    public ExprNode(String value) {
        this.value = value;
        this.left = null;
        this.right = null;
        this.arity = INFIX;
    }

    /**
     * Construct an internal node.
     *
     * @param value		operator symbol or function name
     * @param left		left child
     * @param right		right child
     * @param arity		arity tag
     */
    public ExprNode(String value, ExprNode left, ExprNode right, int arity) {
        this.value = value;
        this.left = left;
        this.right = right;
        this.arity = arity;
    }

    /**
     * @return a new empty leaf
     */
    public static ExprNode empty() {
        return new ExprNode(EMPTY_LEAF);
    }

    /**
     * @return TRUE if the specified token is a numeric literal
     *
     * @param token		token to check
     */
    public static boolean isNumber(String token) {
        return NUMBER.matcher(token).matches();
    }

    /**
     * @return TRUE if the specified token is a relational condition
     *
     * @param token		token to check
     */
    public static boolean isCondition(String token) {
        return CONDITION.matcher(token).find();
    }

    /**
     * @return the node value
     */
    public String getValue() {
        return this.value;
    }

    /**
     * @return the left child (NULL for a leaf)
     */
    public ExprNode getLeft() {
        return this.left;
    }

    /**
     * @return the right child (NULL for a leaf)
     */
    public ExprNode getRight() {
        return this.right;
    }

    /**
     * @return the arity tag
     */
    public int getArity() {
        return this.arity;
    }

    /**
     * @return TRUE if this node is a leaf
     */
    public boolean isLeaf() {
        return this.left == null && this.right == null;
    }

    /**
     * @return TRUE if this node is the empty-leaf sentinel
     */
    public boolean isEmptyLeaf() {
        return this.isLeaf() && EMPTY_LEAF.equals(this.value);
    }

    /**
     * @return TRUE if this node is an operation with exactly one real operand
     */
    public boolean isUnary() {
        return ! this.isLeaf() && (this.left.isEmptyLeaf() != this.right.isEmptyLeaf());
    }

    /**
     * @return TRUE if this node is an operation with two real operands
     */
    public boolean isBinary() {
        return ! this.isLeaf() && ! this.left.isEmptyLeaf() && ! this.right.isEmptyLeaf();
    }

    /**
     * Append a word to the value of this leaf.  This is used by the tree builder to merge
     * consecutive operand tokens.
     *
     * @param word	word to append
     */
    void appendWord(String word) {
        this.value = this.value + " " + word;
    }

    /**
     * @return the set of operands in this subtree (the empty leaf excluded)
     */
    public Set<String> getOperands() {
        Set<String> retVal = new TreeSet<String>();
        this.collect(retVal, x -> x.isLeaf() && ! x.isEmptyLeaf());
        return retVal;
    }

    /**
     * @return the set of operators and function names in this subtree
     */
    public Set<String> getOperators() {
        Set<String> retVal = new TreeSet<String>();
        this.collect(retVal, x -> ! x.isLeaf());
        return retVal;
    }

    /**
     * @return the set of operands in this subtree that are not numeric literals
     */
    public Set<String> getParameters() {
        Set<String> retVal = new TreeSet<String>();
        this.collect(retVal, x -> x.isLeaf() && ! x.isEmptyLeaf() && ! isNumber(x.value));
        return retVal;
    }

    /**
     * @return the set of operands in this subtree that are relational conditions
     */
    public Set<String> getConditions() {
        return this.getOperands().stream().filter(x -> isCondition(x)).collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Add the values of the qualifying nodes of this subtree to a set.
     *
     * @param values	output set
     * @param filter	function that decides whether a node qualifies
     */
    private void collect(Set<String> values, Predicate<ExprNode> filter) {
        if (filter.test(this))
            values.add(this.value);
        if (this.left != null)
            this.left.collect(values, filter);
        if (this.right != null)
            this.right.collect(values, filter);
    }

    /**
     * @return a deep copy of this subtree
     */
    public ExprNode copy() {
        ExprNode retVal;
        if (this.isLeaf())
            retVal = new ExprNode(this.value);
        else
            retVal = new ExprNode(this.value, copyOf(this.left), copyOf(this.right), this.arity);
        return retVal;
    }

    /**
     * @return a deep copy of a possibly-NULL child
     *
     * @param child		child to copy
     */
    private static ExprNode copyOf(ExprNode child) {
        return (child == null ? null : child.copy());
    }

    /**
     * Create a new tree with leaf values substituted.  This tree is not modified.
     *
     * @param mapping	map of old leaf values to new leaf values
     *
     * @return a new tree with the substitutions made
     */
    public ExprNode replace(Map<String, String> mapping) {
        ExprNode retVal;
        if (this.isLeaf())
            retVal = new ExprNode(mapping.getOrDefault(this.value, this.value));
        else {
            ExprNode newLeft = (this.left == null ? null : this.left.replace(mapping));
            ExprNode newRight = (this.right == null ? null : this.right.replace(mapping));
            retVal = new ExprNode(this.value, newLeft, newRight, this.arity);
        }
        return retVal;
    }

    /**
     * Graft a copy of a subtree in place of the first node (depth-first, left to right) whose
     * value equals a key.  The node keeps its identity but takes on the value, children
     * and arity tag of the subtree.
     *
     * @param key		value of the node to replace
     * @param subtree	subtree to graft
     *
     * @return TRUE if a node was replaced, FALSE if the key was not found
     */
    public boolean replaceNode(String key, ExprNode subtree) {
        boolean retVal = false;
        if (key.equals(this.value)) {
            this.graft(subtree);
            retVal = true;
        } else if (! this.isLeaf()) {
            retVal = (this.left != null && this.left.replaceNode(key, subtree));
            if (! retVal && this.right != null)
                retVal = this.right.replaceNode(key, subtree);
        }
        return retVal;
    }

    /**
     * Graft a copy of a subtree in place of every node whose value equals a key.  Grafted
     * copies are not searched again.
     *
     * @param key		value of the nodes to replace
     * @param subtree	subtree to graft
     *
     * @return the number of nodes replaced
     */
    public int replaceAllNodes(String key, ExprNode subtree) {
        int retVal = 0;
        if (key.equals(this.value)) {
            this.graft(subtree);
            retVal = 1;
        } else if (! this.isLeaf()) {
            if (this.left != null)
                retVal += this.left.replaceAllNodes(key, subtree);
            if (this.right != null)
                retVal += this.right.replaceAllNodes(key, subtree);
        }
        return retVal;
    }

    /**
     * Graft every subtree in a map in place of the nodes matching its key.
     *
     * @param nodes		map of node values to replacement subtrees
     */
    public void replaceNodes(Map<String, ExprNode> nodes) {
        for (Map.Entry<String, ExprNode> nodeEntry : nodes.entrySet())
            this.replaceAllNodes(nodeEntry.getKey(), nodeEntry.getValue());
    }

    /**
     * Overwrite this node with a copy of another subtree.
     *
     * @param subtree	subtree to copy
     */
    private void graft(ExprNode subtree) {
        ExprNode source = subtree.copy();
        this.value = source.value;
        this.left = source.left;
        this.right = source.right;
        this.arity = source.arity;
    }

    /**
     * Evaluate this tree with a pair of resolver functions.
     *
     * @param operandFn		function that converts a leaf value to a result
     * @param operatorFn	function that returns the combining function for an operator
     *
     * @return the value of the expression
     */
    public <T> T evaluate(Function<String, T> operandFn, Function<String, BinaryOperator<T>> operatorFn) {
        return TreeEvaluator.evaluate(this, operandFn, operatorFn);
    }

    /**
     * Evaluate this tree with a resolver object.
     *
     * @param resolver		resolver for operands and operators
     *
     * @return the value of the expression
     */
    public <T> T evaluate(Resolver<T> resolver) {
        return TreeEvaluator.evaluate(this, resolver);
    }

    /**
     * @return the infix representation of this tree using the default punctuation
     */
    public String toInfix() {
        return this.toInfix("(", ")", " ", ", ", null);
    }

    /**
     * @return the infix representation of this tree
     *
     * @param open		text to open an infix group
     * @param close		text to close an infix group
     * @param sep		separator between an infix operator and its operands
     * @param argSep	separator between function arguments
     * @param renames	map of operator symbols to display text (overrides the defaults); may be NULL
     */
    public String toInfix(String open, String close, String sep, String argSep, Map<String, String> renames) {
        Map<String, String> displayMap = DEFAULT_RENAMES;
        if (renames != null) {
            displayMap = new HashMap<String, String>(DEFAULT_RENAMES);
            displayMap.putAll(renames);
        }
        StringBuilder retVal = new StringBuilder();
        this.render(retVal, open, close, sep, argSep, displayMap);
        return retVal.toString();
    }

    /**
     * Render this subtree in infix form.
     *
     * @param buffer		output buffer
     * @param open			text to open an infix group
     * @param close			text to close an infix group
     * @param sep			separator around infix operators
     * @param argSep		separator between function arguments
     * @param displayMap	map of operator symbols to display text
     */
    private void render(StringBuilder buffer, String open, String close, String sep, String argSep,
            Map<String, String> displayMap) {
        String display = displayMap.getOrDefault(this.value, this.value);
        if (this.isLeaf()) {
            if (! this.isEmptyLeaf())
                buffer.append(display);
        } else if (this.arity == UNARY_FUNCTION) {
            buffer.append(display).append('(');
            this.right.render(buffer, open, close, sep, argSep, displayMap);
            buffer.append(')');
        } else if (this.arity >= BINARY_FUNCTION) {
            buffer.append(display).append('(');
            List<ExprNode> args = this.getArguments();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0)
                    buffer.append(argSep);
                args.get(i).render(buffer, open, close, sep, argSep, displayMap);
            }
            buffer.append(')');
        } else {
            buffer.append(open);
            if (! this.left.isEmptyLeaf()) {
                this.left.render(buffer, open, close, sep, argSep, displayMap);
                buffer.append(sep);
            }
            buffer.append(display).append(sep);
            this.right.render(buffer, open, close, sep, argSep, displayMap);
            buffer.append(close);
        }
    }

    /**
     * @return the argument subtrees of a function-call node, in order
     */
    public List<ExprNode> getArguments() {
        List<ExprNode> retVal = new ArrayList<ExprNode>(Math.max(this.arity, 1));
        if (this.arity == UNARY_FUNCTION)
            retVal.add(this.right);
        else if (this.arity == BINARY_FUNCTION) {
            retVal.add(this.left);
            retVal.add(this.right);
        } else if (this.arity > BINARY_FUNCTION) {
            retVal.add(this.left);
            // Unwind the argument chain.  The last argument is the final right child.
            ExprNode chain = this.right;
            while (retVal.size() < this.arity - 1 && ARG_CHAIN.equals(chain.value) && ! chain.isLeaf()) {
                retVal.add(chain.left);
                chain = chain.right;
            }
            retVal.add(chain);
        }
        return retVal;
    }

    /**
     * @return the LaTeX rendering of this tree and the precedence of its outermost operator
     */
    public Latex toLatex() {
        Latex retVal;
        if (this.isLeaf()) {
            if (this.isEmptyLeaf())
                retVal = new Latex("", Latex.MAX_PRECEDENCE);
            else
                retVal = new Latex(Latex.convertConstant(this.value), Latex.MAX_PRECEDENCE);
        } else {
            String op = this.value.trim();
            if (Latex.hasLayout(op)) {
                Latex leftLatex = this.left.toLatex();
                Latex rightLatex = this.right.toLatex();
                int p = Latex.precedenceOf(op);
                String leftText = leftLatex.getText();
                String rightText = rightLatex.getText();
                // A fraction groups its own operands.
                if (! op.equals("/")) {
                    // AND and OR share a precedence level, so a left operand using the other one is bracketed.
                    if (p > leftLatex.getPrecedence() || Latex.isLogical(op) && p == leftLatex.getPrecedence()
                            && ! op.equals(this.left.value))
                        leftText = Latex.paren(leftText);
                    if (p > rightLatex.getPrecedence()
                            || Latex.bracketsEqualRight(op) && p == rightLatex.getPrecedence())
                        rightText = Latex.paren(rightText);
                }
                retVal = new Latex(Latex.layout(op, leftText, rightText), p);
            } else {
                String args;
                if (this.arity == INFIX)
                    args = this.left.toLatex().getText() + "," + this.right.toLatex().getText();
                else
                    args = this.getArguments().stream().map(x -> x.toLatex().getText())
                            .collect(Collectors.joining(","));
                retVal = new Latex(Latex.convertConstant(this.value) + "\\left(" + args + "\\right)",
                        Latex.MAX_PRECEDENCE);
            }
        }
        return retVal;
    }

    /**
     * Write an indented picture of this tree to the debug log.
     */
    public void dump() {
        if (log.isDebugEnabled())
            this.dump(0);
    }

    /**
     * Write an indented picture of this subtree to the debug log.
     *
     * @param level		indentation level
     */
    private void dump(int level) {
        if (! this.isEmptyLeaf())
            log.debug("{}|____{}", "\t".repeat(level), this.value);
        if (this.left != null)
            this.left.dump(level + 1);
        if (this.right != null)
            this.right.dump(level + 1);
    }

    @Override
    public String toString() {
        return this.toInfix();
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.value, this.left, this.right, this.arity);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        ExprNode other = (ExprNode) obj;
        return this.arity == other.arity && Objects.equals(this.value, other.value)
                && Objects.equals(this.left, other.left) && Objects.equals(this.right, other.right);
    }

}
