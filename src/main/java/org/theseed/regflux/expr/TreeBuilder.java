/**
 *
 */
package org.theseed.regflux.expr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * This class builds binary expression trees from rule strings.  It uses an operator-precedence
 * (shunting-yard) algorithm with an operator stack and a tree stack, extended to support prefix
 * operators and function calls with any number of arguments.
 *
 * Consecutive operands with no operator between them are merged into a single leaf, so that
 * identifiers containing spaces and relational conditions such as "R > 0" survive as single
 * operands of a Boolean rule.
 *
 */
public class TreeBuilder {

    /** scope marker on the operator stack */
    private static final String SCOPE = "(";

    // FIELDS
    /** grammar in use */
    private final Grammar grammar;
    /** source text, for error messages */
    private final String source;
    /** pending operators */
    private final Deque<String> opStack;
    /** completed subtrees */
    private final Deque<ExprNode> treeStack;

    /**
     * Construct a builder for a single expression.
     *
     * @param grammar	grammar in use
     * @param source	source text, for error messages
     */
    private TreeBuilder(Grammar grammar, String source) {
        this.grammar = grammar;
        this.source = source;
        this.opStack = new ArrayDeque<String>();
        this.treeStack = new ArrayDeque<ExprNode>();
    }

    /**
     * Build an expression tree from a rule string.
     *
     * @param expression	rule string to parse
     * @param grammar		grammar defining the operators
     *
     * @return the root of the expression tree (an empty leaf if the expression is blank)
     *
     * @throws MalformedExpressionException if the expression is not well-formed
     */
    public static ExprNode buildTree(String expression, Grammar grammar) {
        ExprNode retVal;
        if (StringUtils.isBlank(expression))
            retVal = ExprNode.empty();
        else {
            List<Token> tokens = Tokenizer.tokenize(expression, grammar);
            retVal = buildTree(tokens, grammar, expression);
        }
        return retVal;
    }

    /**
     * Build an expression tree from a token list.
     *
     * @param tokens		tokens to parse
     * @param grammar		grammar defining the operators
     *
     * @return the root of the expression tree (an empty leaf if there are no tokens)
     *
     * @throws MalformedExpressionException if the token list is not well-formed
     */
    public static ExprNode buildTree(List<Token> tokens, Grammar grammar) {
        return buildTree(tokens, grammar, StringUtils.join(tokens, " "));
    }

    /**
     * Build an expression tree from a token list.
     *
     * @param tokens		tokens to parse
     * @param grammar		grammar defining the operators
     * @param source		source text, for error messages
     *
     * @return the root of the expression tree
     */
    private static ExprNode buildTree(List<Token> tokens, Grammar grammar, String source) {
        TreeBuilder builder = new TreeBuilder(grammar, source);
        return builder.parse(tokens);
    }

    /**
     * Parse a token list.
     *
     * @param tokens	tokens to parse
     *
     * @return the root of the expression tree
     */
    private ExprNode parse(List<Token> tokens) {
        // This tracks the type of the previous token, so we know when an operand is expected.
        Token.Type predecessor = null;
        final int n = tokens.size();
        int i = 0;
        while (i < n) {
            Token token = tokens.get(i);
            switch (token.getType()) {
            case OPERAND :
                if (ExprNode.EMPTY_LEAF.equals(token.getText())) {
                    // The empty operand of a prefix operator cannot follow a complete operand.
                    if (predecessor == Token.Type.OPERAND || predecessor == Token.Type.CLOSE)
                        throw new MalformedExpressionException("Prefix operator follows an operand", this.source);
                    this.treeStack.push(ExprNode.empty());
                    predecessor = Token.Type.OPERAND;
                } else if (i + 1 < n && tokens.get(i + 1).getType() == Token.Type.OPEN) {
                    // Here we have a function call.  Find the closing parenthesis.
                    int end = this.findClose(tokens, i + 1);
                    this.treeStack.push(this.buildCall(token.getText(), tokens.subList(i + 2, end)));
                    i = end;
                    predecessor = Token.Type.CLOSE;
                } else {
                    if (predecessor == Token.Type.OPERAND) {
                        if (this.treeStack.peek().isEmptyLeaf())
                            throw new MalformedExpressionException("Operand \"" + token.getText()
                                    + "\" follows an empty operand", this.source);
                        this.treeStack.peek().appendWord(token.getText());
                    } else
                        this.treeStack.push(new ExprNode(token.getText()));
                    predecessor = Token.Type.OPERAND;
                }
                break;
            case OPERATOR :
                if (this.grammar.arity(token.getText()) == 1 && ! isEmptyOperand(tokens, i - 1))
                    throw new MalformedExpressionException("Operator \"" + token.getText()
                            + "\" must start an operand", this.source);
                this.pushOperator(token.getText(), predecessor);
                predecessor = Token.Type.OPERATOR;
                break;
            case OPEN :
                this.opStack.push(SCOPE);
                predecessor = Token.Type.OPEN;
                break;
            case CLOSE :
                while (! this.opStack.isEmpty() && ! SCOPE.equals(this.opStack.peek()))
                    this.reduce();
                if (this.opStack.isEmpty())
                    throw new MalformedExpressionException("Unmatched closing parenthesis", this.source);
                this.opStack.pop();
                predecessor = Token.Type.CLOSE;
                break;
            case SEPARATOR :
                throw new MalformedExpressionException("Argument separator outside of a function call", this.source);
            }
            i++;
        }
        // Flush the remaining operators.
        while (! this.opStack.isEmpty()) {
            if (SCOPE.equals(this.opStack.peek()))
                throw new MalformedExpressionException("Unmatched opening parenthesis", this.source);
            this.reduce();
        }
        ExprNode retVal;
        if (this.treeStack.isEmpty())
            retVal = ExprNode.empty();
        else if (this.treeStack.size() > 1)
            throw new MalformedExpressionException("Missing operator", this.source);
        else
            retVal = this.treeStack.pop();
        return retVal;
    }

    /**
     * @return TRUE if the token at the specified position is the empty operand of a prefix operator
     *
     * @param tokens	token list
     * @param pos		position to check (may be negative)
     */
    private static boolean isEmptyOperand(List<Token> tokens, int pos) {
        boolean retVal = false;
        if (pos >= 0) {
            Token token = tokens.get(pos);
            retVal = (token.getType() == Token.Type.OPERAND && ExprNode.EMPTY_LEAF.equals(token.getText()));
        }
        return retVal;
    }

    /**
     * Process an incoming operator against the operator stack.
     *
     * @param op			canonical operator symbol
     * @param predecessor	type of the previous token (NULL at the start)
     */
    private void pushOperator(String op, Token.Type predecessor) {
        boolean operandExpected = (predecessor == null || predecessor == Token.Type.OPEN
                || predecessor == Token.Type.OPERATOR);
        if (operandExpected && this.grammar.isPrefix(op)) {
            // A sign in operand position binds to the operand that follows it.
            this.treeStack.push(ExprNode.empty());
            this.opStack.push(op);
        } else if (this.opStack.isEmpty() || SCOPE.equals(this.opStack.peek())) {
            this.opStack.push(op);
        } else if (this.grammar.associativity(op) == Grammar.Associativity.RIGHT) {
            this.opStack.push(op);
        } else {
            while (! this.opStack.isEmpty() && ! SCOPE.equals(this.opStack.peek())
                    && this.grammar.hasPrecedence(this.opStack.peek(), op))
                this.reduce();
            this.opStack.push(op);
        }
    }

    /**
     * Pop an operator and combine the two most recent subtrees under it.
     */
    private void reduce() {
        String op = this.opStack.pop();
        if (this.treeStack.size() < 2)
            throw new MalformedExpressionException("Missing operand for \"" + op + "\"", this.source);
        ExprNode right = this.treeStack.pop();
        ExprNode left = this.treeStack.pop();
        this.treeStack.push(new ExprNode(op, left, right, ExprNode.INFIX));
    }

    /**
     * @return the index of the parenthesis that closes the one at the specified position
     *
     * @param tokens	token list
     * @param open		index of the opening parenthesis
     */
    private int findClose(List<Token> tokens, int open) {
        int depth = 0;
        int retVal = -1;
        final int n = tokens.size();
        for (int i = open; i < n && retVal < 0; i++) {
            Token.Type type = tokens.get(i).getType();
            if (type == Token.Type.OPEN)
                depth++;
            else if (type == Token.Type.CLOSE) {
                depth--;
                if (depth == 0)
                    retVal = i;
            }
        }
        if (retVal < 0)
            throw new MalformedExpressionException("Unterminated argument list", this.source);
        return retVal;
    }

    /**
     * Build the node for a function call.
     *
     * @param name		function name
     * @param body		tokens between the parentheses
     *
     * @return a function-call node tagged with its argument count
     */
    private ExprNode buildCall(String name, List<Token> body) {
        // Split the body on the top-level separators.
        List<List<Token>> args = new ArrayList<List<Token>>();
        int depth = 0;
        int start = 0;
        final int n = body.size();
        for (int i = 0; i < n; i++) {
            Token.Type type = body.get(i).getType();
            if (type == Token.Type.OPEN)
                depth++;
            else if (type == Token.Type.CLOSE)
                depth--;
            else if (type == Token.Type.SEPARATOR && depth == 0) {
                args.add(body.subList(start, i));
                start = i + 1;
            }
        }
        args.add(body.subList(start, n));
        ExprNode retVal;
        final int nArgs = args.size();
        if (nArgs == 1)
            retVal = new ExprNode(name, ExprNode.empty(), this.subtree(args.get(0)), ExprNode.UNARY_FUNCTION);
        else if (nArgs == 2)
            retVal = new ExprNode(name, this.subtree(args.get(0)), this.subtree(args.get(1)), ExprNode.BINARY_FUNCTION);
        else
            retVal = new ExprNode(name, this.subtree(args.get(0)), this.chain(args, 1), nArgs);
        return retVal;
    }

    /**
     * @return a right-folded chain of argument subtrees
     *
     * @param args		argument token lists
     * @param start		index of the first argument to chain
     */
    private ExprNode chain(List<List<Token>> args, int start) {
        ExprNode retVal;
        if (start == args.size() - 1)
            retVal = this.subtree(args.get(start));
        else
            retVal = new ExprNode(ExprNode.ARG_CHAIN, this.subtree(args.get(start)), this.chain(args, start + 1),
                    ExprNode.INFIX);
        return retVal;
    }

    /**
     * @return the tree for a sub-expression
     *
     * @param tokens	tokens of the sub-expression
     */
    private ExprNode subtree(List<Token> tokens) {
        return buildTree(tokens, this.grammar, this.source);
    }

}
