/**
 *
 */
package org.theseed.regflux.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility methods for gene-protein-reaction rules.
 *
 */
public class Gprs {

    private Gprs() { }

    /**
     * Split a gene rule into its isozymes.  Each isozyme is a complex of genes joined only by
     * AND; the isozymes are the top-level alternatives joined by OR.
     *
     * @param gpr	gene rule to split
     *
     * @return the list of isozymes, rendered without parentheses (empty if the rule is blank)
     *
     * @throws MalformedExpressionException if the rule contains an operator other than AND or OR
     */
    public static List<String> isozymes(String gpr) {
        ExprNode tree = TreeBuilder.buildTree(gpr, Grammar.BOOLEAN);
        List<ExprNode> complexes = new ArrayList<ExprNode>();
        splitOr(tree, gpr, complexes);
        List<String> retVal = new ArrayList<String>(complexes.size());
        for (ExprNode complex : complexes) {
            for (String op : complex.getOperators()) {
                if (! op.equals(Grammar.AND))
                    throw new MalformedExpressionException("Isozyme contains operator \"" + op + "\"", gpr);
            }
            retVal.add(complex.toInfix("", "", " ", ", ", null));
        }
        return retVal;
    }

    /**
     * Collect the top-level OR alternatives of a subtree.
     *
     * @param node			subtree to split
     * @param gpr			original rule, for messages
     * @param complexes		output list of alternatives
     */
    private static void splitOr(ExprNode node, String gpr, List<ExprNode> complexes) {
        if (node.isLeaf()) {
            if (! node.isEmptyLeaf())
                complexes.add(node);
        } else if (node.getValue().equals(Grammar.OR)) {
            splitOr(node.getLeft(), gpr, complexes);
            splitOr(node.getRight(), gpr, complexes);
        } else if (node.getValue().equals(Grammar.AND))
            complexes.add(node);
        else
            throw new MalformedExpressionException("Unrecognized operator \"" + node.getValue() + "\" in gene rule", gpr);
    }

}
