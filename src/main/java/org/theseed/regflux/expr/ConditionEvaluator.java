/**
 *
 */
package org.theseed.regflux.expr;

import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

/**
 * This class evaluates relational conditions such as "x > 5" or "4.2 <= y" against a map of
 * variable values.  Each side of the comparison is either a numeric literal or a variable name;
 * a variable missing from the map has the value 0.
 *
 */
public class ConditionEvaluator {

    /**
     * Enumeration of the comparison operators, in the order they are tried.  Two-character
     * operators come first so that ">=" is never split as ">".
     */
    public static enum Relop {
        GE(">=") {
            @Override
            public boolean compare(double x, double y) {
                return x >= y;
            }
        }, LE("<=") {
            @Override
            public boolean compare(double x, double y) {
                return x <= y;
            }
        }, GE_ALT("=>") {
            @Override
            public boolean compare(double x, double y) {
                return x >= y;
            }
        }, LE_ALT("=<") {
            @Override
            public boolean compare(double x, double y) {
                return x <= y;
            }
        }, EQ("==") {
            @Override
            public boolean compare(double x, double y) {
                return x == y;
            }
        }, NE("!=") {
            @Override
            public boolean compare(double x, double y) {
                return x != y;
            }
        }, GT(">") {
            @Override
            public boolean compare(double x, double y) {
                return x > y;
            }
        }, LT("<") {
            @Override
            public boolean compare(double x, double y) {
                return x < y;
            }
        }, EQ_ALT("=") {
            @Override
            public boolean compare(double x, double y) {
                return x == y;
            }
        };

        /** text of the operator */
        private final String symbol;

        private Relop(String symbol) {
            this.symbol = symbol;
        }

        /**
         * @return the result of comparing two values
         *
         * @param x		left value
         * @param y		right value
         */
        public abstract boolean compare(double x, double y);

        /**
         * @return the operator text
         */
        public String getSymbol() {
            return this.symbol;
        }

    }

    /** operators in the order they are tried */
    private static final List<Relop> SEARCH_ORDER = List.of(Relop.values());

    private ConditionEvaluator() { }

    /**
     * Evaluate a condition.
     *
     * @param condition		condition text
     * @param variables		map of variable names to values
     *
     * @return the result of the comparison
     *
     * @throws InvalidConditionException if the condition has no operator or is missing a side
     */
    public static boolean evaluate(String condition, Map<String, Double> variables) {
        String text = condition.trim();
        Relop found = null;
        int pos = -1;
        for (int i = 0; i < SEARCH_ORDER.size() && found == null; i++) {
            Relop relop = SEARCH_ORDER.get(i);
            pos = text.indexOf(relop.getSymbol());
            if (pos >= 0)
                found = relop;
        }
        if (found == null)
            throw new InvalidConditionException(condition);
        String leftText = text.substring(0, pos).trim();
        String rightText = text.substring(pos + found.getSymbol().length()).trim();
        if (StringUtils.isBlank(leftText) || StringUtils.isBlank(rightText))
            throw new InvalidConditionException(condition);
        double x = resolve(leftText, variables);
        double y = resolve(rightText, variables);
        return found.compare(x, y);
    }

    /**
     * @return the value of one side of a comparison
     *
     * @param side			text of the side (a number or a variable name)
     * @param variables		map of variable names to values
     */
    private static double resolve(String side, Map<String, Double> variables) {
        double retVal;
        if (ExprNode.isNumber(side))
            retVal = Double.parseDouble(side);
        else {
            Double value = variables.get(side);
            retVal = (value == null ? 0.0 : value);
        }
        return retVal;
    }

}
