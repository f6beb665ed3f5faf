/**
 *
 */
package org.theseed.regflux.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A grammar describes an operator set for the rule language:  the operator symbols, their
 * precedence, associativity and arity, the raw spellings that must be split out of words
 * during tokenization, and the alias table that maps textual synonyms to canonical symbol
 * sequences.
 *
 * Grammars are immutable capability sets passed to the tokenizer and the tree builder.
 * New ones are assembled with a {@link Builder}.  Two standard grammars are provided:
 * {@link #BOOLEAN} for gene and regulatory rules and {@link #ARITHMETIC} for rate laws.
 *
 */
public final class Grammar {

    // FIELDS
    /** name of this grammar (for messages) */
    private final String name;
    /** map of canonical operator symbols to descriptors */
    private final Map<String, OpSpec> operators;
    /** map of lower-case aliases to canonical token sequences */
    private final Map<String, List<String>> aliases;
    /** raw operator spellings recognized inside words, longest first */
    private final List<String> symbols;
    /** binary operators that may also be used as a prefix sign */
    private final Set<String> prefixes;

    /** canonical AND symbol */
    public static final String AND = "&";
    /** canonical OR symbol */
    public static final String OR = "|";
    /** canonical NOT symbol */
    public static final String NOT = "~";
    /** canonical power symbol */
    public static final String POWER = "^";

    /**
     * Enumeration of operator associativity.
     */
    public static enum Associativity {
        LEFT, RIGHT;
    }

    /**
     * Descriptor for a single operator.
     */
    private static class OpSpec {

        /** binding strength (higher binds tighter) */
        private final int precedence;
        /** associativity */
        private final Associativity associativity;
        /** number of real operands (1 or 2) */
        private final int arity;

        private OpSpec(int precedence, Associativity associativity, int arity) {
            this.precedence = precedence;
            this.associativity = associativity;
            this.arity = arity;
        }

    }

    /** Boolean grammar for GPRs and regulatory events (AND and OR bind equally, left to right) */
    public static final Grammar BOOLEAN = new Builder("Boolean")
            .operator(OR, 0, Associativity.LEFT, 2)
            .operator(AND, 0, Associativity.LEFT, 2)
            .operator(NOT, 1, Associativity.RIGHT, 1)
            .symbols("&&", "||", AND, OR, NOT)
            .alias("and", AND).alias("&&", AND)
            .alias("or", OR).alias("||", OR)
            .alias("not", ExprNode.EMPTY_LEAF, NOT).alias(NOT, ExprNode.EMPTY_LEAF, NOT)
            .build();

    /** arithmetic grammar for rate laws */
    public static final Grammar ARITHMETIC = new Builder("Arithmetic")
            .operator("+", 0, Associativity.LEFT, 2)
            .operator("-", 0, Associativity.LEFT, 2)
            .operator("*", 1, Associativity.LEFT, 2)
            .operator("/", 1, Associativity.LEFT, 2)
            .operator(POWER, 2, Associativity.RIGHT, 2)
            .symbols("**", "+", "-", "*", "/", POWER)
            .alias("**", POWER)
            .prefix("+").prefix("-")
            .build();

    /**
     * This class is used to assemble a grammar.
     */
    public static class Builder {

        /** name of the grammar */
        private String name;
        /** operator descriptors */
        private Map<String, OpSpec> operators;
        /** alias table */
        private Map<String, List<String>> aliases;
        /** raw symbols */
        private Set<String> symbols;
        /** prefix-capable operators */
        private Set<String> prefixes;

        /**
         * Start building a grammar.
         *
         * @param name		name of the new grammar
         */
        public Builder(String name) {
            this.name = name;
            this.operators = new HashMap<String, OpSpec>();
            this.aliases = new HashMap<String, List<String>>();
            this.symbols = new HashSet<String>();
            this.prefixes = new HashSet<String>();
        }

        /**
         * Declare an operator.
         *
         * @param symbol			canonical symbol
         * @param precedence		binding strength (higher binds tighter)
         * @param associativity		associativity of the operator
         * @param arity				number of real operands (1 for prefix operators, else 2)
         *
         * @return this object, for chaining
         */
        public Builder operator(String symbol, int precedence, Associativity associativity, int arity) {
            if (arity < 1 || arity > 2)
                throw new IllegalArgumentException("Invalid arity " + arity + " for operator \"" + symbol + "\".");
            this.operators.put(symbol, new OpSpec(precedence, associativity, arity));
            return this;
        }

        /**
         * Declare raw spellings that must be split out of words during tokenization.
         *
         * @param spellings		operator spellings
         *
         * @return this object, for chaining
         */
        public Builder symbols(String... spellings) {
            for (String spelling : spellings)
                this.symbols.add(spelling);
            return this;
        }

        /**
         * Declare an alias.
         *
         * @param word			alias text (matched case-insensitively)
         * @param canonical		canonical token sequence that replaces it
         *
         * @return this object, for chaining
         */
        public Builder alias(String word, String... canonical) {
            this.aliases.put(word.toLowerCase(), List.of(canonical));
            return this;
        }

        /**
         * Allow a binary operator to be used as a prefix sign.  The tree builder will
         * supply an empty left operand for it.
         *
         * @param symbol		canonical symbol of the operator
         *
         * @return this object, for chaining
         */
        public Builder prefix(String symbol) {
            this.prefixes.add(symbol);
            return this;
        }

        /**
         * @return the finished grammar
         */
        public Grammar build() {
            return new Grammar(this);
        }

    }

    /**
     * Construct a grammar from a builder.
     *
     * @param builder	source builder
     */
    private Grammar(Builder builder) {
        this.name = builder.name;
        this.operators = Map.copyOf(builder.operators);
        this.aliases = Map.copyOf(builder.aliases);
        this.prefixes = Set.copyOf(builder.prefixes);
        // Sort the symbols so the longest spelling is tried first.
        List<String> symbolList = new ArrayList<String>(builder.symbols);
        symbolList.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        this.symbols = Collections.unmodifiableList(symbolList);
    }

    /**
     * @return the descriptor for an operator
     *
     * @param op	canonical symbol of the operator
     */
    private OpSpec getSpec(String op) {
        OpSpec retVal = this.operators.get(op);
        if (retVal == null)
            throw new IllegalArgumentException("\"" + op + "\" is not an operator of the " + this.name + " grammar.");
        return retVal;
    }

    /**
     * @return TRUE if the specified symbol is an operator of this grammar
     *
     * @param sym	symbol to check
     */
    public boolean isOperator(String sym) {
        return this.operators.containsKey(sym);
    }

    /**
     * @return the precedence of an operator (higher binds tighter)
     *
     * @param op	canonical symbol of the operator
     */
    public int precedence(String op) {
        return this.getSpec(op).precedence;
    }

    /**
     * @return TRUE if the first operator binds at least as tightly as the second
     *
     * @param op1	first operator
     * @param op2	second operator
     */
    public boolean hasPrecedence(String op1, String op2) {
        return this.precedence(op1) >= this.precedence(op2);
    }

    /**
     * @return the associativity of an operator
     *
     * @param op	canonical symbol of the operator
     */
    public Associativity associativity(String op) {
        return this.getSpec(op).associativity;
    }

    /**
     * @return the number of real operands taken by an operator
     *
     * @param op	canonical symbol of the operator
     */
    public int arity(String op) {
        return this.getSpec(op).arity;
    }

    /**
     * @return TRUE if the operator is a binary operator that may also act as a prefix sign
     *
     * @param op	canonical symbol of the operator
     */
    public boolean isPrefix(String op) {
        return this.prefixes.contains(op);
    }

    /**
     * @return the alias table (lower-case synonym to canonical token sequence)
     */
    public Map<String, List<String>> aliasTable() {
        return this.aliases;
    }

    /**
     * @return the raw operator spellings recognized inside words, longest first
     */
    public List<String> symbols() {
        return this.symbols;
    }

    /**
     * @return the canonical token sequence for a raw word
     *
     * @param word	raw word from the expression
     */
    public List<String> substitute(String word) {
        List<String> retVal = this.aliases.get(word.toLowerCase());
        if (retVal == null)
            retVal = List.of(word);
        return retVal;
    }

    /**
     * @return the longest operator spelling found at the specified position, or NULL if none
     *
     * @param text		text being scanned
     * @param pos		position in the text
     */
    public String matchSymbol(String text, int pos) {
        String retVal = null;
        final int n = this.symbols.size();
        for (int i = 0; i < n && retVal == null; i++) {
            String symbol = this.symbols.get(i);
            if (text.startsWith(symbol, pos))
                retVal = symbol;
        }
        return retVal;
    }

    /**
     * @return the name of this grammar
     */
    public String getName() {
        return this.name;
    }

    @Override
    public String toString() {
        return this.name + " grammar";
    }

}
