/**
 *
 */
package org.theseed.regflux.expr;

/**
 * A token is an atomic lexical unit of a rule string:  an operator symbol, an operand, or
 * one of the grouping and separator marks.  Tokens are simple values.
 *
 */
public final class Token {

    // FIELDS
    /** type of token */
    private final Type type;
    /** text of the token */
    private final String text;

    /** opening parenthesis token */
    public static final Token OPEN = new Token(Type.OPEN, "(");
    /** closing parenthesis token */
    public static final Token CLOSE = new Token(Type.CLOSE, ")");
    /** argument separator token */
    public static final Token SEPARATOR = new Token(Type.SEPARATOR, ",");

    /**
     * Enumeration of token types.
     */
    public static enum Type {
        OPERAND, OPERATOR, OPEN, CLOSE, SEPARATOR;
    }

    /**
     * Construct a token.
     *
     * @param type		token type
     * @param text		token text
     */
    private Token(Type type, String text) {
        this.type = type;
        this.text = text;
    }

    /**
     * @return an operand token
     *
     * @param text		text of the operand
     */
    public static Token operand(String text) {
        return new Token(Type.OPERAND, text);
    }

    /**
     * @return an operator token
     *
     * @param symbol	canonical operator symbol
     */
    public static Token operator(String symbol) {
        return new Token(Type.OPERATOR, symbol);
    }

    /**
     * @return the token type
     */
    public Type getType() {
        return this.type;
    }

    /**
     * @return the token text
     */
    public String getText() {
        return this.text;
    }

    /**
     * @return TRUE if this is an operand token
     */
    public boolean isOperand() {
        return this.type == Type.OPERAND;
    }

    /**
     * @return TRUE if this is an operator token
     */
    public boolean isOperator() {
        return this.type == Type.OPERATOR;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.type.hashCode();
        result = prime * result + this.text.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Token other = (Token) obj;
        return this.type == other.type && this.text.equals(other.text);
    }

    @Override
    public String toString() {
        return this.text;
    }

}
