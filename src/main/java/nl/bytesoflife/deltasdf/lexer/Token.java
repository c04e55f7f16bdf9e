package nl.bytesoflife.deltasdf.lexer;

/**
 * A lexical token. {@code keyword} is set only for {@link TokenType#KEYWORD} tokens.
 */
public record Token(TokenType type, String text, Keyword keyword, int offset, int line, int column) {

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean is(Keyword expected) {
        return type == TokenType.KEYWORD && keyword == expected;
    }

    public boolean isOperator(String op) {
        return type == TokenType.OPERATOR && text.equals(op);
    }

    /**
     * Short human-readable form used in error messages.
     */
    public String describe() {
        if (type == TokenType.EOF) {
            return "end of input";
        }
        return "'" + text + "'";
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
