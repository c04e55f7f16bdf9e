package nl.bytesoflife.deltasdf;

import nl.bytesoflife.deltasdf.lexer.Token;

/**
 * Raised by the parser when the token stream does not match the SDF grammar.
 */
public class SyntaxException extends SdfException {

    private final Token token;

    public SyntaxException(String message, Token token) {
        super(message + ", found " + token.describe(), token.offset(), token.line(), token.column());
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
