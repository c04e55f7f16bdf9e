package nl.bytesoflife.deltasdf;

/**
 * Raised by the lexer on a character sequence that does not start any token.
 */
public class LexException extends SdfException {

    public LexException(String message, int offset, int line, int column) {
        super(message, offset, line, column);
    }
}
