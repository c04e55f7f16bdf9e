package nl.bytesoflife.deltasdf;

/**
 * Base class for all failures raised while reading SDF text.
 * Position fields are -1 when no source position is known.
 */
public class SdfException extends RuntimeException {

    private final int offset;
    private final int line;
    private final int column;

    public SdfException(String message) {
        this(message, -1, -1, -1);
    }

    public SdfException(String message, int offset, int line, int column) {
        super(line > 0 ? message + " (line " + line + ", column " + column + ")" : message);
        this.offset = offset;
        this.line = line;
        this.column = column;
    }

    public int getOffset() {
        return offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
