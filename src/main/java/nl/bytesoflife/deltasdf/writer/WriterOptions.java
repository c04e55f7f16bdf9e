package nl.bytesoflife.deltasdf.writer;

/**
 * Formatting options for {@link SdfWriter}.
 *
 * @param indent            text written once per nesting level
 * @param uppercaseCellType write CELLTYPE names in upper case
 */
public record WriterOptions(String indent, boolean uppercaseCellType) {

    public static final String DEFAULT_INDENT = "  ";

    public WriterOptions {
        if (indent == null || !indent.isBlank()) {
            throw new IllegalArgumentException("Indent must consist of whitespace only");
        }
    }

    public static WriterOptions defaults() {
        return new WriterOptions(DEFAULT_INDENT, false);
    }

    public static WriterOptions indentWidth(int spaces) {
        if (spaces < 0) {
            throw new IllegalArgumentException("Indent width must not be negative: " + spaces);
        }
        return new WriterOptions(" ".repeat(spaces), false);
    }

    public WriterOptions withIndent(String indent) {
        return new WriterOptions(indent, uppercaseCellType);
    }

    public WriterOptions withUppercaseCellType(boolean uppercase) {
        return new WriterOptions(indent, uppercase);
    }
}
