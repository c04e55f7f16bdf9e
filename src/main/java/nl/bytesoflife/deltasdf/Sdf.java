package nl.bytesoflife.deltasdf;

import nl.bytesoflife.deltasdf.model.SdfDocument;
import nl.bytesoflife.deltasdf.parser.DocumentBuilder;
import nl.bytesoflife.deltasdf.parser.SdfParser;
import nl.bytesoflife.deltasdf.writer.SdfJsonWriter;
import nl.bytesoflife.deltasdf.writer.SdfWriter;
import nl.bytesoflife.deltasdf.writer.WriterOptions;

/**
 * Entry points for reading and writing SDF text. Every call builds its own lexer, parser
 * and builder, so calls from different threads do not interfere.
 */
public final class Sdf {

    private Sdf() {
    }

    /**
     * Parses SDF text into a document.
     *
     * @throws LexException      on a character sequence that is not an SDF token
     * @throws SyntaxException   when the tokens do not form a valid DELAYFILE
     * @throws SemanticException when the parsed constructs cannot be combined into a document
     */
    public static SdfDocument parse(String text) {
        return new DocumentBuilder().build(new SdfParser(text).parse());
    }

    public static String emit(SdfDocument document) {
        return emit(document, WriterOptions.defaults());
    }

    public static String emit(SdfDocument document, WriterOptions options) {
        return new SdfWriter(options).write(document);
    }

    public static String toJson(SdfDocument document, int indent) {
        return new SdfJsonWriter(indent).write(document);
    }
}
