package nl.bytesoflife.deltasdf.tools;

import nl.bytesoflife.deltasdf.Sdf;
import nl.bytesoflife.deltasdf.model.SdfDocument;
import nl.bytesoflife.deltasdf.writer.WriterOptions;

import java.nio.file.Path;

/**
 * Reads SDF files and writes them back in canonical form, under the same file name,
 * into a target directory.
 */
public class SdfReformat extends SdfFileTool {

    @Override
    protected String convert(SdfDocument document, Integer indent) {
        WriterOptions options = indent != null ? WriterOptions.indentWidth(indent) : WriterOptions.defaults();
        return Sdf.emit(document, options);
    }

    @Override
    protected String outputName(Path source) {
        return source.getFileName().toString();
    }

    @Override
    protected String usage() {
        return "SdfReformat --dir <path> [--indent N] [--force] file...";
    }

    public static void main(String[] args) {
        System.exit(new SdfReformat().run(args));
    }
}
