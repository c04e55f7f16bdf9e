package nl.bytesoflife.deltasdf.tools;

import nl.bytesoflife.deltasdf.Sdf;
import nl.bytesoflife.deltasdf.model.SdfDocument;

import java.nio.file.Path;

/**
 * Converts SDF files to JSON. {@code top.max.sdf} is written as {@code top.json}.
 */
public class SdfToJson extends SdfFileTool {

    @Override
    protected String convert(SdfDocument document, Integer indent) {
        return Sdf.toJson(document, indent != null ? indent : 0);
    }

    @Override
    protected String outputName(Path source) {
        String name = source.getFileName().toString();
        // strip every extension, keeping a leading dot of hidden files
        int dot = name.indexOf('.', 1);
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return name + ".json";
    }

    @Override
    protected String usage() {
        return "SdfToJson --dir <path> [--indent N] [--force] file...";
    }

    public static void main(String[] args) {
        System.exit(new SdfToJson().run(args));
    }
}
