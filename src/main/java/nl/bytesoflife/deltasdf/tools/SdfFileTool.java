package nl.bytesoflife.deltasdf.tools;

import nl.bytesoflife.deltasdf.Sdf;
import nl.bytesoflife.deltasdf.SdfException;
import nl.bytesoflife.deltasdf.model.SdfDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared command line handling for tools that read SDF files and write one output file
 * per input into a target directory.
 *
 * <p>Arguments: {@code --dir <path> [--indent N] [--force] file...}
 */
public abstract class SdfFileTool {

    private static final Logger log = LoggerFactory.getLogger(SdfFileTool.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    private Path outputDir;
    private Integer indent;
    private boolean force;
    private final List<Path> files = new ArrayList<>();

    /**
     * Converts a parsed document to the output text.
     *
     * @param indent the --indent value, or null when not given
     */
    protected abstract String convert(SdfDocument document, Integer indent);

    /**
     * File name of the output written for the given input.
     */
    protected abstract String outputName(Path source);

    protected abstract String usage();

    public int run(String[] args) {
        try {
            parseArguments(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            log.error("Usage: {}", usage());
            return EXIT_USAGE;
        }

        if (!Files.isDirectory(outputDir)) {
            log.error("Not a directory: {}", outputDir);
            return EXIT_FAILED;
        }

        int failures = 0;
        for (Path file : files) {
            if (!processFile(file)) {
                failures++;
            }
        }
        if (failures > 0) {
            log.warn("{} of {} file(s) failed", failures, files.size());
            return EXIT_FAILED;
        }
        return EXIT_OK;
    }

    private boolean processFile(Path file) {
        if (!Files.exists(file)) {
            log.error("Does not exist: '{}'", file);
            return false;
        }
        Path target = outputDir.resolve(outputName(file));
        if (Files.exists(target) && !force) {
            log.error("Refusing to overwrite {} (use --force)", target);
            return false;
        }
        try {
            log.info("Reading {} ...", file);
            SdfDocument document = Sdf.parse(Files.readString(file, StandardCharsets.UTF_8));
            String output = convert(document, indent);
            log.info("Writing {} ...", target);
            Files.writeString(target, output, StandardCharsets.UTF_8);
            return true;
        } catch (SdfException e) {
            log.error("Failed to parse {}: {}", file, e.getMessage());
        } catch (IOException e) {
            log.error("I/O error on {}: {}", file, e.getMessage(), e);
        }
        return false;
    }

    void parseArguments(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--dir" -> outputDir = Path.of(value(args, ++i, arg));
                case "--indent" -> {
                    String text = value(args, ++i, arg);
                    try {
                        indent = Integer.parseInt(text);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("--indent expects a number, got '" + text + "'");
                    }
                    if (indent < 0) {
                        throw new IllegalArgumentException("--indent must not be negative");
                    }
                }
                case "--force" -> force = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    files.add(Path.of(arg));
                }
            }
        }
        if (outputDir == null) {
            throw new IllegalArgumentException("Missing required option --dir");
        }
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No input files given");
        }
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[index];
    }

    Path getOutputDir() {
        return outputDir;
    }

    Integer getIndent() {
        return indent;
    }

    boolean isForce() {
        return force;
    }

    List<Path> getFiles() {
        return files;
    }
}
