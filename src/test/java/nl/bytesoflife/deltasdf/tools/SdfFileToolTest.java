package nl.bytesoflife.deltasdf.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SdfFileToolTest {

    private static final String SOURCE = "testdata/sdf/retain_cond.sdf";

    @TempDir
    Path out;

    @Test
    void reformatWritesCanonicalText() throws IOException {
        int code = new SdfReformat().run(new String[]{"--dir", out.toString(), SOURCE});
        assertEquals(SdfFileTool.EXIT_OK, code);

        String text = Files.readString(out.resolve("retain_cond.sdf"));
        assertTrue(text.startsWith("(DELAYFILE\n  (SDFVERSION \"3.0\")"));
        assertTrue(text.endsWith("\n)"));
    }

    @Test
    void reformatHonoursIndent() throws IOException {
        int code = new SdfReformat().run(new String[]{"--indent", "4", "--dir", out.toString(), SOURCE});
        assertEquals(SdfFileTool.EXIT_OK, code);
        assertTrue(Files.readString(out.resolve("retain_cond.sdf")).contains("\n    (SDFVERSION \"3.0\")"));
    }

    @Test
    void refusesToOverwriteWithoutForce() throws IOException {
        Path existing = out.resolve("retain_cond.sdf");
        Files.writeString(existing, "keep");

        assertEquals(SdfFileTool.EXIT_FAILED, new SdfReformat().run(new String[]{"--dir", out.toString(), SOURCE}));
        assertEquals("keep", Files.readString(existing));

        assertEquals(SdfFileTool.EXIT_OK,
            new SdfReformat().run(new String[]{"--dir", out.toString(), "--force", SOURCE}));
        assertNotEquals("keep", Files.readString(existing));
    }

    @Test
    void missingInputFails() {
        int code = new SdfReformat().run(new String[]{"--dir", out.toString(), "testdata/sdf/nope.sdf", SOURCE});
        assertEquals(SdfFileTool.EXIT_FAILED, code);
        assertTrue(Files.exists(out.resolve("retain_cond.sdf")));
    }

    @Test
    void invalidInputFails() throws IOException {
        Path broken = out.resolve("broken.sdf");
        Files.writeString(broken, "(DELAYFILE (CELL))");
        Path target = Files.createDirectory(out.resolve("target"));
        assertEquals(SdfFileTool.EXIT_FAILED,
            new SdfReformat().run(new String[]{"--dir", target.toString(), broken.toString()}));
        assertFalse(Files.exists(target.resolve("broken.sdf")));
    }

    @Test
    void usageErrors() {
        assertEquals(SdfFileTool.EXIT_USAGE, new SdfReformat().run(new String[]{SOURCE}));
        assertEquals(SdfFileTool.EXIT_USAGE, new SdfReformat().run(new String[]{"--dir", out.toString()}));
        assertEquals(SdfFileTool.EXIT_USAGE,
            new SdfReformat().run(new String[]{"--dir", out.toString(), "--indent", "-2", SOURCE}));
        assertEquals(SdfFileTool.EXIT_USAGE,
            new SdfReformat().run(new String[]{"--dir", out.toString(), "--verbose", SOURCE}));
        assertEquals(SdfFileTool.EXIT_USAGE, new SdfReformat().run(new String[]{"--dir"}));
    }

    @Test
    void missingOutputDirectoryFails() {
        assertEquals(SdfFileTool.EXIT_FAILED,
            new SdfReformat().run(new String[]{"--dir", out.resolve("absent").toString(), SOURCE}));
    }

    @Test
    void parseArguments() {
        SdfToJson tool = new SdfToJson();
        tool.parseArguments(new String[]{"a.sdf", "--force", "--dir", "x", "--indent", "3", "b.sdf"});
        assertEquals(Path.of("x"), tool.getOutputDir());
        assertEquals(3, tool.getIndent());
        assertTrue(tool.isForce());
        assertEquals(2, tool.getFiles().size());
    }

    @Test
    void jsonOutputNameDropsAllExtensions() {
        SdfToJson tool = new SdfToJson();
        assertEquals("top.json", tool.outputName(Path.of("dir/top.max.sdf")));
        assertEquals("top.json", tool.outputName(Path.of("top.sdf")));
        assertEquals("top.json", tool.outputName(Path.of("top")));
        assertEquals(".hidden.json", tool.outputName(Path.of(".hidden.sdf")));
    }

    @Test
    void toJsonWritesFile() throws IOException {
        assertEquals(SdfFileTool.EXIT_OK, new SdfToJson().run(new String[]{"--dir", out.toString(), SOURCE}));
        String json = Files.readString(out.resolve("retain_cond.json"));
        assertTrue(json.startsWith("{\"header\":{\"sdfversion\":\"3.0\""));
    }
}
