package nl.bytesoflife.deltasdf.writer;

import nl.bytesoflife.deltasdf.Sdf;
import nl.bytesoflife.deltasdf.model.DelayMode;
import nl.bytesoflife.deltasdf.model.Edge;
import nl.bytesoflife.deltasdf.model.Entry;
import nl.bytesoflife.deltasdf.model.EntryKey;
import nl.bytesoflife.deltasdf.model.EntryKind;
import nl.bytesoflife.deltasdf.model.SdfDocument;
import nl.bytesoflife.deltasdf.model.SdfHeader;
import nl.bytesoflife.deltasdf.model.Timescale;
import nl.bytesoflife.deltasdf.model.Triple;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SdfWriterTest {

    private final SdfWriter writer = new SdfWriter();

    private static Entry check(EntryKind kind, String to, String from) {
        return Entry.builder(kind)
            .toPin(to)
            .fromPin(from, Edge.POSEDGE)
            .delayPath("nominal", Triple.of(new BigDecimal("0.5")))
            .build();
    }

    private static SdfDocument single(String cellType, String instance, Entry... entries) {
        Map<EntryKey, Entry> map = new LinkedHashMap<>();
        for (Entry entry : entries) {
            map.put(new EntryKey(entry.keyBase(), 0), entry);
        }
        return new SdfDocument(SdfHeader.builder().sdfVersion("3.0").build(),
            Map.of(cellType, Map.of(instance, map)));
    }

    @Test
    void writeHeaderOnly() {
        SdfDocument doc = Sdf.parse("(DELAYFILE (SDFVERSION \"3.0\"))");
        assertEquals("(DELAYFILE\n  (SDFVERSION \"3.0\")\n)", writer.write(doc));
    }

    @Test
    void writeHeaderItemsInCanonicalOrder() {
        SdfHeader header = SdfHeader.builder()
            .timescale(Timescale.parse("100ps"))
            .design("top \"v2\"")
            .sdfVersion("3.0")
            .divider('/')
            .temperature(Triple.of("-40", "25", "125"))
            .build();
        String expected = "(DELAYFILE\n"
            + "  (SDFVERSION \"3.0\")\n"
            + "  (DESIGN \"top \\\"v2\\\"\")\n"
            + "  (DIVIDER /)\n"
            + "  (TEMPERATURE -40:25:125)\n"
            + "  (TIMESCALE 100 ps)\n"
            + ")";
        assertEquals(expected, writer.write(new SdfDocument(header, Map.of())));
    }

    @Test
    void formatTriples() {
        assertEquals("()", SdfWriter.formatValue(Triple.empty()));
        assertEquals("(1:2:3)", SdfWriter.formatValue(Triple.of("1", "2", "3")));
        assertEquals("(1::3)", SdfWriter.formatValue(Triple.of("1", null, "3")));
        assertEquals("(:0.1:)", SdfWriter.formatValue(Triple.of(null, "0.1", null)));
        assertEquals("(2:2:2)", SdfWriter.formatValue(Triple.of(new BigDecimal("2"))));
        assertEquals("1000:1000:1000", SdfWriter.formatTriple(Triple.of(new BigDecimal("1000"))));
    }

    @Test
    void writeRetainAndCondFile() throws IOException {
        SdfDocument doc = Sdf.parse(Files.readString(Path.of("testdata/sdf/retain_cond.sdf")));
        String expected = """
                (DELAYFILE
                  (SDFVERSION "3.0")
                  (TIMESCALE 100 ps)
                  (CELL
                    (CELLTYPE "somecell")
                    (INSTANCE someinst)
                    (DELAY
                      (ABSOLUTE
                        (COND en == 1'b1 (IOPATH d[0] b/c/d (RETAIN (0.3:0.3:0.3)) (0.4:0.4:0.4)))
                        (IOPATH mck b/c/clk (RETAIN (1:1:1)) (2:2:2))
                      )
                    )
                  )
                )""";
        assertEquals(expected, writer.write(doc));
    }

    @Test
    void outputDoesNotDependOnInsertionOrder() {
        Entry a = Entry.builder(EntryKind.PORT).delayMode(DelayMode.ABSOLUTE)
            .fromPin("a").toPin("a").delayPath("nominal", Triple.of(BigDecimal.ONE)).build();
        Entry b = Entry.builder(EntryKind.PORT).delayMode(DelayMode.ABSOLUTE)
            .fromPin("b").toPin("b").delayPath("nominal", Triple.of(BigDecimal.TEN)).build();

        Map<EntryKey, Entry> forward = new LinkedHashMap<>();
        forward.put(EntryKey.of(a.keyBase()), a);
        forward.put(EntryKey.of(b.keyBase()), b);
        Map<EntryKey, Entry> backward = new LinkedHashMap<>();
        backward.put(EntryKey.of(b.keyBase()), b);
        backward.put(EntryKey.of(a.keyBase()), a);

        Map<String, Map<EntryKey, Entry>> instancesForward = new LinkedHashMap<>();
        instancesForward.put("u2", forward);
        instancesForward.put("u1", backward);
        Map<String, Map<EntryKey, Entry>> instancesBackward = new LinkedHashMap<>();
        instancesBackward.put("u1", forward);
        instancesBackward.put("u2", backward);

        String first = writer.write(new SdfDocument(SdfHeader.empty(), Map.of("BUF", instancesForward)));
        String second = writer.write(new SdfDocument(SdfHeader.empty(), Map.of("BUF", instancesBackward)));
        assertEquals(first, second);
        assertTrue(first.indexOf("(INSTANCE u1)") < first.indexOf("(INSTANCE u2)"));
        assertTrue(first.indexOf("(PORT a ") < first.indexOf("(PORT b "));
    }

    @Test
    void formatTimingChecks() {
        assertEquals("(SETUP d (posedge clk) (0.5:0.5:0.5))",
            writer.formatCheck(check(EntryKind.SETUP, "d", "clk")));

        Entry width = Entry.builder(EntryKind.WIDTH)
            .fromPin("clk", Edge.NEGEDGE).toPin("clk", Edge.NEGEDGE)
            .cond("en")
            .delayPath("nominal", Triple.of("1", "2", "3"))
            .build();
        assertEquals("(WIDTH (COND en (negedge clk)) (1:2:3))", writer.formatCheck(width));

        Entry setuphold = Entry.builder(EntryKind.SETUPHOLD)
            .toPin("d").fromPin("clk", Edge.POSEDGE)
            .delayPath("hold", Triple.of("-1", "-1", "-1"))
            .delayPath("setup", Triple.of("3", "4", "5"))
            .build();
        assertEquals("(SETUPHOLD d (posedge clk) (3:4:5) (-1:-1:-1))", writer.formatCheck(setuphold));
    }

    @Test
    void formatPathConstraint() {
        Entry constraint = Entry.builder(EntryKind.PATHCONSTRAINT)
            .toPin("y").fromPin("a", Edge.POSEDGE)
            .delayPath("rise", Triple.of("1", "2", "3"))
            .delayPath("fall", Triple.of("4", "5", "6"))
            .build();
        assertEquals("(PATHCONSTRAINT y (posedge a) (1:2:3) (4:5:6))", writer.formatPathConstraint(constraint));
    }

    @Test
    void formatConditionalIopath() {
        Entry iopath = Entry.builder(EntryKind.IOPATH)
            .delayMode(DelayMode.ABSOLUTE)
            .fromPin("A").toPin("Y")
            .cond("( S == 1'b0 ) & ~ EN")
            .delayPath("rise", Triple.of(new BigDecimal("3")))
            .delayPath("fall", Triple.of(new BigDecimal("4")))
            .build();
        assertEquals("(COND (S == 1'b0) & ~ EN (IOPATH A Y (3:3:3) (4:4:4)))", writer.formatPathDelay(iopath));
    }

    @Test
    void writeAllBlocksInOrder() {
        Entry absolute = Entry.builder(EntryKind.IOPATH).delayMode(DelayMode.ABSOLUTE)
            .fromPin("a").toPin("y").delayPath("nominal", Triple.empty()).build();
        Entry increment = Entry.builder(EntryKind.IOPATH).delayMode(DelayMode.INCREMENT)
            .fromPin("a").toPin("y").delayPath("nominal", Triple.of(BigDecimal.ONE)).build();
        String text = writer.write(single("INV", "u1", increment, check(EntryKind.HOLD, "d", "clk"), absolute));
        String expected = "(DELAYFILE\n"
            + "  (SDFVERSION \"3.0\")\n"
            + "  (CELL\n"
            + "    (CELLTYPE \"INV\")\n"
            + "    (INSTANCE u1)\n"
            + "    (DELAY\n"
            + "      (ABSOLUTE\n"
            + "        (IOPATH a y ())\n"
            + "      )\n"
            + "      (INCREMENT\n"
            + "        (IOPATH a y (1:1:1))\n"
            + "      )\n"
            + "    )\n"
            + "    (TIMINGCHECK\n"
            + "      (HOLD d (posedge clk) (0.5:0.5:0.5))\n"
            + "    )\n"
            + "  )\n"
            + ")";
        assertEquals(expected, text);
    }

    @Test
    void customIndentAndUppercaseCellType() {
        SdfDocument doc = single("inv", "", check(EntryKind.RECOVERY, "rst", "clk"));
        String text = new SdfWriter(WriterOptions.indentWidth(4).withUppercaseCellType(true)).write(doc);
        assertTrue(text.contains("\n    (CELL\n        (CELLTYPE \"INV\")\n        (INSTANCE)\n"));

        String tabs = new SdfWriter(WriterOptions.defaults().withIndent("\t")).write(doc);
        assertTrue(tabs.contains("\n\t\t\t(RECOVERY rst (posedge clk) (0.5:0.5:0.5))"));
    }

    @Test
    void indentMustBeWhitespace() {
        assertThrows(IllegalArgumentException.class, () -> WriterOptions.defaults().withIndent("--"));
        assertThrows(IllegalArgumentException.class, () -> WriterOptions.indentWidth(-1));
    }

    @Test
    void inconsistentEntryFails() {
        Entry noPins = Entry.builder(EntryKind.IOPATH).delayMode(DelayMode.ABSOLUTE)
            .delayPath("nominal", Triple.of(BigDecimal.ONE)).build();
        assertThrows(IllegalStateException.class, () -> writer.formatPathDelay(noPins));

        Entry noHold = Entry.builder(EntryKind.SETUPHOLD)
            .toPin("d").fromPin("clk")
            .delayPath("setup", Triple.of(BigDecimal.ONE))
            .build();
        assertThrows(IllegalStateException.class, () -> writer.formatCheck(noHold));
    }
}
