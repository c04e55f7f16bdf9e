package nl.bytesoflife.deltasdf.writer;

import nl.bytesoflife.deltasdf.model.DelayMode;
import nl.bytesoflife.deltasdf.model.Edge;
import nl.bytesoflife.deltasdf.model.Entry;
import nl.bytesoflife.deltasdf.model.EntryFamily;
import nl.bytesoflife.deltasdf.model.EntryKey;
import nl.bytesoflife.deltasdf.model.EntryKind;
import nl.bytesoflife.deltasdf.model.HeaderItem;
import nl.bytesoflife.deltasdf.model.SdfDocument;
import nl.bytesoflife.deltasdf.model.SdfHeader;
import nl.bytesoflife.deltasdf.model.Triple;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes an {@link SdfDocument} as canonical SDF text.
 *
 * <p>Output is deterministic: header items follow {@link HeaderItem} order, cells are
 * sorted by cell type and then instance, and entries inside each block are sorted by key.
 * Blocks without entries are left out. The text has no trailing newline.
 */
public class SdfWriter {

    private final WriterOptions options;

    public SdfWriter() {
        this(WriterOptions.defaults());
    }

    public SdfWriter(WriterOptions options) {
        this.options = options;
    }

    public String write(SdfDocument document) {
        StringBuilder sb = new StringBuilder("(DELAYFILE");
        writeHeader(sb, document.getHeader());

        for (Map.Entry<String, Map<String, Map<EntryKey, Entry>>> cell : new TreeMap<>(document.getCells()).entrySet()) {
            for (Map.Entry<String, Map<EntryKey, Entry>> instance : new TreeMap<>(cell.getValue()).entrySet()) {
                writeCell(sb, cell.getKey(), instance.getKey(), new TreeMap<>(instance.getValue()));
            }
        }

        sb.append('\n').append(')');
        return sb.toString();
    }

    private void writeHeader(StringBuilder sb, SdfHeader header) {
        for (HeaderItem item : header.getItems()) {
            String value = switch (item) {
                case DIVIDER -> String.valueOf(header.getDivider());
                case VOLTAGE -> formatTriple(header.getVoltage());
                case TEMPERATURE -> formatTriple(header.getTemperature());
                case TIMESCALE -> header.getTimescale().value().toPlainString() + " " + header.getTimescale().unit();
                default -> quote(header.getText(item));
            };
            line(sb, 1, "(" + item.name() + " " + value + ")");
        }
    }

    private void writeCell(StringBuilder sb, String cellType, String instance, TreeMap<EntryKey, Entry> entries) {
        String type = options.uppercaseCellType() ? cellType.toUpperCase(Locale.ROOT) : cellType;
        line(sb, 1, "(CELL");
        line(sb, 2, "(CELLTYPE " + quote(type) + ")");
        line(sb, 2, instance.isEmpty() ? "(INSTANCE)" : "(INSTANCE " + instance + ")");

        List<Entry> absolute = new ArrayList<>();
        List<Entry> increment = new ArrayList<>();
        List<Entry> checks = new ArrayList<>();
        List<Entry> env = new ArrayList<>();
        for (Entry entry : entries.values()) {
            switch (entry.getFamily()) {
                case DELAY -> (entry.getDelayMode() == DelayMode.ABSOLUTE ? absolute : increment).add(entry);
                case TIMING_CHECK -> checks.add(entry);
                case TIMING_ENV -> env.add(entry);
            }
        }

        if (!absolute.isEmpty() || !increment.isEmpty()) {
            line(sb, 2, "(DELAY");
            writeDelayBlock(sb, "ABSOLUTE", absolute);
            writeDelayBlock(sb, "INCREMENT", increment);
            line(sb, 2, ")");
        }
        if (!checks.isEmpty()) {
            line(sb, 2, "(TIMINGCHECK");
            for (Entry entry : checks) {
                line(sb, 3, formatCheck(entry));
            }
            line(sb, 2, ")");
        }
        if (!env.isEmpty()) {
            line(sb, 2, "(TIMINGENV");
            for (Entry entry : env) {
                line(sb, 3, formatPathConstraint(entry));
            }
            line(sb, 2, ")");
        }
        line(sb, 1, ")");
    }

    private void writeDelayBlock(StringBuilder sb, String name, List<Entry> entries) {
        if (entries.isEmpty()) {
            return;
        }
        line(sb, 3, "(" + name);
        for (Entry entry : entries) {
            line(sb, 4, formatPathDelay(entry));
        }
        line(sb, 3, ")");
    }

    String formatPathDelay(Entry entry) {
        StringBuilder sb = new StringBuilder("(").append(entry.getKind().name());
        switch (entry.getKind()) {
            case IOPATH, INTERCONNECT -> {
                sb.append(' ').append(formatPort(requirePin(entry, entry.getFromPin()), entry.getFromPinEdge()));
                sb.append(' ').append(formatPort(requirePin(entry, entry.getToPin()), entry.getToPinEdge()));
            }
            case PORT -> sb.append(' ').append(formatPort(requirePin(entry, entry.getFromPin()), entry.getFromPinEdge()));
            case DEVICE -> {
                if (entry.getFromPin() != null) {
                    sb.append(' ').append(formatPort(entry.getFromPin(), entry.getFromPinEdge()));
                }
            }
            default -> throw new IllegalStateException("Not a path delay: " + entry);
        }
        if (!entry.getRetain().isEmpty()) {
            sb.append(" (RETAIN");
            for (Triple triple : entry.getRetain()) {
                sb.append(' ').append(formatValue(triple));
            }
            sb.append(')');
        }
        appendValues(sb, entry);
        sb.append(')');

        if (entry.isCond()) {
            return "(COND " + formatEquation(entry.getCondEquation()) + " " + sb + ")";
        }
        return sb.toString();
    }

    String formatCheck(Entry entry) {
        if (entry.getFamily() != EntryFamily.TIMING_CHECK) {
            throw new IllegalStateException("Not a timing check: " + entry);
        }
        String input = formatPort(requirePin(entry, entry.getFromPin()), entry.getFromPinEdge());
        if (entry.isCond()) {
            input = "(COND " + formatEquation(entry.getCondEquation()) + " " + input + ")";
        }

        StringBuilder sb = new StringBuilder("(").append(entry.getKind().name());
        if (!entry.getKind().isSinglePortCheck()) {
            sb.append(' ').append(formatPort(requirePin(entry, entry.getToPin()), entry.getToPinEdge()));
        }
        sb.append(' ').append(input);
        if (entry.getKind() == EntryKind.SETUPHOLD) {
            sb.append(' ').append(formatValue(requireSlot(entry, "setup")));
            sb.append(' ').append(formatValue(requireSlot(entry, "hold")));
        } else {
            appendValues(sb, entry);
        }
        return sb.append(')').toString();
    }

    String formatPathConstraint(Entry entry) {
        return "(PATHCONSTRAINT "
            + formatPort(requirePin(entry, entry.getToPin()), entry.getToPinEdge()) + " "
            + formatPort(requirePin(entry, entry.getFromPin()), entry.getFromPinEdge()) + " "
            + formatValue(requireSlot(entry, "rise")) + " "
            + formatValue(requireSlot(entry, "fall")) + ")";
    }

    private void appendValues(StringBuilder sb, Entry entry) {
        for (Triple triple : entry.getDelayPaths().values()) {
            sb.append(' ').append(formatValue(triple));
        }
    }

    private static String requirePin(Entry entry, String pin) {
        if (pin == null) {
            throw new IllegalStateException("Entry is missing a pin: " + entry);
        }
        return pin;
    }

    private static Triple requireSlot(Entry entry, String slot) {
        Triple triple = entry.getDelayPath(slot);
        if (triple == null) {
            throw new IllegalStateException("Entry is missing the '" + slot + "' value: " + entry);
        }
        return triple;
    }

    static String formatPort(String path, Edge edge) {
        return edge == null ? path : "(" + edge.text() + " " + path + ")";
    }

    /**
     * Delay value in parentheses: {@code ()}, {@code (1:2:3)} or {@code (1::3)}.
     */
    public static String formatValue(Triple triple) {
        return "(" + formatTriple(triple) + ")";
    }

    /**
     * Bare triple text. Absent slots are left blank; the empty triple is the empty string.
     */
    public static String formatTriple(Triple triple) {
        if (triple.isEmpty()) {
            return "";
        }
        return number(triple.min()) + ":" + number(triple.avg()) + ":" + number(triple.max());
    }

    /**
     * Token-joined equation with the spaces just inside parentheses removed.
     */
    static String formatEquation(String equation) {
        return equation.replace("( ", "(").replace(" )", ")");
    }

    private static String number(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }

    private static String quote(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }

    private void line(StringBuilder sb, int depth, String text) {
        sb.append('\n').append(options.indent().repeat(depth)).append(text);
    }
}
