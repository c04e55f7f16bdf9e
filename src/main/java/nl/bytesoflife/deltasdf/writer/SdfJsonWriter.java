package nl.bytesoflife.deltasdf.writer;

import nl.bytesoflife.deltasdf.model.Entry;
import nl.bytesoflife.deltasdf.model.EntryKey;
import nl.bytesoflife.deltasdf.model.HeaderItem;
import nl.bytesoflife.deltasdf.model.SdfDocument;
import nl.bytesoflife.deltasdf.model.SdfHeader;
import nl.bytesoflife.deltasdf.model.Triple;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exports an {@link SdfDocument} as JSON, using the field names of the sdf2json format.
 * Keys are written in sorted order so the output is stable.
 */
public class SdfJsonWriter {

    private final int indent;

    /**
     * @param indent spaces per nesting level; 0 or less writes everything on one line
     */
    public SdfJsonWriter(int indent) {
        this.indent = indent;
    }

    public String write(SdfDocument document) {
        StringBuilder json = new StringBuilder();
        json.append('{');
        newline(json, 1);
        json.append("\"header\":").append(space());
        writeHeader(json, document.getHeader(), 1);
        json.append(',');
        newline(json, 1);
        json.append("\"cells\":").append(space());
        writeCells(json, document.getCells(), 1);
        newline(json, 0);
        json.append('}');
        return json.toString();
    }

    private void writeHeader(StringBuilder json, SdfHeader header, int depth) {
        json.append('{');
        Iterator<HeaderItem> it = header.getItems().iterator();
        while (it.hasNext()) {
            HeaderItem item = it.next();
            newline(json, depth + 1);
            json.append(escapeJson(item.name().toLowerCase(Locale.ROOT))).append(':').append(space());
            switch (item) {
                case DIVIDER -> json.append(escapeJson(String.valueOf(header.getDivider())));
                case VOLTAGE -> writeTriple(json, header.getVoltage());
                case TEMPERATURE -> writeTriple(json, header.getTemperature());
                case TIMESCALE -> json.append(escapeJson(header.getTimescale().toString()));
                default -> json.append(escapeJson(header.getText(item)));
            }
            if (it.hasNext()) json.append(',');
        }
        if (!header.getItems().isEmpty()) {
            newline(json, depth);
        }
        json.append('}');
    }

    private void writeCells(StringBuilder json, Map<String, Map<String, Map<EntryKey, Entry>>> cells, int depth) {
        json.append('{');
        Iterator<Map.Entry<String, Map<String, Map<EntryKey, Entry>>>> cellIt = new TreeMap<>(cells).entrySet().iterator();
        while (cellIt.hasNext()) {
            Map.Entry<String, Map<String, Map<EntryKey, Entry>>> cell = cellIt.next();
            newline(json, depth + 1);
            json.append(escapeJson(cell.getKey())).append(':').append(space()).append('{');

            Iterator<Map.Entry<String, Map<EntryKey, Entry>>> instIt = new TreeMap<>(cell.getValue()).entrySet().iterator();
            while (instIt.hasNext()) {
                Map.Entry<String, Map<EntryKey, Entry>> instance = instIt.next();
                newline(json, depth + 2);
                json.append(escapeJson(instance.getKey())).append(':').append(space()).append('{');

                Iterator<Map.Entry<EntryKey, Entry>> entryIt = new TreeMap<>(instance.getValue()).entrySet().iterator();
                while (entryIt.hasNext()) {
                    Map.Entry<EntryKey, Entry> entry = entryIt.next();
                    newline(json, depth + 3);
                    json.append(escapeJson(entry.getKey().toString())).append(':').append(space());
                    writeEntry(json, entry.getKey(), entry.getValue(), depth + 3);
                    if (entryIt.hasNext()) json.append(',');
                }
                if (!instance.getValue().isEmpty()) newline(json, depth + 2);
                json.append('}');
                if (instIt.hasNext()) json.append(',');
            }
            if (!cell.getValue().isEmpty()) newline(json, depth + 1);
            json.append('}');
            if (cellIt.hasNext()) json.append(',');
        }
        if (!cells.isEmpty()) newline(json, depth);
        json.append('}');
    }

    private void writeEntry(StringBuilder json, EntryKey key, Entry entry, int depth) {
        json.append('{');
        field(json, depth + 1, "name", escapeJson(key.toString()));
        field(json, depth + 1, "type", escapeJson(entry.getKind().id()));
        field(json, depth + 1, "from_pin", escapeJson(entry.getFromPin()));
        field(json, depth + 1, "to_pin", escapeJson(entry.getToPin()));
        field(json, depth + 1, "from_pin_edge",
            escapeJson(entry.getFromPinEdge() != null ? entry.getFromPinEdge().text() : null));
        field(json, depth + 1, "to_pin_edge",
            escapeJson(entry.getToPinEdge() != null ? entry.getToPinEdge().text() : null));
        field(json, depth + 1, "is_cond", String.valueOf(entry.isCond()));
        field(json, depth + 1, "cond_equation", escapeJson(entry.getCondEquation()));
        field(json, depth + 1, "is_absolute", String.valueOf(entry.isAbsolute()));
        field(json, depth + 1, "is_incremental", String.valueOf(entry.isIncremental()));
        field(json, depth + 1, "is_timing_check", String.valueOf(entry.isTimingCheck()));
        field(json, depth + 1, "is_timing_env", String.valueOf(entry.isTimingEnv()));
        if (!entry.getRetain().isEmpty()) {
            newline(json, depth + 1);
            json.append("\"retain\":").append(space()).append('[');
            for (int i = 0; i < entry.getRetain().size(); i++) {
                if (i > 0) json.append(',').append(space());
                writeTriple(json, entry.getRetain().get(i));
            }
            json.append("],");
        }
        newline(json, depth + 1);
        json.append("\"delay_paths\":").append(space()).append('{');
        Iterator<Map.Entry<String, Triple>> it = entry.getDelayPaths().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Triple> path = it.next();
            newline(json, depth + 2);
            json.append(escapeJson(path.getKey())).append(':').append(space());
            writeTriple(json, path.getValue());
            if (it.hasNext()) json.append(',');
        }
        newline(json, depth + 1);
        json.append('}');
        newline(json, depth);
        json.append('}');
    }

    private void field(StringBuilder json, int depth, String name, String value) {
        newline(json, depth);
        json.append(escapeJson(name)).append(':').append(space()).append(value).append(',');
    }

    private void writeTriple(StringBuilder json, Triple triple) {
        json.append("{\"min\":").append(space()).append(number(triple.min()))
            .append(',').append(space()).append("\"avg\":").append(space()).append(number(triple.avg()))
            .append(',').append(space()).append("\"max\":").append(space()).append(number(triple.max()))
            .append('}');
    }

    private static String number(BigDecimal value) {
        return value == null ? "null" : value.toPlainString();
    }

    private String space() {
        return indent > 0 ? " " : "";
    }

    private void newline(StringBuilder json, int depth) {
        if (indent > 0) {
            json.append('\n').append(" ".repeat(indent * depth));
        }
    }

    static String escapeJson(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 32) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('"');
        return sb.toString();
    }
}
