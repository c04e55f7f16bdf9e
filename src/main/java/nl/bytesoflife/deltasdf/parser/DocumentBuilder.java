package nl.bytesoflife.deltasdf.parser;

import nl.bytesoflife.deltasdf.SemanticException;
import nl.bytesoflife.deltasdf.model.DelayMode;
import nl.bytesoflife.deltasdf.model.Entry;
import nl.bytesoflife.deltasdf.model.EntryKey;
import nl.bytesoflife.deltasdf.model.EntryKind;
import nl.bytesoflife.deltasdf.model.SdfDocument;
import nl.bytesoflife.deltasdf.model.SdfHeader;
import nl.bytesoflife.deltasdf.model.Triple;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces an {@link SdfNode.DelayFile} parse tree to an {@link SdfDocument}.
 *
 * <p>Positional delay values are given slot names here, and every entry gets a key that
 * is unique within its instance (see {@link EntryKey}). CELL blocks that repeat a cell
 * type and instance are merged into one instance.
 */
public class DocumentBuilder {

    private static final List<String> SIX_TRANSITIONS = List.of("01", "10", "0z", "z1", "1z", "z0");
    private static final List<String> TWELVE_TRANSITIONS = List.of(
        "01", "10", "0z", "z1", "1z", "z0", "0x", "x1", "1x", "x0", "xz", "zx");

    private final Map<String, Map<String, Map<EntryKey, Entry>>> cells = new LinkedHashMap<>();
    // next free ordinal per key base, for each instance's entry map
    private final Map<Map<EntryKey, Entry>, Map<String, Integer>> ordinals = new IdentityHashMap<>();

    public SdfDocument build(SdfNode.DelayFile delayFile) {
        SdfHeader header = buildHeader(delayFile.header());
        for (SdfNode.Cell cell : delayFile.cells()) {
            addCell(cell);
        }
        return new SdfDocument(header, cells);
    }

    private SdfHeader buildHeader(List<SdfNode.HeaderEntry> entries) {
        SdfHeader.Builder header = SdfHeader.builder();
        for (SdfNode.HeaderEntry entry : entries) {
            switch (entry.item()) {
                case DIVIDER -> header.divider(entry.text().charAt(0));
                case VOLTAGE -> header.voltage(entry.triple());
                case TEMPERATURE -> header.temperature(entry.triple());
                case TIMESCALE -> header.timescale(entry.timescale());
                default -> header.text(entry.item(), entry.text());
            }
        }
        return header.build();
    }

    private void addCell(SdfNode.Cell cell) {
        Map<EntryKey, Entry> entries = cells
            .computeIfAbsent(cell.cellType(), k -> new LinkedHashMap<>())
            .computeIfAbsent(cell.instance(), k -> new LinkedHashMap<>());

        for (SdfNode.TimingSpec spec : cell.specs()) {
            if (spec instanceof SdfNode.Delay delay) {
                for (SdfNode.DelayBlock block : delay.blocks()) {
                    for (SdfNode.PathDelay pathDelay : block.entries()) {
                        put(entries, buildPathDelay(pathDelay, block.mode()));
                    }
                }
            } else if (spec instanceof SdfNode.TimingCheck timingCheck) {
                for (SdfNode.Check check : timingCheck.checks()) {
                    put(entries, buildCheck(check));
                }
            } else if (spec instanceof SdfNode.TimingEnv timingEnv) {
                for (SdfNode.PathConstraint constraint : timingEnv.constraints()) {
                    put(entries, buildPathConstraint(constraint));
                }
            }
        }
    }

    private void put(Map<EntryKey, Entry> entries, Entry entry) {
        Map<String, Integer> next = ordinals.computeIfAbsent(entries, k -> new HashMap<>());
        String base = entry.keyBase();
        int ordinal = next.getOrDefault(base, 0);
        if (ordinal == Integer.MAX_VALUE) {
            throw new SemanticException("Too many entries with key " + base);
        }
        next.put(base, ordinal + 1);
        EntryKey key = new EntryKey(base, ordinal);
        if (entries.putIfAbsent(key, entry) != null) {
            throw new SemanticException("Duplicate entry key " + key);
        }
    }

    Entry buildPathDelay(SdfNode.PathDelay node, DelayMode mode) {
        Entry.Builder builder = Entry.builder(node.kind()).delayMode(mode);
        SdfNode.PortSpec from = node.from();
        // PORT and DEVICE name a single port, which is both ends of the path
        SdfNode.PortSpec to = node.to() != null ? node.to() : from;
        if (from != null) {
            builder.fromPin(from.path(), from.edge());
            builder.toPin(to.path(), to.edge());
        }
        if (node.cond() != null) {
            builder.cond(node.cond());
        }
        builder.retain(node.retain());
        nameDelayValues(builder, node.values());
        return builder.build();
    }

    Entry buildCheck(SdfNode.Check node) {
        Entry.Builder builder = Entry.builder(node.kind());
        List<SdfNode.CheckPort> ports = node.ports();

        String cond = null;
        for (SdfNode.CheckPort port : ports) {
            if (port.cond() != null) {
                if (cond != null) {
                    throw new SemanticException(node.kind() + " check carries a COND on both ports (line "
                        + node.token().line() + ")");
                }
                cond = port.cond();
            }
        }
        if (cond != null) {
            builder.cond(cond);
        }

        if (ports.size() == 1) {
            SdfNode.PortSpec port = ports.get(0).port();
            builder.fromPin(port.path(), port.edge());
            builder.toPin(port.path(), port.edge());
        } else {
            // the first port goes to to_pin and the second to from_pin, NOCHANGE included
            SdfNode.PortSpec first = ports.get(0).port();
            SdfNode.PortSpec second = ports.get(1).port();
            builder.toPin(first.path(), first.edge());
            builder.fromPin(second.path(), second.edge());
        }

        List<Triple> values = node.values();
        if (values.size() == 2) {
            builder.delayPath("setup", values.get(0));
            builder.delayPath("hold", values.get(1));
        } else {
            builder.delayPath("nominal", values.get(0));
        }
        return builder.build();
    }

    Entry buildPathConstraint(SdfNode.PathConstraint node) {
        return Entry.builder(EntryKind.PATHCONSTRAINT)
            .toPin(node.output().path(), node.output().edge())
            .fromPin(node.input().path(), node.input().edge())
            .delayPath("rise", node.values().get(0))
            .delayPath("fall", node.values().get(1))
            .build();
    }

    private void nameDelayValues(Entry.Builder builder, List<Triple> values) {
        List<String> slots = delaySlots(values.size());
        for (int i = 0; i < values.size(); i++) {
            builder.delayPath(slots.get(i), values.get(i));
        }
    }

    /**
     * Slot names for a path delay with the given number of values.
     */
    public static List<String> delaySlots(int count) {
        return switch (count) {
            case 1 -> List.of("nominal");
            case 2 -> List.of("rise", "fall");
            case 3 -> List.of("rise", "fall", "turnoff");
            case 6 -> SIX_TRANSITIONS;
            case 12 -> TWELVE_TRANSITIONS;
            default -> throw new SemanticException("Unsupported number of delay values: " + count);
        };
    }
}
