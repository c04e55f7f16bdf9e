package nl.bytesoflife.deltasdf.parser;

import nl.bytesoflife.deltasdf.lexer.Token;
import nl.bytesoflife.deltasdf.model.DelayMode;
import nl.bytesoflife.deltasdf.model.Edge;
import nl.bytesoflife.deltasdf.model.EntryKind;
import nl.bytesoflife.deltasdf.model.HeaderItem;
import nl.bytesoflife.deltasdf.model.Timescale;
import nl.bytesoflife.deltasdf.model.Triple;

import java.util.List;

/**
 * Parse tree produced by {@link SdfParser}. Values are kept positional; naming them is
 * left to {@link DocumentBuilder}.
 */
public sealed interface SdfNode {

    record DelayFile(List<HeaderEntry> header, List<Cell> cells) implements SdfNode {
    }

    /**
     * One header item. Only the field matching the item is set.
     */
    record HeaderEntry(HeaderItem item, String text, Triple triple, Timescale timescale, Token token)
        implements SdfNode {
    }

    record Cell(String cellType, String instance, List<TimingSpec> specs, Token token) implements SdfNode {
    }

    sealed interface TimingSpec extends SdfNode {
    }

    record Delay(List<DelayBlock> blocks) implements TimingSpec {
    }

    record TimingCheck(List<Check> checks) implements TimingSpec {
    }

    record TimingEnv(List<PathConstraint> constraints) implements TimingSpec {
    }

    record DelayBlock(DelayMode mode, List<PathDelay> entries) implements SdfNode {
    }

    /**
     * IOPATH, INTERCONNECT, PORT or DEVICE. {@code to} is null for single-port kinds.
     */
    record PathDelay(EntryKind kind, PortSpec from, PortSpec to, String cond, List<Triple> retain,
                     List<Triple> values, Token token) implements SdfNode {
    }

    record Check(EntryKind kind, List<CheckPort> ports, List<Triple> values, Token token) implements SdfNode {
    }

    record CheckPort(PortSpec port, String cond) implements SdfNode {
    }

    record PathConstraint(PortSpec output, PortSpec input, List<Triple> values, Token token) implements SdfNode {
    }

    record PortSpec(String path, Edge edge) implements SdfNode {
    }

    record Value(Triple triple) implements SdfNode {
    }
}
