package nl.bytesoflife.deltasdf.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntryTest {

    private static final Triple ONE = Triple.of(BigDecimal.ONE);

    @Test
    void keyBaseUsesKindAndPins() {
        Entry iopath = Entry.builder(EntryKind.IOPATH)
            .delayMode(DelayMode.ABSOLUTE)
            .fromPin("a", Edge.POSEDGE)
            .toPin("y")
            .delayPath("nominal", ONE)
            .build();
        assertEquals("iopath_a_y", iopath.keyBase());
        assertEquals(EntryFamily.DELAY, iopath.getFamily());

        Entry increment = Entry.builder(EntryKind.INTERCONNECT)
            .delayMode(DelayMode.INCREMENT)
            .fromPin("a")
            .toPin("b")
            .delayPath("nominal", ONE)
            .build();
        assertEquals("increment_interconnect_a_b", increment.keyBase());

        Entry device = Entry.builder(EntryKind.DEVICE)
            .delayMode(DelayMode.ABSOLUTE)
            .delayPath("nominal", ONE)
            .build();
        assertEquals("device__", device.keyBase());
    }

    @Test
    void delayNeedsMode() {
        assertThrows(IllegalStateException.class, () -> Entry.builder(EntryKind.IOPATH)
            .fromPin("a").toPin("y").delayPath("nominal", ONE).build());
    }

    @Test
    void checkCannotHaveMode() {
        assertThrows(IllegalStateException.class, () -> Entry.builder(EntryKind.SETUP)
            .delayMode(DelayMode.ABSOLUTE).fromPin("clk").toPin("d").delayPath("nominal", ONE).build());
    }

    @Test
    void condAndRetainOnlyOnIopath() {
        assertThrows(IllegalStateException.class, () -> Entry.builder(EntryKind.INTERCONNECT)
            .delayMode(DelayMode.ABSOLUTE).fromPin("a").toPin("b").cond("en")
            .delayPath("nominal", ONE).build());
        assertThrows(IllegalStateException.class, () -> Entry.builder(EntryKind.PORT)
            .delayMode(DelayMode.ABSOLUTE).fromPin("a").toPin("a").retain(List.of(ONE))
            .delayPath("nominal", ONE).build());
        assertThrows(IllegalStateException.class, () -> Entry.builder(EntryKind.PATHCONSTRAINT)
            .fromPin("a").toPin("y").cond("en")
            .delayPath("rise", ONE).delayPath("fall", ONE).build());

        Entry check = Entry.builder(EntryKind.HOLD)
            .fromPin("clk").toPin("d").cond("en")
            .delayPath("nominal", ONE).build();
        assertTrue(check.isCond());
    }

    @Test
    void entryNeedsValues() {
        assertThrows(IllegalStateException.class, () -> Entry.builder(EntryKind.WIDTH)
            .fromPin("clk").toPin("clk").build());
    }

    @Test
    void familyFlagsAreExclusive() {
        Entry constraint = Entry.builder(EntryKind.PATHCONSTRAINT)
            .fromPin("a").toPin("y")
            .delayPath("rise", ONE).delayPath("fall", ONE)
            .build();
        assertTrue(constraint.isTimingEnv());
        assertFalse(constraint.isTimingCheck());
        assertFalse(constraint.isAbsolute());
        assertFalse(constraint.isIncremental());
        assertFalse(constraint.isCond());
        assertNull(constraint.getCondEquation());
    }

    @Test
    void valuesAreCopied() {
        Entry entry = Entry.builder(EntryKind.PERIOD)
            .fromPin("clk").toPin("clk")
            .delayPath("nominal", ONE)
            .build();
        assertThrows(UnsupportedOperationException.class, () -> entry.getDelayPaths().clear());
        assertEquals(entry, Entry.builder(EntryKind.PERIOD)
            .fromPin("clk").toPin("clk")
            .delayPath("nominal", Triple.of("1", "1", "1"))
            .build());
    }
}
