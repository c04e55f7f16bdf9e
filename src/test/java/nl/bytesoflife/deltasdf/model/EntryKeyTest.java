package nl.bytesoflife.deltasdf.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class EntryKeyTest {

    @Test
    void toStringOmitsZeroOrdinal() {
        assertEquals("iopath_a_y", EntryKey.of("iopath_a_y").toString());
        assertEquals("iopath_a_y#3", new EntryKey("iopath_a_y", 3).toString());
    }

    @Test
    void parseReadsOrdinalSuffix() {
        assertEquals(new EntryKey("iopath_a_y", 12), EntryKey.parse("iopath_a_y#12"));
        assertEquals(EntryKey.of("iopath_a_y"), EntryKey.parse("iopath_a_y"));
        // a '#' that is not followed by digits belongs to the pin name
        assertEquals(EntryKey.of("port_a#b_a#b"), EntryKey.parse("port_a#b_a#b"));
        assertEquals(EntryKey.of("port_x#_x#"), EntryKey.parse("port_x#_x#"));
    }

    @Test
    void ordinalsSortNumerically() {
        TreeSet<EntryKey> keys = new TreeSet<>(List.of(
            new EntryKey("iopath_a_y", 10),
            new EntryKey("iopath_a_y", 2),
            EntryKey.of("iopath_b_y"),
            EntryKey.of("iopath_a_y")));
        assertEquals(List.of("iopath_a_y", "iopath_a_y#2", "iopath_a_y#10", "iopath_b_y"),
            keys.stream().map(EntryKey::toString).toList());
    }

    @Test
    void rejectsInvalidKeys() {
        assertThrows(IllegalArgumentException.class, () -> EntryKey.of(""));
        assertThrows(IllegalArgumentException.class, () -> new EntryKey("x", -1));
    }
}
