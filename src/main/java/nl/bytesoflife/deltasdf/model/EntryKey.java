package nl.bytesoflife.deltasdf.model;

import java.util.Comparator;

/**
 * Identifies an entry within one instance. Entries that share a {@code base} are told
 * apart by {@code ordinal}, which counts earlier entries with the same base in input order.
 * Ordering compares the ordinal numerically, so {@code base#2} sorts before {@code base#10}.
 */
public record EntryKey(String base, int ordinal) implements Comparable<EntryKey> {

    private static final Comparator<EntryKey> ORDER = Comparator
        .comparing(EntryKey::base)
        .thenComparingInt(EntryKey::ordinal);

    public EntryKey {
        if (base == null || base.isEmpty()) {
            throw new IllegalArgumentException("Entry key base must not be empty");
        }
        if (ordinal < 0) {
            throw new IllegalArgumentException("Entry key ordinal must not be negative: " + ordinal);
        }
    }

    public static EntryKey of(String base) {
        return new EntryKey(base, 0);
    }

    /**
     * Reads the {@link #toString()} form back.
     */
    public static EntryKey parse(String text) {
        int hash = text.lastIndexOf('#');
        if (hash > 0 && hash < text.length() - 1) {
            String suffix = text.substring(hash + 1);
            if (suffix.chars().allMatch(Character::isDigit)) {
                return new EntryKey(text.substring(0, hash), Integer.parseInt(suffix));
            }
        }
        return new EntryKey(text, 0);
    }

    @Override
    public int compareTo(EntryKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return ordinal == 0 ? base : base + "#" + ordinal;
    }
}
