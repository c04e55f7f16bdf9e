package nl.bytesoflife.deltasdf.model;

import java.math.BigDecimal;

/**
 * A min:avg:max value set. Any slot may be null; all three null is the empty value {@code ()}.
 */
public record Triple(BigDecimal min, BigDecimal avg, BigDecimal max) {

    private static final Triple EMPTY = new Triple(null, null, null);

    public static Triple empty() {
        return EMPTY;
    }

    /**
     * A single literal value, which applies to all three slots.
     */
    public static Triple of(BigDecimal value) {
        return new Triple(value, value, value);
    }

    public static Triple of(String min, String avg, String max) {
        return new Triple(decimal(min), decimal(avg), decimal(max));
    }

    public boolean isEmpty() {
        return min == null && avg == null && max == null;
    }

    private static BigDecimal decimal(String text) {
        return text == null ? null : new BigDecimal(text);
    }
}
