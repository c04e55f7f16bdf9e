package nl.bytesoflife.deltasdf.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The TIMESCALE header value: one of 1, 10 or 100 followed by a time unit.
 */
public record Timescale(BigDecimal value, String unit) {

    private static final Set<String> UNITS = Set.of("s", "ms", "us", "ns", "ps", "fs");
    private static final List<BigDecimal> MAGNITUDES = List.of(
        BigDecimal.ONE, BigDecimal.TEN, BigDecimal.valueOf(100));

    private static final Pattern COMPACT = Pattern.compile("^(\\d+(?:\\.\\d*)?)\\s*([a-zA-Z]+)$");

    public Timescale {
        if (value == null || unit == null) {
            throw new IllegalArgumentException("Timescale needs both a value and a unit");
        }
        unit = unit.toLowerCase(Locale.ROOT);
        if (!UNITS.contains(unit)) {
            throw new IllegalArgumentException("Unknown timescale unit: " + unit);
        }
        if (MAGNITUDES.stream().noneMatch(m -> m.compareTo(value) == 0)) {
            throw new IllegalArgumentException("Timescale value must be 1, 10 or 100: " + value.toPlainString());
        }
    }

    /**
     * Parses the compact form {@code 100ps} (whitespace between number and unit is allowed).
     */
    public static Timescale parse(String text) {
        Matcher matcher = COMPACT.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed timescale: " + text);
        }
        return new Timescale(new BigDecimal(matcher.group(1)), matcher.group(2));
    }

    @Override
    public String toString() {
        return value.toPlainString() + unit;
    }
}
