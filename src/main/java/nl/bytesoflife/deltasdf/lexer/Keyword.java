package nl.bytesoflife.deltasdf.lexer;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reserved SDF words. Recognition is case-insensitive; {@link #text()} is the
 * spelling the writer uses.
 */
public enum Keyword {
    DELAYFILE,
    SDFVERSION,
    DESIGN,
    DATE,
    VENDOR,
    PROGRAM,
    VERSION,
    DIVIDER,
    VOLTAGE,
    PROCESS,
    TEMPERATURE,
    TIMESCALE,
    CELL,
    CELLTYPE,
    INSTANCE,
    DELAY,
    ABSOLUTE,
    INCREMENT,
    IOPATH,
    INTERCONNECT,
    PORT,
    DEVICE,
    COND,
    RETAIN,
    PATHPULSE,
    TIMINGCHECK,
    SETUPHOLD,
    SETUP,
    HOLD,
    WIDTH,
    PERIOD,
    NOCHANGE,
    RECOVERY,
    REMOVAL,
    SKEW,
    TIMINGENV,
    PATHCONSTRAINT,
    POSEDGE("posedge"),
    NEGEDGE("negedge");

    private static final Map<String, Keyword> BY_NAME = new HashMap<>();

    static {
        for (Keyword keyword : values()) {
            BY_NAME.put(keyword.name(), keyword);
        }
    }

    private final String text;

    Keyword() {
        this.text = name();
    }

    Keyword(String text) {
        this.text = text;
    }

    public String text() {
        return text;
    }

    /**
     * Looks up a word, ignoring case. Returns null when the word is not reserved.
     */
    public static Keyword lookup(String word) {
        return BY_NAME.get(word.toUpperCase(Locale.ROOT));
    }
}
