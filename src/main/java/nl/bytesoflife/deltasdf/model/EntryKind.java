package nl.bytesoflife.deltasdf.model;

import java.util.Locale;

public enum EntryKind {
    IOPATH(EntryFamily.DELAY),
    INTERCONNECT(EntryFamily.DELAY),
    PORT(EntryFamily.DELAY),
    DEVICE(EntryFamily.DELAY),
    SETUPHOLD(EntryFamily.TIMING_CHECK),
    HOLD(EntryFamily.TIMING_CHECK),
    SETUP(EntryFamily.TIMING_CHECK),
    RECOVERY(EntryFamily.TIMING_CHECK),
    REMOVAL(EntryFamily.TIMING_CHECK),
    SKEW(EntryFamily.TIMING_CHECK),
    WIDTH(EntryFamily.TIMING_CHECK),
    PERIOD(EntryFamily.TIMING_CHECK),
    NOCHANGE(EntryFamily.TIMING_CHECK),
    PATHCONSTRAINT(EntryFamily.TIMING_ENV);

    private final EntryFamily family;

    EntryKind(EntryFamily family) {
        this.family = family;
    }

    public EntryFamily family() {
        return family;
    }

    /**
     * Checks that take a single port and use it for both pins.
     */
    public boolean isSinglePortCheck() {
        return this == WIDTH || this == PERIOD;
    }

    /**
     * Lower-case name, as used in entry keys and the JSON export.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
