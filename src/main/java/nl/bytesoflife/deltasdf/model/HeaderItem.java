package nl.bytesoflife.deltasdf.model;

/**
 * Header items in the order they are written out.
 */
public enum HeaderItem {
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
    TIMESCALE;

    public boolean isQuoted() {
        return switch (this) {
            case SDFVERSION, DESIGN, DATE, VENDOR, PROGRAM, VERSION, PROCESS -> true;
            default -> false;
        };
    }
}
