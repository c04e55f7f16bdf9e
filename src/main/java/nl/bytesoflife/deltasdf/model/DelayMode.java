package nl.bytesoflife.deltasdf.model;

public enum DelayMode {
    ABSOLUTE,
    INCREMENT
}
