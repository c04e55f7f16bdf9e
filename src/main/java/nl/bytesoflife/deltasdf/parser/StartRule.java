package nl.bytesoflife.deltasdf.parser;

/**
 * Grammar rule the parser starts from. Anything other than {@link #DELAYFILE} is meant
 * for parsing a single construct in isolation.
 */
public enum StartRule {
    DELAYFILE,
    CELL,
    DEL_DEF,
    TC_DEF,
    TE_DEF,
    RVALUE
}
