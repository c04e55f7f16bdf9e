package nl.bytesoflife.deltasdf.model;

/**
 * The three disjoint groups an {@link Entry} can belong to. Each maps to one SDF block.
 */
public enum EntryFamily {
    DELAY,
    TIMING_CHECK,
    TIMING_ENV
}
