package ai.legaldoc.reviser.diff;

/**
 * Kind of aligned region between an old and a new block sequence.
 */
public enum RegionType {
    EQUAL,
    DELETE,
    INSERT,
    REPLACE
}
