package ai.legaldoc.reviser.diff;

import java.util.Objects;

/**
 * One region of an alignment: half-open ranges into the old and the new sequence. Either range may be
 * empty ({@link RegionType#INSERT} has an empty old range, {@link RegionType#DELETE} an empty new one).
 */
public record DiffRegion(RegionType type, int oldStart, int oldEnd, int newStart, int newEnd) {

    public DiffRegion {
        Objects.requireNonNull(type, "type");
        if (oldStart < 0 || oldEnd < oldStart || newStart < 0 || newEnd < newStart) {
            throw new IllegalArgumentException("Invalid region ranges");
        }
        if (type == RegionType.EQUAL && oldEnd - oldStart != newEnd - newStart) {
            throw new IllegalArgumentException("Equal region ranges must have the same length");
        }
    }

    public int oldLength() {
        return oldEnd - oldStart;
    }

    public int newLength() {
        return newEnd - newStart;
    }
}
