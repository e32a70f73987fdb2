package ai.legaldoc.reviser.model;

/**
 * Paragraph indentation in points. Any field may be {@code null} when the source did not set it.
 */
public record Indentation(Double left, Double right, Double firstLine, Double hanging) {

    public static final Indentation NONE = new Indentation(null, null, null, null);

    public boolean isEmpty() {
        return left == null && right == null && firstLine == null && hanging == null;
    }

    /**
     * Returns a copy where every field set on {@code other} replaces the field of this instance.
     */
    public Indentation overlay(Indentation other) {
        if (other == null) {
            return this;
        }
        Double first = firstLine;
        Double hang = hanging;
        if (other.firstLine() != null) {
            first = other.firstLine();
            hang = null;
        }
        if (other.hanging() != null) {
            hang = other.hanging();
            first = null;
        }
        return new Indentation(
                other.left() != null ? other.left() : left,
                other.right() != null ? other.right() : right,
                first,
                hang);
    }
}
