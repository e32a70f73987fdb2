package ai.legaldoc.reviser.model;

/**
 * Paragraph spacing: before and after in points, line spacing as a multiple of single spacing.
 */
public record Spacing(Double before, Double after, Double line) {

    public static final Spacing NONE = new Spacing(null, null, null);

    public boolean isEmpty() {
        return before == null && after == null && line == null;
    }

    public Spacing overlay(Spacing other) {
        if (other == null) {
            return this;
        }
        return new Spacing(
                other.before() != null ? other.before() : before,
                other.after() != null ? other.after() : after,
                other.line() != null ? other.line() : line);
    }
}
