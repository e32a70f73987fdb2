package ai.legaldoc.reviser.article;

import java.util.Objects;

/**
 * Half-open block range {@code [start, end)} of one article, starting at its header paragraph.
 */
public record ArticleSpan(String id, int start, int end) {

    public ArticleSpan {
        Objects.requireNonNull(id, "id");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid article span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }
}
