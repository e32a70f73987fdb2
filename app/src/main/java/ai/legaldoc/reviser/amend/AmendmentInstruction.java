package ai.legaldoc.reviser.amend;

import ai.legaldoc.reviser.article.LegalPatterns;
import java.util.Objects;

/**
 * A parsed directive repealing one paragraph ("stav") of an article.
 *
 * @param articleNumber    article number as written, e.g. {@code 9}
 * @param paragraphOrdinal 1-based ordinal of the paragraph inside the article body
 * @param text             full wording of the amendment paragraph the directive was parsed from
 */
public record AmendmentInstruction(String articleNumber, int paragraphOrdinal, String text) {

    public AmendmentInstruction {
        Objects.requireNonNull(articleNumber, "articleNumber");
        Objects.requireNonNull(text, "text");
        if (paragraphOrdinal < 1) {
            throw new IllegalArgumentException("paragraphOrdinal must be at least 1");
        }
    }

    public String articleId() {
        return LegalPatterns.ARTICLE_WORD + " " + articleNumber;
    }

    /**
     * The repeal of this single stav, worded the way amendment acts word it.
     */
    public String directive() {
        return "člana %s. stav %d. Zakona o računovodstvu %s".formatted(
                articleNumber, paragraphOrdinal, LegalPatterns.CEASES_TO_BE_VALID);
    }
}
