package ai.legaldoc.reviser.amend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RuleBasedArticleEditorTest {

    private final RuleBasedArticleEditor editor = new RuleBasedArticleEditor();

    @Test
    void picksDirectiveMatchingTheArticle() {
        String instruction = "Odredbe člana 9. stav 1. Zakona o računovodstvu i člana 64. stav 2. Zakona o računovodstvu prestaju da važe.";

        String result = editor.edit("Član 64\nPrvi.\nDrugi.\nTreći.", instruction);

        assertThat(result).isEqualTo("Član 64*\nPrvi.\nTreći.");
    }

    @Test
    void removesEveryStavAddressedToTheArticle() {
        String instruction = "Odredbe člana 9. stav 2. Zakona o računovodstvu i člana 9. stav 4. Zakona o računovodstvu prestaju da važe.";

        String result = editor.edit("Član 9\nS1\nS2\nS3\nS4\nS5\nS6", instruction);

        assertThat(result).isEqualTo("Član 9*\nS1\nS3\nS5\nS6");
    }

    @Test
    void leavesArticleIntactWhenAnyStavIsMissing() {
        String instruction = "člana 9. stav 1. Zakona o računovodstvu i člana 9. stav 5. Zakona o računovodstvu prestaju da važe";

        assertThatThrownBy(() -> editor.edit("Član 9\nS1\nS2", instruction))
                .isInstanceOf(ArticleEditException.class)
                .hasMessageContaining("Stav 5");
    }

    @Test
    void doesNotDoubleTheMarker() {
        String result = editor.edit("Član 9*\n\nPrvi.\n\nDrugi.", "člana 9. stav 2. Zakona o računovodstvu prestaju da važe");

        assertThat(result).isEqualTo("Član 9*\nPrvi.");
    }

    @Test
    void rejectsOrdinalBeyondArticleBody() {
        assertThatThrownBy(() -> editor.edit("Član 9\nPrvi.", "člana 9. stav 4. Zakona o računovodstvu prestaju da važe"))
                .isInstanceOf(ArticleEditException.class)
                .hasMessageContaining("Stav 4");
    }

    @Test
    void rejectsTextWithoutHeader() {
        assertThatThrownBy(() -> editor.edit("Prvi.\nDrugi.", "člana 9. stav 1. Zakona o računovodstvu prestaju da važe"))
                .isInstanceOf(ArticleEditException.class);
    }
}
