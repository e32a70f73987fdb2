package ai.legaldoc.reviser.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.legaldoc.reviser.amend.AmendmentApplier;
import ai.legaldoc.reviser.amend.AmendmentInstruction;
import ai.legaldoc.reviser.amend.ArticleEditException;
import ai.legaldoc.reviser.amend.ArticleEditor;
import ai.legaldoc.reviser.amend.RuleBasedArticleEditor;
import ai.legaldoc.reviser.model.Alignment;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Paragraph;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class RevisionPipelineTest {

    private static final String REPEAL_ARTICLE_1 = "Odredbe člana 1. stav 2. Zakona o računovodstvu prestaju da važe.";

    @Test
    void removesRepealedParagraphAndFlagsHeader() {
        Document original = new Document();
        original.addParagraph("Član 1");
        original.addParagraph("text A");
        original.addParagraph("text B");
        Document amendment = new Document();
        amendment.addParagraph(REPEAL_ARTICLE_1);
        RevisionPipeline pipeline = new RevisionPipeline(new AmendmentApplier(new RuleBasedArticleEditor()), 1);

        RevisionResult result = pipeline.buildUpdatedDocument(original, amendment);

        assertThat(result.document().paragraphs()).extracting(Paragraph::text).containsExactly("Član 1*", "text A");
        assertThat(result.appliedArticles()).containsExactly("Član 1");
        assertThat(result.skippedInstructions()).isEmpty();
        assertThat(result.gazetteMerged()).isFalse();
        assertThat(original.paragraphs()).extracting(Paragraph::text).containsExactly("Član 1", "text A", "text B");
    }

    @Test
    void mergesGazetteCitationAndKeepsUntouchedArticles() {
        Document original = new Document();
        original.addParagraph("ZAKON O RAČUNOVODSTVU");
        original.addParagraph("(\"Sl. glasnik RS\", br. 73/2019)").setAlignment(Alignment.CENTER);
        original.addParagraph("Član 1");
        original.addParagraph("prvi");
        original.addParagraph("drugi");
        original.addParagraph("Član 2");
        original.addParagraph("nepromenjen");
        Document amendment = new Document();
        amendment.addParagraph("(\"Sl. glasnik RS\", br. 44/2021)");
        amendment.addParagraph(REPEAL_ARTICLE_1);
        RevisionPipeline pipeline = new RevisionPipeline(new AmendmentApplier(new RuleBasedArticleEditor()), 1);

        RevisionResult result = pipeline.buildUpdatedDocument(original, amendment);

        assertThat(result.gazetteMerged()).isTrue();
        assertThat(result.document().paragraphs()).extracting(Paragraph::text).containsExactly(
                "ZAKON O RAČUNOVODSTVU",
                "(\"Sl. glasnik RS\", br. 44/2021 i 73/2019)",
                "Član 1*",
                "prvi",
                "Član 2",
                "nepromenjen");
        assertThat(result.document().get(1).asParagraph().alignment()).isEqualTo(Alignment.CENTER);
    }

    @Test
    void instructionsForMissingArticlesAreSkipped() {
        Document original = new Document();
        original.addParagraph("Član 1");
        original.addParagraph("text A");
        Document amendment = new Document();
        amendment.addParagraph("Odredbe člana 7. stav 1. Zakona o računovodstvu prestaju da važe.");

        RevisionResult result = new RevisionPipeline(new AmendmentApplier(new RuleBasedArticleEditor()), 1)
                .buildUpdatedDocument(original, amendment);

        assertThat(result.appliedArticles()).isEmpty();
        assertThat(result.skippedInstructions()).extracting(AmendmentInstruction::articleId).containsExactly("Član 7");
        assertThat(result.document().paragraphs()).extracting(Paragraph::text).containsExactly("Član 1", "text A");
    }

    @Test
    void failedAmendmentLeavesArticleUntouched() {
        Document original = new Document();
        original.addParagraph("Član 1");
        original.addParagraph("text A");
        original.addParagraph("text B");
        Document amendment = new Document();
        amendment.addParagraph(REPEAL_ARTICLE_1);
        ArticleEditor failing = (text, instruction) -> {
            throw new ArticleEditException("unavailable");
        };

        RevisionResult result = new RevisionPipeline(new AmendmentApplier(failing), 1)
                .buildUpdatedDocument(original, amendment);

        assertThat(result.appliedArticles()).isEmpty();
        assertThat(result.document().paragraphs()).extracting(Paragraph::text)
                .containsExactly("Član 1", "text A", "text B");
    }

    @Test
    void amendsArticlesOnWorkerThreadsWithArticleInMdc() {
        Document original = new Document();
        original.addParagraph("Član 1");
        original.addParagraph("a1");
        original.addParagraph("a2");
        original.addParagraph("Član 2");
        original.addParagraph("b1");
        original.addParagraph("b2");
        Document amendment = new Document();
        amendment.addParagraph(REPEAL_ARTICLE_1);
        amendment.addParagraph("Odredbe člana 2. stav 1. Zakona o računovodstvu prestaju da važe.");
        Set<String> seen = ConcurrentHashMap.newKeySet();
        RuleBasedArticleEditor rules = new RuleBasedArticleEditor();
        ArticleEditor recording = (text, instruction) -> {
            seen.add(Thread.currentThread().getName().replaceAll("\\d+$", "") + MDC.get(RevisionPipeline.ARTICLE_MDC_KEY));
            return rules.edit(text, instruction);
        };

        RevisionResult result = new RevisionPipeline(new AmendmentApplier(recording), 2)
                .buildUpdatedDocument(original, amendment);

        assertThat(seen).containsExactlyInAnyOrder("amendment-Član 1", "amendment-Član 2");
        assertThat(result.appliedArticles()).containsExactly("Član 1", "Član 2");
        assertThat(result.document().paragraphs()).extracting(Paragraph::text)
                .containsExactly("Član 1*", "a1", "Član 2*", "b2");
    }

    @Test
    void repealsFromSeparateParagraphsCountOriginalStavs() {
        Document amendment = new Document();
        amendment.addParagraph("Odredbe člana 9. stav 2. Zakona o računovodstvu prestaju da važe.");
        amendment.addParagraph("Odredbe člana 9. stav 4. Zakona o računovodstvu prestaju da važe.");

        RevisionResult result = new RevisionPipeline(new AmendmentApplier(new RuleBasedArticleEditor()), 1)
                .buildUpdatedDocument(articleNineWithSixStavs(), amendment);

        assertThat(result.document().paragraphs()).extracting(Paragraph::text)
                .containsExactly("Član 9*", "S1", "S3", "S5", "S6");
    }

    @Test
    void repealsJoinedInOneParagraphAreAllApplied() {
        Document amendment = new Document();
        amendment.addParagraph("Odredbe člana 9. stav 2. Zakona o računovodstvu i člana 9. stav 4. Zakona o računovodstvu prestaju da važe.");

        RevisionResult result = new RevisionPipeline(new AmendmentApplier(new RuleBasedArticleEditor()), 1)
                .buildUpdatedDocument(articleNineWithSixStavs(), amendment);

        assertThat(result.document().paragraphs()).extracting(Paragraph::text)
                .containsExactly("Član 9*", "S1", "S3", "S5", "S6");
    }

    @Test
    void editorReceivesOneDirectivePerStavHighestFirst() {
        Document amendment = new Document();
        amendment.addParagraph("Odredbe člana 9. stav 2. Zakona o računovodstvu i člana 9. stav 4. Zakona o računovodstvu prestaju da važe.");
        amendment.addParagraph("Odredbe člana 9. stav 2. Zakona o računovodstvu prestaju da važe.");
        List<String> directives = new ArrayList<>();
        RuleBasedArticleEditor rules = new RuleBasedArticleEditor();
        ArticleEditor recording = (text, instruction) -> {
            directives.add(instruction);
            return rules.edit(text, instruction);
        };

        new RevisionPipeline(new AmendmentApplier(recording), 1).buildUpdatedDocument(articleNineWithSixStavs(), amendment);

        assertThat(directives).containsExactly(
                "člana 9. stav 4. Zakona o računovodstvu prestaju da važe",
                "člana 9. stav 2. Zakona o računovodstvu prestaju da važe");
    }

    @Test
    void rejectsNonPositiveConcurrency() {
        AmendmentApplier applier = new AmendmentApplier(new RuleBasedArticleEditor());

        assertThatThrownBy(() -> new RevisionPipeline(applier, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("concurrency");
    }

    @Test
    void documentWithoutInstructionsIsCopiedVerbatim() {
        Document original = new Document();
        original.addParagraph("Član 1");
        original.addTable(1, 1).cell(0, 0).addParagraph().addRun("ćelija");
        Document amendment = new Document();
        amendment.addParagraph("Ovaj zakon stupa na snagu osmog dana.");

        RevisionResult result = new RevisionPipeline(new AmendmentApplier(new RuleBasedArticleEditor()), 4)
                .buildUpdatedDocument(original, amendment);

        assertThat(result.document().size()).isEqualTo(2);
        assertThat(result.document().get(1).asTable().cell(0, 0).text()).isEqualTo("ćelija");
        assertThat(result.appliedArticles()).isEmpty();
    }

    private static Document articleNineWithSixStavs() {
        Document document = new Document();
        document.addParagraph("Član 9");
        for (int i = 1; i <= 6; i++) {
            document.addParagraph("S" + i);
        }
        return document;
    }
}
