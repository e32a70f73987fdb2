package ai.legaldoc.reviser.pipeline;

import ai.legaldoc.reviser.amend.AmendmentInstruction;
import ai.legaldoc.reviser.model.Document;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of the revision pipeline.
 *
 * @param document            the updated document
 * @param gazetteMerged       whether the gazette citation paragraph was patched
 * @param appliedArticles     ids of articles whose text was changed, in document order
 * @param skippedInstructions instructions naming an article the document does not contain
 */
public record RevisionResult(Document document,
                             boolean gazetteMerged,
                             List<String> appliedArticles,
                             List<AmendmentInstruction> skippedInstructions) {

    public RevisionResult {
        Objects.requireNonNull(document, "document");
        appliedArticles = List.copyOf(Objects.requireNonNull(appliedArticles, "appliedArticles"));
        skippedInstructions = List.copyOf(Objects.requireNonNull(skippedInstructions, "skippedInstructions"));
    }
}
