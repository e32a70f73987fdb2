package ai.legaldoc.reviser.annotate;

import ai.legaldoc.reviser.article.LegalPatterns;
import ai.legaldoc.reviser.diff.DiffColors;
import ai.legaldoc.reviser.format.FormatPreservingCopier;
import ai.legaldoc.reviser.model.Alignment;
import ai.legaldoc.reviser.model.Block;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Paragraph;
import ai.legaldoc.reviser.model.Spacing;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Post-processes a rendered comparison: places the amending act's citation above every article header
 * flagged as modified, and normalizes the spacing after the first article.
 */
public class ReferenceAnnotator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceAnnotator.class);

    static final String REFERENCE_FONT = "Arial";
    static final double REFERENCE_FONT_SIZE = 12.0;
    static final Spacing REFERENCE_SPACING = new Spacing(12.0, 6.0, 1.0);
    static final String SPACER_TEXT = ".";

    private final FormatPreservingCopier copier;

    public ReferenceAnnotator(FormatPreservingCopier copier) {
        this.copier = Objects.requireNonNull(copier, "copier");
    }

    /**
     * Inserts a reference paragraph immediately before each modified article header.
     *
     * @return the number of reference paragraphs inserted
     */
    public int annotate(Document document, String reference) {
        Objects.requireNonNull(reference, "reference");
        List<Integer> positions = new ArrayList<>();
        List<Block> blocks = document.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (block.isParagraph() && LegalPatterns.isModifiedArticleHeader(block.asParagraph().text())) {
                positions.add(i);
            }
        }
        // descending, so positions not yet processed stay valid
        for (int i = positions.size() - 1; i >= 0; i--) {
            document.insert(positions.get(i), referenceParagraph(reference));
        }
        LOGGER.info("Inserted amending reference before {} modified articles", positions.size());
        return positions.size();
    }

    /**
     * Inserts a {@code "."} paragraph styled like the first article header, two blocks after that header.
     *
     * @return whether an article header was found
     */
    public boolean insertSpacer(Document document) {
        List<Block> blocks = document.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (block.isParagraph() && LegalPatterns.isArticleHeader(block.asParagraph().text())) {
                Paragraph spacer = copier.duplicate(block.asParagraph());
                spacer.setText(SPACER_TEXT);
                document.insert(Math.min(i + 2, document.size()), spacer);
                return true;
            }
        }
        return false;
    }

    private Paragraph referenceParagraph(String reference) {
        Paragraph paragraph = new Paragraph();
        paragraph.setAlignment(Alignment.CENTER);
        paragraph.setSpacing(REFERENCE_SPACING);
        paragraph.addRun(reference)
                .setBold(true)
                .setFontFamily(REFERENCE_FONT)
                .setFontSize(REFERENCE_FONT_SIZE)
                .setColor(DiffColors.ADDED);
        return paragraph;
    }
}
