package ai.legaldoc.reviser.pipeline;

import ai.legaldoc.reviser.article.ArticleSpan;
import ai.legaldoc.reviser.article.LegalPatterns;
import ai.legaldoc.reviser.format.FormatPreservingCopier;
import ai.legaldoc.reviser.model.Alignment;
import ai.legaldoc.reviser.model.Block;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Paragraph;
import ai.legaldoc.reviser.model.Run;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Replaces the blocks of one article with paragraphs built from revised lines.
 *
 * <p>Each line borrows the formatting of the old paragraph with the same text when there is one, and of
 * the paragraph at the same position otherwise. Header lines are centered in bold Arial 12pt. Tables
 * inside the old span are kept after the new paragraphs.</p>
 */
public class ArticleSplicer {

    static final String HEADER_FONT = "Arial";
    static final double HEADER_FONT_SIZE = 12.0;

    private final FormatPreservingCopier copier;

    public ArticleSplicer(FormatPreservingCopier copier) {
        this.copier = Objects.requireNonNull(copier, "copier");
    }

    public void splice(Document document, ArticleSpan span, List<String> lines) {
        List<Paragraph> templates = new ArrayList<>();
        List<Block> tables = new ArrayList<>();
        for (Block block : document.blocks().subList(span.start(), span.end())) {
            switch (block.kind()) {
                case PARAGRAPH -> templates.add(block.asParagraph());
                case TABLE -> tables.add(block);
            }
        }

        List<Block> replacement = new ArrayList<>(lines.size() + tables.size());
        int cursor = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            int match = findTemplate(templates, line, cursor);
            int templateIndex;
            if (match >= 0) {
                templateIndex = match;
                cursor = match + 1;
            } else {
                templateIndex = Math.min(i, templates.size() - 1);
            }
            Paragraph paragraph = templateIndex < 0 ? new Paragraph() : copier.duplicate(templates.get(templateIndex));
            paragraph.setText(line);
            if (LegalPatterns.isArticleHeader(line)) {
                formatHeader(paragraph);
            }
            replacement.add(paragraph);
        }
        replacement.addAll(tables);
        document.replaceRange(span.start(), span.end(), replacement);
    }

    private int findTemplate(List<Paragraph> templates, String line, int from) {
        String key = normalize(line);
        for (int i = from; i < templates.size(); i++) {
            if (normalize(templates.get(i).text()).equals(key)) {
                return i;
            }
        }
        return -1;
    }

    private String normalize(String text) {
        return text.replace(String.valueOf(LegalPatterns.MODIFICATION_MARKER), "").trim();
    }

    private void formatHeader(Paragraph paragraph) {
        paragraph.setAlignment(Alignment.CENTER);
        for (Run run : paragraph.runs()) {
            run.setBold(true);
            run.setFontFamily(HEADER_FONT);
            run.setFontSize(HEADER_FONT_SIZE);
        }
    }
}
