package ai.legaldoc.reviser.format;

import ai.legaldoc.reviser.model.Block;
import ai.legaldoc.reviser.model.Cell;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Paragraph;
import ai.legaldoc.reviser.model.RgbColor;
import ai.legaldoc.reviser.model.Run;
import ai.legaldoc.reviser.model.Table;
import java.util.Objects;

/**
 * Copies blocks into freshly created blocks of a target document, carrying content and formatting.
 * Formatting absent on the source is left untouched on the target. Nothing written to the target is
 * read back.
 */
public class FormatPreservingCopier {

    /** Fill applied to every copied table cell that had any shading in the source. */
    public static final RgbColor TABLE_HIGHLIGHT = RgbColor.of("8A084B");

    public void copyParagraph(Paragraph source, Paragraph target) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        target.setStyleName(source.styleName());
        if (source.alignment().isSet()) {
            target.setAlignment(source.alignment());
        }
        if (!source.indentation().isEmpty()) {
            target.setIndentation(target.indentation().overlay(source.indentation()));
        }
        if (!source.spacing().isEmpty()) {
            target.setSpacing(target.spacing().overlay(source.spacing()));
        }
        if (source.shading() != null) {
            target.setShading(source.shading());
        }
        target.clearRuns();
        for (Run run : source.runs()) {
            target.addRun(run.text()).copyFormattingFrom(run);
        }
    }

    public Table copyTable(Table source, Document targetDocument) {
        return copyTable(source, targetDocument, null);
    }

    /**
     * Appends a bordered copy of {@code source} to {@code targetDocument}. When {@code overrideColor} is
     * given, every copied run is recolored with it.
     */
    public Table copyTable(Table source, Document targetDocument, RgbColor overrideColor) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(targetDocument, "targetDocument");
        Table target = targetDocument.addTable(source.rowCount(), source.columnCount());
        target.setBordered(true);
        for (int r = 0; r < source.rowCount(); r++) {
            for (int c = 0; c < source.columnCount(); c++) {
                Cell sourceCell = source.cell(r, c);
                Cell targetCell = target.cell(r, c);
                if (sourceCell.shading() != null) {
                    targetCell.setShading(TABLE_HIGHLIGHT);
                }
                for (Paragraph sourceParagraph : sourceCell.paragraphs()) {
                    Paragraph targetParagraph = targetCell.addParagraph();
                    copyParagraph(sourceParagraph, targetParagraph);
                    if (overrideColor != null) {
                        recolor(targetParagraph, overrideColor);
                    }
                }
            }
        }
        return target;
    }

    /**
     * Appends a copy of any block to {@code targetDocument} and returns it.
     */
    public Block copyBlock(Block source, Document targetDocument) {
        return switch (source.kind()) {
            case PARAGRAPH -> {
                Paragraph paragraph = targetDocument.addParagraph();
                copyParagraph(source.asParagraph(), paragraph);
                yield paragraph;
            }
            case TABLE -> copyTable(source.asTable(), targetDocument);
        };
    }

    /**
     * Detached copy of a paragraph, for callers that splice it into a document themselves.
     */
    public Paragraph duplicate(Paragraph source) {
        Paragraph copy = new Paragraph();
        copyParagraph(source, copy);
        return copy;
    }

    public void recolor(Paragraph paragraph, RgbColor color) {
        for (Run run : paragraph.runs()) {
            run.setColor(color);
        }
    }
}
