package ai.legaldoc.reviser.diff;

import ai.legaldoc.reviser.format.FormatPreservingCopier;
import ai.legaldoc.reviser.model.Block;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Paragraph;
import ai.legaldoc.reviser.model.RgbColor;
import ai.legaldoc.reviser.model.Run;
import java.util.List;
import java.util.Objects;

/**
 * Writes diff regions into an output document: unchanged blocks as-is, removed blocks bracketed in red,
 * added blocks bracketed in green. A replacement renders as its removal followed by its addition.
 */
public class DiffRenderer {

    private final FormatPreservingCopier copier;

    public DiffRenderer(FormatPreservingCopier copier) {
        this.copier = Objects.requireNonNull(copier, "copier");
    }

    public void render(List<DiffRegion> regions, List<Block> oldBlocks, List<Block> newBlocks, Document target) {
        for (DiffRegion region : regions) {
            switch (region.type()) {
                case EQUAL -> copyRange(newBlocks, region.newStart(), region.newEnd(), target);
                case DELETE -> markRange(oldBlocks, region.oldStart(), region.oldEnd(), DiffColors.REMOVED, target);
                case INSERT -> markRange(newBlocks, region.newStart(), region.newEnd(), DiffColors.ADDED, target);
                case REPLACE -> {
                    markRange(oldBlocks, region.oldStart(), region.oldEnd(), DiffColors.REMOVED, target);
                    markRange(newBlocks, region.newStart(), region.newEnd(), DiffColors.ADDED, target);
                }
            }
        }
    }

    private void copyRange(List<Block> blocks, int start, int end, Document target) {
        for (int i = start; i < end; i++) {
            copier.copyBlock(blocks.get(i), target);
        }
    }

    private void markRange(List<Block> blocks, int start, int end, RgbColor color, Document target) {
        for (int i = start; i < end; i++) {
            Block block = blocks.get(i);
            switch (block.kind()) {
                case PARAGRAPH -> {
                    Paragraph paragraph = target.addParagraph();
                    copier.copyParagraph(block.asParagraph(), paragraph);
                    bracket(paragraph);
                    copier.recolor(paragraph, color);
                }
                case TABLE -> copier.copyTable(block.asTable(), target, color);
            }
        }
    }

    private void bracket(Paragraph paragraph) {
        List<Run> runs = paragraph.runs();
        if (runs.isEmpty()) {
            paragraph.addRun("[]");
            return;
        }
        Run first = runs.get(0);
        first.setText("[" + first.text());
        Run last = runs.get(runs.size() - 1);
        last.setText(last.text() + "]");
    }
}
