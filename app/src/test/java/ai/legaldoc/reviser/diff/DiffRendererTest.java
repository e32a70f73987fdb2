package ai.legaldoc.reviser.diff;

import static org.assertj.core.api.Assertions.assertThat;

import ai.legaldoc.reviser.format.FormatPreservingCopier;
import ai.legaldoc.reviser.model.Block;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Paragraph;
import ai.legaldoc.reviser.model.Run;
import ai.legaldoc.reviser.model.Table;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiffRendererTest {

    private final DiffRenderer renderer = new DiffRenderer(new FormatPreservingCopier());

    @Test
    void rendersReplacementAsRemovalThenAddition() {
        List<Block> oldBlocks = List.of(new Paragraph("Član 1"), new Paragraph("A"), new Paragraph("B"));
        List<Block> newBlocks = List.of(new Paragraph("Član 1*"), new Paragraph("A"), new Paragraph("C"));
        List<DiffRegion> regions = new StructuralDiffEngine().diff(oldBlocks, newBlocks);
        Document target = new Document();

        renderer.render(regions, oldBlocks, newBlocks, target);

        assertThat(target.paragraphs()).extracting(Paragraph::text).containsExactly("Član 1*", "A", "[B]", "[C]");
        assertThat(target.paragraphs().get(0).runs().get(0).color()).isNull();
        assertThat(target.paragraphs().get(2).runs().get(0).color()).isEqualTo(DiffColors.REMOVED);
        assertThat(target.paragraphs().get(3).runs().get(0).color()).isEqualTo(DiffColors.ADDED);
    }

    @Test
    void bracketsFirstAndLastRunOnly() {
        Paragraph removed = new Paragraph();
        removed.addRun("prvi ").setBold(true);
        removed.addRun("srednji ");
        removed.addRun("poslednji");
        Document target = new Document();

        renderer.render(List.of(new DiffRegion(RegionType.DELETE, 0, 1, 0, 0)), List.of(removed), List.of(), target);

        List<Run> runs = target.paragraphs().get(0).runs();
        assertThat(runs).extracting(Run::text).containsExactly("[prvi ", "srednji ", "poslednji]");
        assertThat(runs.get(0).bold()).isTrue();
        assertThat(runs).allSatisfy(run -> assertThat(run.color()).isEqualTo(DiffColors.REMOVED));
        assertThat(removed.text()).isEqualTo("prvi srednji poslednji");
    }

    @Test
    void emptyParagraphGetsEmptyBrackets() {
        Document target = new Document();

        renderer.render(List.of(new DiffRegion(RegionType.INSERT, 0, 0, 0, 1)), List.of(), List.of(new Paragraph()), target);

        assertThat(target.paragraphs().get(0).text()).isEqualTo("[]");
        assertThat(target.paragraphs().get(0).runs().get(0).color()).isEqualTo(DiffColors.ADDED);
    }

    @Test
    void removedTablesAreRecolored() {
        Table table = new Table(1, 1);
        table.cell(0, 0).addParagraph().addRun("ćelija");
        Document target = new Document();

        renderer.render(List.of(new DiffRegion(RegionType.DELETE, 0, 1, 0, 0)), List.of(table), List.of(), target);

        Table rendered = target.get(0).asTable();
        assertThat(rendered.cell(0, 0).text()).isEqualTo("ćelija");
        assertThat(rendered.cell(0, 0).paragraphs().get(0).runs().get(0).color()).isEqualTo(DiffColors.REMOVED);
    }
}
