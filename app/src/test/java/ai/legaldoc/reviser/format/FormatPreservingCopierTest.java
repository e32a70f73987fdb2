package ai.legaldoc.reviser.format;

import static org.assertj.core.api.Assertions.assertThat;

import ai.legaldoc.reviser.model.Alignment;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Indentation;
import ai.legaldoc.reviser.model.Paragraph;
import ai.legaldoc.reviser.model.RgbColor;
import ai.legaldoc.reviser.model.Run;
import ai.legaldoc.reviser.model.Spacing;
import ai.legaldoc.reviser.model.Table;
import org.junit.jupiter.api.Test;

class FormatPreservingCopierTest {

    private final FormatPreservingCopier copier = new FormatPreservingCopier();

    @Test
    void copiesParagraphFormattingAndRuns() {
        Paragraph source = new Paragraph();
        source.setStyleName("Heading2")
                .setAlignment(Alignment.JUSTIFY)
                .setIndentation(new Indentation(36.0, null, 18.0, null))
                .setSpacing(new Spacing(6.0, 12.0, 1.15))
                .setShading(RgbColor.of("EEEEEE"));
        source.addRun("Bold ").setBold(true).setFontFamily("Arial").setFontSize(11.0);
        source.addRun("red").setColor(RgbColor.of("FF0000")).setUnderline(true);

        Paragraph target = new Paragraph("stale");
        copier.copyParagraph(source, target);

        assertThat(target.styleName()).isEqualTo("Heading2");
        assertThat(target.alignment()).isEqualTo(Alignment.JUSTIFY);
        assertThat(target.indentation()).isEqualTo(new Indentation(36.0, null, 18.0, null));
        assertThat(target.spacing()).isEqualTo(new Spacing(6.0, 12.0, 1.15));
        assertThat(target.shading()).isEqualTo(RgbColor.of("EEEEEE"));
        assertThat(target.runs()).extracting(Run::text).containsExactly("Bold ", "red");
        Run first = target.runs().get(0);
        assertThat(first.bold()).isTrue();
        assertThat(first.fontFamily()).isEqualTo("Arial");
        assertThat(first.fontSize()).isEqualTo(11.0);
        Run second = target.runs().get(1);
        assertThat(second.color()).isEqualTo(new RgbColor(255, 0, 0));
        assertThat(second.underline()).isTrue();
        assertThat(second.bold()).isNull();
    }

    @Test
    void leavesTargetFormattingWhenSourceHasNone() {
        Paragraph source = new Paragraph("plain");
        Paragraph target = new Paragraph();
        target.setAlignment(Alignment.CENTER).setSpacing(new Spacing(1.0, 2.0, null));

        copier.copyParagraph(source, target);

        assertThat(target.alignment()).isEqualTo(Alignment.CENTER);
        assertThat(target.spacing()).isEqualTo(new Spacing(1.0, 2.0, null));
        assertThat(target.text()).isEqualTo("plain");
    }

    @Test
    void copiedRunsAreIndependentOfSource() {
        Paragraph source = new Paragraph("text");
        Paragraph copy = copier.duplicate(source);

        copy.runs().get(0).setText("changed");

        assertThat(source.text()).isEqualTo("text");
    }

    @Test
    void copiesTableWithHighlightAndOverrideColor() {
        Table source = new Table(2, 2);
        source.cell(0, 0).setShading(RgbColor.of("CCCCCC"));
        source.cell(0, 0).addParagraph().addRun("header").setColor(RgbColor.of("000000"));
        source.cell(1, 1).addParagraph().addRun("value");
        Document target = new Document();

        Table copy = copier.copyTable(source, target, RgbColor.of("00CC33"));

        assertThat(target.blocks()).containsExactly(copy);
        assertThat(copy.bordered()).isTrue();
        assertThat(copy.rowCount()).isEqualTo(2);
        assertThat(copy.columnCount()).isEqualTo(2);
        assertThat(copy.cell(0, 0).shading()).isEqualTo(FormatPreservingCopier.TABLE_HIGHLIGHT);
        assertThat(copy.cell(1, 1).shading()).isNull();
        assertThat(copy.cell(0, 0).text()).isEqualTo("header");
        assertThat(copy.cell(0, 0).paragraphs().get(0).runs().get(0).color()).isEqualTo(RgbColor.of("00CC33"));
        assertThat(copy.cell(1, 1).paragraphs().get(0).runs().get(0).color()).isEqualTo(RgbColor.of("00CC33"));
    }

    @Test
    void copyBlockDispatchesOnKind() {
        Document target = new Document();

        copier.copyBlock(new Paragraph("p"), target);
        copier.copyBlock(new Table(1, 1), target);

        assertThat(target.size()).isEqualTo(2);
        assertThat(target.get(0).isParagraph()).isTrue();
        assertThat(target.get(1).asTable().bordered()).isTrue();
    }
}
