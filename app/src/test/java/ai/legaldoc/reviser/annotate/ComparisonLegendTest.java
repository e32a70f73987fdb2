package ai.legaldoc.reviser.annotate;

import static org.assertj.core.api.Assertions.assertThat;

import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Paragraph;
import ai.legaldoc.reviser.model.Run;
import ai.legaldoc.reviser.model.Table;
import org.junit.jupiter.api.Test;

class ComparisonLegendTest {

    @Test
    void addsLegendThenTitleTable() {
        Document document = new Document();

        new ComparisonLegend().addTo(document);

        assertThat(document.size()).isEqualTo(2);
        Table legend = document.get(0).asTable();
        assertThat(legend.cell(0, 0).shading()).isEqualTo(ComparisonLegend.LEGEND_FILL);
        assertThat(legend.cell(0, 0).text()).contains("zelenom").contains("crvenom").endsWith("\"Tekst dokumenta\".");
        Paragraph legendParagraph = legend.cell(0, 0).paragraphs().get(0);
        assertThat(legendParagraph.runs().get(1).shading()).isEqualTo(ComparisonLegend.ADDED_HIGHLIGHT);
        Run last = legendParagraph.runs().get(legendParagraph.runs().size() - 1);
        assertThat(last.italic()).isTrue();

        Table title = document.get(1).asTable();
        assertThat(title.cell(0, 0).shading()).isEqualTo(ComparisonLegend.TITLE_FILL);
        Run titleRun = title.cell(0, 0).paragraphs().get(0).runs().get(0);
        assertThat(titleRun.text()).isEqualTo(ComparisonLegend.TITLE);
        assertThat(titleRun.color()).isEqualTo(ComparisonLegend.TITLE_COLOR);
        assertThat(titleRun.fontSize()).isEqualTo(13.0);
    }
}
