package ai.legaldoc.reviser.annotate;

import ai.legaldoc.reviser.diff.DiffColors;
import ai.legaldoc.reviser.model.Alignment;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Paragraph;
import ai.legaldoc.reviser.model.RgbColor;
import ai.legaldoc.reviser.model.Run;
import ai.legaldoc.reviser.model.Spacing;
import ai.legaldoc.reviser.model.Table;

/**
 * Header tables opening every comparison document: a grey legend explaining the colors and a black
 * title banner.
 */
public class ComparisonLegend {

    static final RgbColor LEGEND_FILL = RgbColor.of("CCCCCC");
    static final RgbColor TITLE_FILL = RgbColor.of("000000");
    static final RgbColor TITLE_COLOR = RgbColor.of("FFE8BF");
    static final RgbColor ADDED_HIGHLIGHT = RgbColor.of("33FF33");
    static final String TITLE = "Propis - analitički prikaz promena";
    private static final String FONT = "Arial";

    public void addTo(Document document) {
        addLegend(document);
        addTitle(document);
    }

    private void addLegend(Document document) {
        Table table = document.addTable(1, 1);
        table.cell(0, 0).setShading(LEGEND_FILL);
        Paragraph paragraph = table.cell(0, 0).addParagraph();
        paragraph.setAlignment(Alignment.CENTER);
        paragraph.setSpacing(new Spacing(5.0, 5.0, 1.0));
        legendRun(paragraph, "Radi lakšeg sagledavanja izmena i dopuna propisa, nova sadržina odredaba data je ");
        legendRun(paragraph, "zelenom").setShading(ADDED_HIGHLIGHT);
        legendRun(paragraph, ", prethodna ");
        legendRun(paragraph, "crvenom").setColor(DiffColors.REMOVED);
        legendRun(paragraph, " bojom, a nepromenjene odredbe nisu posebno označene, tako da pregledanjem crno-zelenog teksta "
                + "pregledate važeću, a crno-crvenog teksta, prethodnu verziju propisa. Prečišćen tekst bez crvenih i zelenih "
                + "oznaka i dalje možete videti na tabu ");
        legendRun(paragraph, "\"Tekst dokumenta\".").setItalic(true);
    }

    private void addTitle(Document document) {
        Table table = document.addTable(1, 1);
        table.cell(0, 0).setShading(TITLE_FILL);
        Paragraph paragraph = table.cell(0, 0).addParagraph();
        paragraph.setAlignment(Alignment.CENTER);
        paragraph.setSpacing(new Spacing(null, null, 1.1));
        paragraph.addRun(TITLE)
                .setBold(true)
                .setItalic(true)
                .setFontFamily(FONT)
                .setFontSize(13.0)
                .setColor(TITLE_COLOR);
    }

    private Run legendRun(Paragraph paragraph, String text) {
        return paragraph.addRun(text)
                .setBold(true)
                .setItalic(false)
                .setFontFamily(FONT);
    }
}
