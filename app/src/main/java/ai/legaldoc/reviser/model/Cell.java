package ai.legaldoc.reviser.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A table cell holding its own paragraphs.
 */
public class Cell {

    private RgbColor shading;
    private final List<Paragraph> paragraphs = new ArrayList<>();

    public RgbColor shading() {
        return shading;
    }

    public Cell setShading(RgbColor shading) {
        this.shading = shading;
        return this;
    }

    public List<Paragraph> paragraphs() {
        return Collections.unmodifiableList(paragraphs);
    }

    public Paragraph addParagraph() {
        Paragraph paragraph = new Paragraph();
        paragraphs.add(paragraph);
        return paragraph;
    }

    public String text() {
        StringBuilder builder = new StringBuilder();
        for (Paragraph paragraph : paragraphs) {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(paragraph.text());
        }
        return builder.toString();
    }
}
