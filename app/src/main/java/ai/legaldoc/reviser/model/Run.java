package ai.legaldoc.reviser.model;

import java.util.Objects;

/**
 * A stretch of paragraph text sharing one set of character properties.
 * Boolean and optional properties left {@code null} inherit from the paragraph style.
 */
public class Run {

    private String text;
    private Boolean bold;
    private Boolean italic;
    private Boolean underline;
    private String fontFamily;
    private Double fontSize;
    private RgbColor color;
    private RgbColor shading;

    public Run() {
        this("");
    }

    public Run(String text) {
        this.text = text == null ? "" : text;
    }

    public String text() {
        return text;
    }

    public Run setText(String text) {
        this.text = text == null ? "" : text;
        return this;
    }

    public Boolean bold() {
        return bold;
    }

    public Run setBold(Boolean bold) {
        this.bold = bold;
        return this;
    }

    public Boolean italic() {
        return italic;
    }

    public Run setItalic(Boolean italic) {
        this.italic = italic;
        return this;
    }

    public Boolean underline() {
        return underline;
    }

    public Run setUnderline(Boolean underline) {
        this.underline = underline;
        return this;
    }

    public String fontFamily() {
        return fontFamily;
    }

    public Run setFontFamily(String fontFamily) {
        this.fontFamily = fontFamily;
        return this;
    }

    public Double fontSize() {
        return fontSize;
    }

    public Run setFontSize(Double fontSize) {
        this.fontSize = fontSize;
        return this;
    }

    public RgbColor color() {
        return color;
    }

    public Run setColor(RgbColor color) {
        this.color = color;
        return this;
    }

    public RgbColor shading() {
        return shading;
    }

    public Run setShading(RgbColor shading) {
        this.shading = shading;
        return this;
    }

    /**
     * Copies every character property except the text.
     */
    public Run copyFormattingFrom(Run source) {
        Objects.requireNonNull(source, "source");
        this.bold = source.bold;
        this.italic = source.italic;
        this.underline = source.underline;
        this.fontFamily = source.fontFamily;
        this.fontSize = source.fontSize;
        this.color = source.color;
        this.shading = source.shading;
        return this;
    }

    @Override
    public String toString() {
        return "Run[" + text + "]";
    }
}
