package ai.legaldoc.reviser.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A paragraph block: paragraph-level formatting plus an ordered list of runs.
 */
public class Paragraph implements Block {

    private String styleName;
    private Alignment alignment = Alignment.UNSET;
    private Indentation indentation = Indentation.NONE;
    private Spacing spacing = Spacing.NONE;
    private RgbColor shading;
    private final List<Run> runs = new ArrayList<>();

    public Paragraph() {
    }

    public Paragraph(String text) {
        if (text != null && !text.isEmpty()) {
            runs.add(new Run(text));
        }
    }

    @Override
    public BlockKind kind() {
        return BlockKind.PARAGRAPH;
    }

    public String text() {
        StringBuilder builder = new StringBuilder();
        for (Run run : runs) {
            builder.append(run.text());
        }
        return builder.toString();
    }

    /**
     * Replaces the content with a single run carrying {@code text}. The new run keeps the formatting
     * of the current first run, if any.
     */
    public Paragraph setText(String text) {
        Run replacement = new Run(text);
        if (!runs.isEmpty()) {
            replacement.copyFormattingFrom(runs.get(0));
        }
        runs.clear();
        runs.add(replacement);
        return this;
    }

    public String styleName() {
        return styleName;
    }

    public Paragraph setStyleName(String styleName) {
        this.styleName = styleName;
        return this;
    }

    public Alignment alignment() {
        return alignment;
    }

    public Paragraph setAlignment(Alignment alignment) {
        this.alignment = alignment == null ? Alignment.UNSET : alignment;
        return this;
    }

    public Indentation indentation() {
        return indentation;
    }

    public Paragraph setIndentation(Indentation indentation) {
        this.indentation = indentation == null ? Indentation.NONE : indentation;
        return this;
    }

    public Spacing spacing() {
        return spacing;
    }

    public Paragraph setSpacing(Spacing spacing) {
        this.spacing = spacing == null ? Spacing.NONE : spacing;
        return this;
    }

    public RgbColor shading() {
        return shading;
    }

    public Paragraph setShading(RgbColor shading) {
        this.shading = shading;
        return this;
    }

    public List<Run> runs() {
        return Collections.unmodifiableList(runs);
    }

    public Run addRun(String text) {
        Run run = new Run(text);
        runs.add(run);
        return run;
    }

    public Paragraph addRun(Run run) {
        runs.add(Objects.requireNonNull(run, "run"));
        return this;
    }

    public void clearRuns() {
        runs.clear();
    }

    @Override
    public String toString() {
        return "Paragraph[" + text() + "]";
    }
}
