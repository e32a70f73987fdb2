package ai.legaldoc.reviser.diff;

import ai.legaldoc.reviser.model.RgbColor;

/**
 * Colors of annotated comparison output.
 */
public final class DiffColors {

    public static final RgbColor REMOVED = RgbColor.of("FF0000");
    public static final RgbColor ADDED = RgbColor.of("00CC33");

    private DiffColors() {
    }
}
