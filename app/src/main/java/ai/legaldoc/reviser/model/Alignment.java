package ai.legaldoc.reviser.model;

import java.util.Locale;

/**
 * Paragraph alignment. {@link #UNSET} means the paragraph inherits the alignment of its style.
 */
public enum Alignment {
    LEFT,
    CENTER,
    RIGHT,
    JUSTIFY,
    UNSET;

    public static Alignment from(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNSET;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "left", "start" -> LEFT;
            case "center" -> CENTER;
            case "right", "end" -> RIGHT;
            case "justify", "both" -> JUSTIFY;
            default -> UNSET;
        };
    }

    public boolean isSet() {
        return this != UNSET;
    }
}
