package ai.legaldoc.reviser.config;

/**
 * Which outputs a run produces: the updated law, the annotated comparison, or both.
 */
public enum Mode {
    REVISE,
    COMPARE,
    BOTH;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return BOTH;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public boolean revises() {
        return this != COMPARE;
    }

    public boolean compares() {
        return this != REVISE;
    }
}
