package ai.legaldoc.reviser.amend;

/**
 * Mode controlling which article editor performs amendments.
 */
public enum EditMode {
    PRODUCTION,
    DRY_RUN,
    MOCK;

    public static EditMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRODUCTION;
        }
        String normalized = raw.trim().replace('-', '_');
        for (EditMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported edit mode: " + raw);
    }
}
