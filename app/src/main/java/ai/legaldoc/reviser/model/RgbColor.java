package ai.legaldoc.reviser.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * An sRGB color with 8-bit channels. Hex conversions are exact in both directions.
 */
public record RgbColor(int red, int green, int blue) {

    private static final Pattern HEX = Pattern.compile("#?[0-9a-fA-F]{6}");

    public RgbColor {
        requireChannel(red, "red");
        requireChannel(green, "green");
        requireChannel(blue, "blue");
    }

    /**
     * Parses {@code RRGGBB} with an optional leading {@code #}. Values such as {@code auto} yield empty.
     */
    public static Optional<RgbColor> fromHex(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (!HEX.matcher(value).matches()) {
            return Optional.empty();
        }
        if (value.startsWith("#")) {
            value = value.substring(1);
        }
        return Optional.of(new RgbColor(
                Integer.parseInt(value.substring(0, 2), 16),
                Integer.parseInt(value.substring(2, 4), 16),
                Integer.parseInt(value.substring(4, 6), 16)));
    }

    public static RgbColor of(String hex) {
        return fromHex(hex).orElseThrow(() -> new IllegalArgumentException("Invalid hex color: " + hex));
    }

    /**
     * Uppercase {@code RRGGBB} without the leading hash, the form WordprocessingML stores.
     */
    public String toHex() {
        return String.format(Locale.ROOT, "%02X%02X%02X", red, green, blue);
    }

    @Override
    public String toString() {
        return "#" + toHex();
    }

    private static void requireChannel(int value, String name) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be between 0 and 255");
        }
    }
}
