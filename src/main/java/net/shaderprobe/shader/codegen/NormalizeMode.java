package net.shaderprobe.shader.codegen;

import java.util.Locale;

/**
 * How a visualized value is remapped into the displayable 0..1 range.
 */
public enum NormalizeMode {
    /** Values are written as they are. */
    OFF,
    /** v / (|v| + 1) * 0.5 + 0.5: zero maps to grey, sign shows as darker or brighter. */
    SOFT,
    /** |v| / (|v| + 1): zero maps to black, large magnitudes approach white. */
    ABS;

    /**
     * Parses a mode name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name is not a known mode
     */
    public static NormalizeMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return OFF;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
