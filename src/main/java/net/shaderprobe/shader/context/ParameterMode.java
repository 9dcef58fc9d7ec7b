package net.shaderprobe.shader.context;

import com.google.gson.annotations.SerializedName;

/**
 * Where the argument for a helper parameter comes from when the helper is called
 * from the synthesized entry function.
 */
public enum ParameterMode {
    /** Derived from normalized screen coordinates. */
    @SerializedName("uv")
    UV,
    /** Derived from aspect-corrected coordinates centered on the screen, -1 to 1. */
    @SerializedName("centered-uv")
    CENTERED_UV,
    /** A user-edited expression. */
    @SerializedName("custom")
    CUSTOM,
    /** A value picked from a preset list, stored like a custom expression. */
    @SerializedName("preset")
    PRESET
}
