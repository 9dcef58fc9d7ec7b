package net.shaderprobe.shader.context;

import java.util.Objects;

/**
 * One parameter of the function being debugged, with the candidate argument
 * expressions a host can choose between.
 */
public class DebugParameterInfo {
    private final String name;
    private final String type;
    private final String uvValue;
    private final String centeredUvValue;
    private final String defaultCustomValue;
    private ParameterMode mode;
    private String customValue;

    public DebugParameterInfo(String name, String type, String uvValue, String centeredUvValue,
                              String defaultCustomValue, ParameterMode mode) {
        this.name = name;
        this.type = type;
        this.uvValue = uvValue;
        this.centeredUvValue = centeredUvValue;
        this.defaultCustomValue = defaultCustomValue;
        this.mode = mode;
        this.customValue = defaultCustomValue;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public String getUvValue() {
        return uvValue;
    }

    public String getCenteredUvValue() {
        return centeredUvValue;
    }

    public String getDefaultCustomValue() {
        return defaultCustomValue;
    }

    public ParameterMode getMode() {
        return mode;
    }

    public void setMode(ParameterMode mode) {
        this.mode = mode;
    }

    public String getCustomValue() {
        return customValue;
    }

    public void setCustomValue(String customValue) {
        this.customValue = customValue;
    }

    /**
     * The expression selected by the current mode.
     */
    public String selectedValue() {
        ParameterMode effective = mode != null ? mode : ParameterMode.CUSTOM;
        switch (effective) {
            case UV:
                return uvValue;
            case CENTERED_UV:
                return centeredUvValue;
            default:
                return customValue != null && !customValue.isBlank() ? customValue : defaultCustomValue;
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DebugParameterInfo)) return false;
        DebugParameterInfo other = (DebugParameterInfo) obj;
        return Objects.equals(name, other.name)
            && Objects.equals(type, other.type)
            && Objects.equals(uvValue, other.uvValue)
            && Objects.equals(centeredUvValue, other.centeredUvValue)
            && Objects.equals(defaultCustomValue, other.defaultCustomValue)
            && mode == other.mode
            && Objects.equals(customValue, other.customValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, uvValue, centeredUvValue, defaultCustomValue, mode, customValue);
    }

    @Override
    public String toString() {
        return String.format("DebugParameterInfo{%s %s, mode=%s, value='%s'}", type, name, mode, selectedValue());
    }
}
