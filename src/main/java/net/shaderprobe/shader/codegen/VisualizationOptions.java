package net.shaderprobe.shader.codegen;

import java.util.Objects;

/**
 * Post-processing applied to the visualized value: normalization and an optional
 * binary step threshold.
 */
public class VisualizationOptions {
    private static final VisualizationOptions DEFAULTS = new VisualizationOptions(NormalizeMode.OFF, null);

    private final NormalizeMode normalizeMode;
    private final Double stepEdge;

    public VisualizationOptions(NormalizeMode normalizeMode, Double stepEdge) {
        this.normalizeMode = normalizeMode != null ? normalizeMode : NormalizeMode.OFF;
        this.stepEdge = stepEdge;
    }

    /**
     * Plain visualization: no normalization, no threshold.
     */
    public static VisualizationOptions defaults() {
        return DEFAULTS;
    }

    public static VisualizationOptions normalized(NormalizeMode mode) {
        return new VisualizationOptions(mode, null);
    }

    public VisualizationOptions withStepEdge(Double edge) {
        return new VisualizationOptions(normalizeMode, edge);
    }

    public NormalizeMode getNormalizeMode() {
        return normalizeMode;
    }

    /**
     * Threshold for step(), or null when disabled.
     */
    public Double getStepEdge() {
        return stepEdge;
    }

    public boolean hasStep() {
        return stepEdge != null;
    }

    public boolean isPlain() {
        return normalizeMode == NormalizeMode.OFF && stepEdge == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VisualizationOptions)) return false;
        VisualizationOptions other = (VisualizationOptions) obj;
        return normalizeMode == other.normalizeMode && Objects.equals(stepEdge, other.stepEdge);
    }

    @Override
    public int hashCode() {
        return Objects.hash(normalizeMode, stepEdge);
    }

    @Override
    public String toString() {
        return String.format("VisualizationOptions{normalize=%s, step=%s}", normalizeMode.getName(), stepEdge);
    }
}
