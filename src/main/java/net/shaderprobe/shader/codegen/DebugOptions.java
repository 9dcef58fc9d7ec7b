package net.shaderprobe.shader.codegen;

import java.util.*;

/**
 * Per-request generator options: argument overrides for the synthesized call of a
 * helper function, and how the value is visualized.
 */
public class DebugOptions {
    private static final DebugOptions DEFAULTS = builder().build();

    private final Map<Integer, String> customArguments;
    private final VisualizationOptions visualization;

    private DebugOptions(Builder builder) {
        this.customArguments = Collections.unmodifiableMap(new TreeMap<>(builder.customArguments));
        this.visualization = builder.visualization;
    }

    public static DebugOptions defaults() {
        return DEFAULTS;
    }

    /**
     * GLSL expressions replacing the default argument at a parameter index.
     */
    public Map<Integer, String> getCustomArguments() {
        return customArguments;
    }

    public String getCustomArgument(int index) {
        return customArguments.get(index);
    }

    public VisualizationOptions getVisualization() {
        return visualization;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return String.format("DebugOptions{customArguments=%s, visualization=%s}", customArguments, visualization);
    }

    /**
     * Builder for debug options.
     */
    public static class Builder {
        private final Map<Integer, String> customArguments = new HashMap<>();
        private VisualizationOptions visualization = VisualizationOptions.defaults();

        public Builder customArgument(int index, String expression) {
            if (index < 0) {
                throw new IllegalArgumentException("Parameter index cannot be negative: " + index);
            }
            if (expression == null || expression.isBlank()) {
                throw new IllegalArgumentException("Argument expression cannot be empty for parameter " + index);
            }
            customArguments.put(index, expression.trim());
            return this;
        }

        public Builder customArguments(Map<Integer, String> arguments) {
            arguments.forEach(this::customArgument);
            return this;
        }

        public Builder visualization(VisualizationOptions visualization) {
            this.visualization = visualization != null ? visualization : VisualizationOptions.defaults();
            return this;
        }

        public Builder normalize(NormalizeMode mode) {
            this.visualization = new VisualizationOptions(mode, visualization.getStepEdge());
            return this;
        }

        public Builder stepEdge(Double edge) {
            this.visualization = visualization.withStepEdge(edge);
            return this;
        }

        public DebugOptions build() {
            return new DebugOptions(this);
        }
    }
}
