package net.shaderprobe.shader.codegen;

import net.shaderprobe.shader.parser.GlslType;

import java.util.*;

/**
 * Produces the statements that write a value into the color output so it can be
 * read back as a pixel.
 */
public class Visualizer {
    private static final String INDENT = "  ";

    private final String colorOutput;

    public Visualizer(String colorOutput) {
        this.colorOutput = colorOutput;
    }

    /**
     * Visualization lines for a variable, one line plus an optional step threshold.
     */
    public List<String> visualize(String variable, GlslType type, VisualizationOptions options) {
        List<String> lines = new ArrayList<>();
        lines.add(assignment(variable, type, options.getNormalizeMode()));

        if (options.hasStep()) {
            lines.add(stepLine(options.getStepEdge()));
        }
        return lines;
    }

    /**
     * Magenta sentinel for a value whose type cannot be displayed.
     */
    public String unknownType() {
        return INDENT + colorOutput + " = vec4(1.0, 0.0, 1.0, 1.0); // Debug: unknown type";
    }

    /**
     * Binary threshold applied to whatever the color output holds.
     */
    public String stepLine(double edge) {
        return String.format(Locale.ROOT, "%s%s = vec4(step(vec3(%.4f), %s.rgb), 1.0); // Debug: step threshold",
            INDENT, colorOutput, edge, colorOutput);
    }

    private String assignment(String v, GlslType type, NormalizeMode mode) {
        if (type == null) {
            return unknownType();
        }
        if (type.isMatrix() || mode == NormalizeMode.OFF) {
            return plain(v, type);
        }

        String label = mode.getName() + " normalized " + type.getKeyword();
        switch (type) {
            case FLOAT:
                return emit("vec4(vec3(" + normalize(v, "1.0", mode) + "), 1.0)", label);
            case VEC2:
                return emit("vec4(" + normalize(v, "vec2(1.0)", mode) + ", 0.0, 1.0)", label);
            case VEC3:
                return emit("vec4(" + normalize(v, "vec3(1.0)", mode) + ", 1.0)", label);
            case VEC4:
                return emit("vec4(" + normalize(v + ".rgb", "vec3(1.0)", mode) + ", 1.0)", label);
            default:
                return plain(v, type);
        }
    }

    private String plain(String v, GlslType type) {
        switch (type) {
            case FLOAT:
                return emit("vec4(vec3(" + v + "), 1.0)", "visualize float as grayscale");
            case VEC2:
                return emit("vec4(" + v + ", 0.0, 1.0)", "visualize vec2 (RG channels)");
            case VEC3:
                return emit("vec4(" + v + ", 1.0)", "visualize vec3 as RGB");
            case VEC4:
                return emit(v, "visualize vec4 directly");
            case MAT2:
                return emit("vec4(" + v + "[0], " + v + "[1])", "visualize mat2 columns");
            case MAT3:
                return emit("vec4(" + v + "[0], 1.0)", "visualize mat3 first column");
            case MAT4:
                return emit(v + "[0]", "visualize mat4 first column");
            default:
                return unknownType();
        }
    }

    private static String normalize(String expr, String one, NormalizeMode mode) {
        if (mode == NormalizeMode.SOFT) {
            return "(" + expr + " / (abs(" + expr + ") + " + one + ") * 0.5 + 0.5)";
        }
        return "(abs(" + expr + ") / (abs(" + expr + ") + " + one + "))";
    }

    private String emit(String value, String comment) {
        return INDENT + colorOutput + " = " + value + "; // Debug: " + comment;
    }
}
