package net.shaderprobe.shader.codegen;

import net.shaderprobe.shader.parser.GlslType;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class VisualizerTest {

    private final Visualizer visualizer = new Visualizer("fragColor");

    private String plain(String variable, GlslType type) {
        List<String> lines = visualizer.visualize(variable, type, VisualizationOptions.defaults());
        assertEquals(1, lines.size());
        return lines.get(0);
    }

    @Test
    public void testPlainVectors() {
        assertEquals("  fragColor = vec4(vec3(d), 1.0); // Debug: visualize float as grayscale", plain("d", GlslType.FLOAT));
        assertEquals("  fragColor = vec4(uv, 0.0, 1.0); // Debug: visualize vec2 (RG channels)", plain("uv", GlslType.VEC2));
        assertEquals("  fragColor = vec4(col, 1.0); // Debug: visualize vec3 as RGB", plain("col", GlslType.VEC3));
        assertEquals("  fragColor = c; // Debug: visualize vec4 directly", plain("c", GlslType.VEC4));
    }

    @Test
    public void testMatrices() {
        assertEquals("  fragColor = vec4(m[0], m[1]); // Debug: visualize mat2 columns", plain("m", GlslType.MAT2));
        assertEquals("  fragColor = vec4(m[0], 1.0); // Debug: visualize mat3 first column", plain("m", GlslType.MAT3));
        assertEquals("  fragColor = m[0]; // Debug: visualize mat4 first column", plain("m", GlslType.MAT4));
    }

    @Test
    public void testAbsNormalization() {
        List<String> lines = visualizer.visualize("d", GlslType.FLOAT, VisualizationOptions.normalized(NormalizeMode.ABS));

        assertEquals("  fragColor = vec4(vec3((abs(d) / (abs(d) + 1.0))), 1.0); // Debug: abs normalized float", lines.get(0));
    }

    @Test
    public void testVec4NormalizesColorChannels() {
        List<String> lines = visualizer.visualize("c", GlslType.VEC4, VisualizationOptions.normalized(NormalizeMode.SOFT));

        assertEquals("  fragColor = vec4((c.rgb / (abs(c.rgb) + vec3(1.0)) * 0.5 + 0.5), 1.0); // Debug: soft normalized vec4",
            lines.get(0));
    }

    @Test
    public void testMatricesIgnoreNormalization() {
        List<String> lines = visualizer.visualize("m", GlslType.MAT4, VisualizationOptions.normalized(NormalizeMode.SOFT));

        assertEquals("  fragColor = m[0]; // Debug: visualize mat4 first column", lines.get(0));
    }

    @Test
    public void testStepLineUsesFixedPrecision() {
        List<String> lines = visualizer.visualize("col", GlslType.VEC3, VisualizationOptions.defaults().withStepEdge(0.25));

        assertEquals(2, lines.size());
        assertEquals("  fragColor = vec4(step(vec3(0.2500), fragColor.rgb), 1.0); // Debug: step threshold", lines.get(1));
    }

    @Test
    public void testUnknownTypeIsMagenta() {
        assertEquals("  fragColor = vec4(1.0, 0.0, 1.0, 1.0); // Debug: unknown type", plain("x", null));
    }
}
