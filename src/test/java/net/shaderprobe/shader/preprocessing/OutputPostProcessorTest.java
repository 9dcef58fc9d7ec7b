package net.shaderprobe.shader.preprocessing;

import net.shaderprobe.shader.codegen.NormalizeMode;
import net.shaderprobe.shader.config.ShaderDebugConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OutputPostProcessorTest {

    private static final String SHADER = """
        void mainImage(out vec4 fragColor, in vec2 fragCoord) {
          fragColor = vec4(fragCoord, 0.0, 1.0);
        }""";

    private final OutputPostProcessor processor = new OutputPostProcessor(ShaderDebugConfig.defaults());

    @Test
    public void testNothingToApply() {
        assertNull(processor.apply(SHADER, NormalizeMode.OFF, null));
        assertNull(processor.apply(SHADER, null, null));
    }

    @Test
    public void testSoftNormalizationBeforeClosingBrace() {
        String result = processor.apply(SHADER, NormalizeMode.SOFT, null);

        String expected = String.join("\n",
            "void mainImage(out vec4 fragColor, in vec2 fragCoord) {",
            "  fragColor = vec4(fragCoord, 0.0, 1.0);",
            "  fragColor.rgb = fragColor.rgb / (abs(fragColor.rgb) + vec3(1.0)) * 0.5 + 0.5;",
            "}");
        assertEquals(expected, result);
    }

    @Test
    public void testAbsNormalizationThenStep() {
        String result = processor.apply(SHADER, NormalizeMode.ABS, 0.5);

        assertNotNull(result);
        int abs = result.indexOf("fragColor.rgb = abs(fragColor.rgb) / (abs(fragColor.rgb) + vec3(1.0));");
        int step = result.indexOf("fragColor = vec4(step(vec3(0.5000), fragColor.rgb), 1.0);");
        assertTrue(abs > 0);
        assertTrue(step > abs);
        assertTrue(result.endsWith("\n}"));
    }

    @Test
    public void testClosingBraceSharingLine() {
        String shader = "void mainImage(out vec4 fragColor, in vec2 fragCoord) { fragColor = vec4(1.0); }";

        String result = processor.apply(shader, NormalizeMode.OFF, 0.25);

        assertNotNull(result);
        String[] lines = result.split("\n");
        assertEquals(3, lines.length);
        assertTrue(lines[1].contains("step(vec3(0.2500)"));
        assertEquals("}", lines[2]);
    }

    @Test
    public void testHelpersAfterEntryAreKept() {
        String shader = SHADER + "\nfloat helper(float x) {\n  return x;\n}";

        String result = processor.apply(shader, NormalizeMode.SOFT, null);

        assertTrue(result.endsWith("float helper(float x) {\n  return x;\n}"));
    }

    @Test
    public void testMissingOrUnclosedEntry() {
        assertNull(processor.apply("float f(float x) {\n  return x;\n}", NormalizeMode.SOFT, null));
        assertNull(processor.apply("void mainImage(out vec4 fragColor, in vec2 fragCoord) {\n  fragColor = vec4(1.0);",
            NormalizeMode.SOFT, null));
    }
}
