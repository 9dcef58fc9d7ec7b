package net.shaderprobe.shader;

import net.shaderprobe.shader.codegen.DebugOptions;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static net.shaderprobe.shader.ShaderDebuggerTest.assertBalanced;
import static net.shaderprobe.shader.ShaderDebuggerTest.count;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for lines inside helper functions, which are wrapped and called from a
 * synthesized entry function.
 */
public class ShaderDebuggerHelperTest {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShaderDebuggerHelperTest.class);

    private final ShaderDebugger debugger = new ShaderDebugger();

    @Test
    public void testUncalledHelperReturn() {
        String shader = """
            float circle(vec2 st) {
              return length(st);
            }
            """;

        String result = debugger.transform(shader, 1, null);
        LOGGER.info("Debug program:\n{}", result);

        assertNotNull(result);
        assertTrue(result.contains("float _dbgReturn = length(st)"));
        assertTrue(result.contains("return _dbgReturn;"));
        assertTrue(result.contains("vec2 uv = fragCoord / iResolution.xy"));
        assertTrue(result.contains("float result = circle(uv)"));
        assertTrue(result.contains("fragColor = vec4(vec3(result), 1.0)"));
        assertBalanced(result);
    }

    @Test
    public void testSingleLineHelperReturn() {
        String shader = "float circle(vec2 st){ return length(st); }";

        String result = debugger.transform(shader, 0, null);
        LOGGER.info("Debug program:\n{}", result);

        assertNotNull(result);
        assertTrue(result.startsWith("float circle(vec2 st){ float _dbgReturn = length(st);\n  return _dbgReturn;\n}"));
        assertTrue(result.contains("vec2 uv = fragCoord / iResolution.xy;"));
        assertTrue(result.contains("float result = circle(uv);"));
        assertTrue(result.contains("fragColor = vec4(vec3(result), 1.0);"));
        assertEquals(1, count(result, "void mainImage"));
        assertBalanced(result);
    }

    @Test
    public void testHelperRetypedToTarget() {
        String shader = """
            float getValue(vec2 p) {
              vec3 tint = vec3(p, 0.25);
              return tint.x + tint.y;
            }
            """;

        String result = debugger.transform(shader, 1, null);

        assertNotNull(result);
        assertTrue(result.startsWith("vec3 getValue(vec2 p) {"));
        assertTrue(result.contains("return tint;"));
        assertFalse(result.contains("tint.x + tint.y"));
        assertTrue(result.contains("vec3 result = getValue(uv);"));
        assertTrue(result.contains("fragColor = vec4(result, 1.0); // Debug: visualize vec3 as RGB"));
    }

    @Test
    public void testCallSiteInEntryIsReused() {
        String shader = """
            float sdCircle(vec2 p, float r) {
              float d = length(p) - r;
              return d;
            }

            void mainImage(out vec4 fragColor, in vec2 fragCoord) {
              vec2 uv = fragCoord / iResolution.xy;
              float radius = 0.3;
              float d = sdCircle(uv, radius);
              fragColor = vec4(vec3(d), 1.0);
            }
            """;

        String result = debugger.transform(shader, 1, null);
        LOGGER.info("Debug program:\n{}", result);

        assertNotNull(result);
        assertTrue(result.contains("float radius = 0.3;"));
        assertTrue(result.contains("float result = sdCircle(uv, radius);"));
        assertEquals(1, count(result, "void mainImage"));
        assertEquals(1, count(result, "vec2 uv = fragCoord / iResolution\\.xy;"));
        assertFalse(result.contains("fragColor = vec4(vec3(d), 1.0)"));
        assertBalanced(result);
    }

    @Test
    public void testExpressionArgumentsFallBackToDefaults() {
        String shader = """
            float sdCircle(vec2 p, float r) {
              float d = length(p) - r;
              return d;
            }

            void mainImage(out vec4 fragColor, in vec2 fragCoord) {
              vec2 uv = fragCoord / iResolution.xy;
              float d = sdCircle(uv - 0.5, 0.3);
              fragColor = vec4(vec3(d), 1.0);
            }
            """;

        String result = debugger.transform(shader, 1, null);

        assertNotNull(result);
        assertTrue(result.contains("vec2 uv = fragCoord / iResolution.xy;"));
        assertTrue(result.contains("float result = sdCircle(uv, 0.5);"));
    }

    @Test
    public void testEntryBeforeHelperIsReplaced() {
        String shader = """
            void mainImage(out vec4 fragColor, in vec2 fragCoord) {
              vec2 uv = fragCoord / iResolution.xy;
              fragColor = vec4(vec3(shade(uv)), 1.0);
            }

            float shade(vec2 p) {
              float v = p.x * p.y;
              return v;
            }
            """;

        String result = debugger.transform(shader, 6, null);

        assertNotNull(result);
        assertEquals(1, count(result, "void mainImage"));
        assertEquals(1, count(result, "vec2 uv = fragCoord / iResolution\\.xy;"));
        assertTrue(result.contains("float result = shade(uv);"));
        assertTrue(result.indexOf("float shade(vec2 p)") < result.indexOf("void mainImage"));
        assertBalanced(result);
    }

    @Test
    public void testUndefinedCallArgumentUsesDefaults() {
        String shader = """
            vec2 foldX(vec2 p) {
              p.x = abs(p.x);
              return p;
            }

            void mainImage(out vec4 fragColor, in vec2 fragCoord) {
              vec2 q = foldX(p);
              fragColor = vec4(q, 0.0, 1.0);
            }
            """;

        String result = debugger.transform(shader, 1, null);

        assertNotNull(result);
        assertTrue(result.contains("vec2 result = foldX(uv);"));
        assertTrue(result.contains("fragColor = vec4(result, 0.0, 1.0); // Debug: visualize vec2 (RG channels)"));
    }

    @Test
    public void testCustomArgumentOverridesDefault() {
        String shader = """
            float sdCircle(vec2 p, float r) {
              float d = length(p) - r;
              return d;
            }
            """;
        DebugOptions options = DebugOptions.builder().customArgument(1, "0.25").build();

        String result = debugger.transform(shader, 1, null, options);

        assertNotNull(result);
        assertTrue(result.contains("float result = sdCircle(uv, 0.25);"));
    }

    @Test
    public void testOutParameterGetsLocal() {
        String shader = """
            float split(vec2 p, out float rest) {
              rest = p.y;
              float first = p.x;
              return first;
            }
            """;

        String result = debugger.transform(shader, 2, null);

        assertNotNull(result);
        assertTrue(result.contains("float _dbgArg1 = 0.5;"));
        assertTrue(result.contains("float result = split(uv, _dbgArg1);"));
    }

    @Test
    public void testReturnInsideLoopIsCaptured() {
        String shader = """
            vec3 palette(float t) {
              vec3 a = vec3(0.5);
              for (int i = 0; i < 2; i++) {
                a *= 0.9;
              }
              return a + t;
            }
            """;

        String result = debugger.transform(shader, 5, null);

        assertNotNull(result);
        assertTrue(result.contains("vec3 _dbgReturn = a + t;"));
        assertTrue(result.contains("return _dbgReturn;"));
        assertTrue(result.contains("vec3 result = palette(0.5);"));
        assertFalse(result.contains("for ("));
        assertBalanced(result);
    }

    @Test
    public void testVoidHelperReturnHasNoTarget() {
        String shader = """
            void touch(inout vec3 c) {
              c *= 0.5;
              return;
            }
            """;

        assertNull(debugger.transform(shader, 2, null));
        assertNotNull(debugger.transform(shader, 1, null));
    }
}
