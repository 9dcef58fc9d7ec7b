package net.shaderprobe.shader.context;

import net.shaderprobe.shader.config.ShaderDebugConfig;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class FunctionContextExtractorTest {

    private static final String SHADER = """
        float march(vec3 ro, vec3 rd, out float steps, inout int hits, sampler2D tex, bool flip) {
            float t = 0.0;
            for (int i = 0; i < 64; i++) {
                vec3 p = ro + rd * t;
                for (int j = 0; j < 2; j++)
                    t += 0.01;
                t += length(p) - 1.0;
            }
            return t;
        }

        void mainImage(out vec4 fragColor, in vec2 fragCoord) {
            vec2 uv = fragCoord / iResolution.xy;
            while (uv.x > 0.0) {
                uv.x -= 0.1;
            }
            fragColor = vec4(uv, 0.0, 1.0);
        }
        """;

    private final FunctionContextExtractor extractor = new FunctionContextExtractor(ShaderDebugConfig.defaults());

    @Test
    public void testHelperSignature() {
        DebugFunctionContext context = extractor.extract(SHADER, 1);

        assertNotNull(context);
        assertEquals("march", context.getFunctionName());
        assertEquals("float", context.getReturnType());
        assertTrue(context.isFunction());

        List<String> names = new ArrayList<>();
        for (DebugParameterInfo parameter : context.getParameters()) {
            names.add(parameter.getName());
        }
        assertEquals(List.of("ro", "rd", "hits", "tex", "flip"), names);
    }

    @Test
    public void testParameterCandidates() {
        List<DebugParameterInfo> parameters = extractor.extract(SHADER, 1).getParameters();

        DebugParameterInfo ro = parameters.get(0);
        assertEquals("vec3", ro.getType());
        assertEquals("vec3(uv, 0.0)", ro.getUvValue());
        assertEquals("vec3(((2.0 * fragCoord - iResolution.xy) / iResolution.y), 0.0)", ro.getCenteredUvValue());
        assertEquals("vec3(0.5)", ro.getDefaultCustomValue());
        assertEquals(ParameterMode.CUSTOM, ro.getMode());

        DebugParameterInfo tex = parameters.get(3);
        assertEquals("iChannel0", tex.getUvValue());
        assertEquals("iChannel0", tex.getDefaultCustomValue());

        DebugParameterInfo flip = parameters.get(4);
        assertEquals("uv.x > 0.5", flip.getUvValue());
        assertEquals("fragCoord.x > iResolution.x * 0.5", flip.getCenteredUvValue());
        assertEquals("true", flip.getDefaultCustomValue());
    }

    @Test
    public void testContainingLoops() {
        DebugFunctionContext context = extractor.extract(SHADER, 5);

        List<DebugLoopInfo> loops = context.getLoops();
        assertEquals(2, loops.size());

        assertEquals(0, loops.get(0).getLoopIndex());
        assertEquals(2, loops.get(0).getLineNumber());
        assertEquals(7, loops.get(0).getEndLine());
        assertEquals("for (int i = 0; i < 64; i++)", loops.get(0).getLoopHeader());

        assertEquals(1, loops.get(1).getLoopIndex());
        assertEquals(4, loops.get(1).getLineNumber());
        assertEquals(5, loops.get(1).getEndLine());
        assertNull(loops.get(1).getMaxIter());
    }

    @Test
    public void testLoopHeaderAndClosingLineAreOutside() {
        assertTrue(extractor.extract(SHADER, 2).getLoops().isEmpty());
        assertTrue(extractor.extract(SHADER, 7).getLoops().isEmpty());
        assertEquals(1, extractor.extract(SHADER, 6).getLoops().size());
    }

    @Test
    public void testEntryFunction() {
        DebugFunctionContext context = extractor.extract(SHADER, 14);

        assertEquals("mainImage", context.getFunctionName());
        assertEquals("void", context.getReturnType());
        assertFalse(context.isFunction());
        assertEquals(List.of("fragCoord"), List.of(context.getParameters().get(0).getName()));
        assertEquals(1, context.getParameters().size());
        assertEquals(1, context.getLoops().size());
        assertEquals(0, context.getLoops().get(0).getLoopIndex());
    }

    @Test
    public void testGlobalLine() {
        assertNull(extractor.extract(SHADER, 10));
    }

    @Test
    public void testInvalidLine() {
        assertThrows(IllegalArgumentException.class, () -> extractor.extract(SHADER, 500));
    }
}
