package net.shaderprobe.shader.codegen;

import net.shaderprobe.shader.source.SourceBuffer;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowStripperTest {

    private final ControlFlowStripper stripper = new ControlFlowStripper();

    private List<String> strip(String source) {
        SourceBuffer buffer = SourceBuffer.of(source);
        return stripper.strip(buffer, 0, buffer.size() - 1);
    }

    @Test
    public void testIfElseBodiesAreBothKept() {
        List<String> lines = strip("""
            if (x > 0.5) {
                a = 1.0;
            } else if (x > 0.25) {
                a = 0.5;
            } else {
                a = 0.0;
            }""");

        assertEquals(List.of("    a = 1.0;", "    a = 0.5;", "    a = 0.0;"), lines);
    }

    @Test
    public void testForKeepsInitWithComment() {
        List<String> lines = strip("""
            for (int i = 0; i < 4; i++) {
                x += 1.0;
            }""");

        assertEquals(List.of("int i = 0;" + ControlFlowStripper.LOOP_INIT_COMMENT, "    x += 1.0;"), lines);
    }

    @Test
    public void testForWithoutInit() {
        List<String> lines = strip("""
            for (; t < 1.0; t += 0.1) {
                t += d;
            }""");

        assertEquals(List.of("    t += d;"), lines);
    }

    @Test
    public void testWhileAndDoWhile() {
        List<String> lines = strip("""
            while (d > 0.0) {
                d -= 0.1;
            }
            do {
                d += 0.2;
            } while (d < 1.0);""");

        assertEquals(List.of("    d -= 0.1;", "    d += 0.2;"), lines);
    }

    @Test
    public void testPlainBlocksKeepTheirBraces() {
        List<String> lines = strip("""
            {
                float k = 1.0;
            }""");

        assertEquals(List.of("{", "    float k = 1.0;", "}"), lines);
    }

    @Test
    public void testJumpStatementsInsideStrippedBlocksAreDropped() {
        List<String> lines = strip("""
            for (int i = 0; i < 64; i++) {
                float d = map(p);
                if (d < 0.001) break;
                if (t > 20.0) {
                    return vec3(0.0);
                }
                t += d;
            }""");

        assertFalse(lines.stream().anyMatch(l -> l.contains("break")));
        assertFalse(lines.stream().anyMatch(l -> l.contains("return")));
        assertTrue(lines.contains("    float d = map(p);"));
        assertTrue(lines.contains("    t += d;"));
    }

    @Test
    public void testBracelessBodyIsKept() {
        List<String> lines = strip("""
            if (uv.x > 0.5)
                col = vec3(1.0);
            col *= 0.5;""");

        assertEquals(List.of("    col = vec3(1.0);", "col *= 0.5;"), lines);
    }

    @Test
    public void testSameLineBracelessBody() {
        List<String> lines = strip("if (uv.x > 0.5) col = vec3(1.0);");

        assertEquals(List.of("col = vec3(1.0);"), lines);
    }

    @Test
    public void testConditionAcrossLines() {
        List<String> lines = strip("""
            if (a > 0.0 &&
                b > 0.0) {
                c = a * b;
            }""");

        assertEquals(List.of("    c = a * b;"), lines);
    }

    @Test
    public void testCommentsAndBlankLinesPassThrough() {
        List<String> lines = strip("""
            // header comment

            x = 1.0;""");

        assertEquals(List.of("// header comment", "", "x = 1.0;"), lines);
    }

    @Test
    public void testTopLevelReturnIsKept() {
        List<String> lines = strip("""
            float f(float x) {
                return x;
            }""");

        assertEquals(3, lines.size());
        assertEquals("    return x;", lines.get(1));
    }
}
