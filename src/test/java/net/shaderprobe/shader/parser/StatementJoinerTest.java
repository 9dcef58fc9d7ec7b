package net.shaderprobe.shader.parser;

import net.shaderprobe.shader.source.SourceBuffer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StatementJoinerTest {

    private final StatementJoiner joiner = new StatementJoiner();

    @Test
    public void testCompleteLineStandsAlone() {
        SourceBuffer source = SourceBuffer.of("""
            vec2 uv = fragCoord / iResolution.xy;
            float d = length(uv);
            """);

        LogicalStatement statement = joiner.join(source, 1);

        assertEquals("float d = length(uv);", statement.getText());
        assertEquals(1, statement.getStartLine());
        assertEquals(1, statement.getEndLine());
        assertFalse(statement.isMultiLine());
        assertTrue(statement.isTerminated());
    }

    @Test
    public void testContinuationLinesAreJoined() {
        SourceBuffer source = SourceBuffer.of("""
            float a = 1.0;
            vec3 col = mix(
                vec3(0.1),
                vec3(0.9),
                a);
            col *= 2.0;
            """);

        LogicalStatement statement = joiner.join(source, 2);

        assertEquals("vec3 col = mix( vec3(0.1), vec3(0.9), a);", statement.getText());
        assertEquals(1, statement.getStartLine());
        assertEquals(4, statement.getEndLine());
        assertTrue(statement.isMultiLine());
    }

    @Test
    public void testLastLineOfStatementFindsItsStart() {
        SourceBuffer source = SourceBuffer.of("""
            float total = 0.0
                + 1.0
                + 2.0;
            """);

        LogicalStatement statement = joiner.join(source, 2);

        assertEquals(0, statement.getStartLine());
        assertEquals(2, statement.getEndLine());
        assertEquals("float total = 0.0 + 1.0 + 2.0;", statement.getText());
    }

    @Test
    public void testTrailingCommentDoesNotMakeLineIncomplete() {
        SourceBuffer source = SourceBuffer.of("""
            vec3 col = vec3(1.0);
            col -= vec3(0.0, 1.0, 0.0);  // green circle:
            """);

        LogicalStatement statement = joiner.join(source, 1);

        assertEquals("col -= vec3(0.0, 1.0, 0.0);", statement.getText());
        assertFalse(statement.isMultiLine());
    }

    @Test
    public void testMissingTerminatorKeepsTargetLine() {
        SourceBuffer source = SourceBuffer.of("""
            float x = 1.0;
            x = x * 2.0
            """);

        LogicalStatement statement = new StatementJoiner(3).join(source, 1);

        assertFalse(statement.isTerminated());
        assertEquals(1, statement.getEndLine());
    }

    @Test
    public void testTerminatorOnLastScannedLineIsJoined() {
        SourceBuffer source = SourceBuffer.of(statementSpanning(9));

        LogicalStatement statement = joiner.join(source, 1);

        assertTrue(statement.isTerminated());
        assertEquals(1, statement.getStartLine());
        assertEquals(10, statement.getEndLine());
        assertTrue(statement.getText().endsWith("0.1);"));
    }

    @Test
    public void testTerminatorBeyondScanLimitIsNotJoined() {
        SourceBuffer source = SourceBuffer.of(statementSpanning(10));

        LogicalStatement statement = joiner.join(source, 1);

        assertFalse(statement.isTerminated());
        assertEquals(1, statement.getEndLine());
        assertEquals("vec3 col = vec3(", statement.getText());
    }

    /**
     * A statement opening on line 1 whose ';' sits the given number of lines below it.
     */
    private static String statementSpanning(int linesBelow) {
        StringBuilder text = new StringBuilder("float a = 1.0;\nvec3 col = vec3(\n");
        for (int i = 1; i < linesBelow; i++) {
            text.append("    0.1,\n");
        }
        return text.append("    0.1);\n").toString();
    }

    @Test
    public void testIsIncomplete() {
        assertTrue(StatementJoiner.isIncomplete("vec3 col = vec3("));
        assertTrue(StatementJoiner.isIncomplete("    0.5,"));
        assertFalse(StatementJoiner.isIncomplete("x = 1.0;"));
        assertFalse(StatementJoiner.isIncomplete("if (x) {"));
        assertFalse(StatementJoiner.isIncomplete("}"));
        assertFalse(StatementJoiner.isIncomplete("   "));
    }

    @Test
    public void testNegativeScanLimitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StatementJoiner(-1));
    }
}
