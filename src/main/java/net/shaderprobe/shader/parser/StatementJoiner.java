package net.shaderprobe.shader.parser;

import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Recovers the logical statement around a target line when a statement is
 * broken across several physical lines.
 */
public class StatementJoiner {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatementJoiner.class);

    public static final int DEFAULT_SCAN_LIMIT = 10;

    private final int scanLimit;

    public StatementJoiner() {
        this(DEFAULT_SCAN_LIMIT);
    }

    public StatementJoiner(int scanLimit) {
        if (scanLimit < 0) {
            throw new IllegalArgumentException("Scan limit cannot be negative: " + scanLimit);
        }
        this.scanLimit = scanLimit;
    }

    /**
     * A line is incomplete when it has code that does not end a statement or block.
     */
    public static boolean isIncomplete(String code) {
        String trimmed = code.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        return !(trimmed.endsWith(";") || trimmed.endsWith("{") || trimmed.endsWith("}"));
    }

    /**
     * Joins the statement containing the target line.
     */
    public LogicalStatement join(SourceBuffer source, int targetLine) {
        if (!source.isValidLine(targetLine)) {
            throw new IllegalArgumentException("Target line " + targetLine + " outside source of "
                + source.size() + " lines");
        }

        boolean currentIncomplete = isIncomplete(source.code(targetLine));
        boolean previousIncomplete = targetLine > 0 && isIncomplete(source.code(targetLine - 1));

        if (!currentIncomplete && !previousIncomplete) {
            return new LogicalStatement(source.code(targetLine).trim(), targetLine, targetLine, true);
        }

        int start = findStart(source, targetLine);
        int end = targetLine;
        boolean terminated = true;

        if (currentIncomplete) {
            end = findTerminator(source, targetLine);
            if (end < 0) {
                LOGGER.debug("No statement terminator within {} lines of line {}", scanLimit, targetLine);
                end = targetLine;
                terminated = false;
            }
        }

        List<String> parts = new ArrayList<>();
        for (int i = start; i <= end; i++) {
            String code = source.code(i).trim();
            if (!code.isEmpty()) {
                parts.add(code);
            }
        }

        return new LogicalStatement(String.join(" ", parts), start, end, terminated);
    }

    /**
     * Walks backward to the first line after the previous complete line.
     */
    private int findStart(SourceBuffer source, int targetLine) {
        for (int i = targetLine - 1; i >= Math.max(0, targetLine - scanLimit); i--) {
            String code = source.code(i);
            if (code.isBlank() || !isIncomplete(code)) {
                return i + 1;
            }
            if (i == 0) {
                return 0;
            }
        }
        return targetLine;
    }

    /**
     * Index of the first line ending in ';' among the scan limit's lines starting at
     * the target, or -1.
     */
    public int findTerminator(SourceBuffer source, int targetLine) {
        int last = Math.min(source.size() - 1, targetLine + scanLimit - 1);
        for (int i = targetLine; i <= last; i++) {
            if (source.code(i).trim().endsWith(";")) {
                return i;
            }
        }
        return -1;
    }
}
