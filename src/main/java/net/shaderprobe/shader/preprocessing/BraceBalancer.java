package net.shaderprobe.shader.preprocessing;

import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Closes every brace left open after a given line by appending '}' lines.
 */
public class BraceBalancer {
    private static final Logger LOGGER = LoggerFactory.getLogger(BraceBalancer.class);

    /**
     * Counts unmatched '{' from {@code startOffset} to the end, ignoring comments.
     */
    public static int countOpenBraces(List<String> lines, int startOffset) {
        SourceBuffer source = SourceBuffer.of(lines);
        int open = 0;
        for (int i = Math.max(0, startOffset); i < source.size(); i++) {
            open += source.netBraces(i);
        }
        return Math.max(0, open);
    }

    /**
     * Appends one '}' line per unmatched '{' from {@code startOffset} onward.
     * Running it again on its own output appends nothing.
     *
     * @return a new list; the input is not modified
     */
    public static List<String> closeOpenBraces(List<String> lines, int startOffset) {
        if (lines == null) {
            throw new IllegalArgumentException("Lines cannot be null");
        }
        if (startOffset < 0) {
            throw new IllegalArgumentException("Start offset cannot be negative: " + startOffset);
        }

        List<String> result = new ArrayList<>(lines);
        int missing = countOpenBraces(lines, startOffset);
        for (int i = 0; i < missing; i++) {
            result.add("}");
        }

        if (missing > 0) {
            LOGGER.debug("Appended {} closing braces", missing);
        }
        return result;
    }
}
