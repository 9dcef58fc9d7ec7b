package net.shaderprobe.shader.preprocessing;

import net.shaderprobe.shader.parser.LoopHeader;
import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Bounds selected loops with an iteration counter so long-running or infinite
 * loops terminate under debugging. Loops are numbered in document order starting
 * after a given line; unselected loops are left untouched.
 */
public class LoopIterationCapper {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoopIterationCapper.class);

    public static final String COUNTER_PREFIX = "_dbgIter";

    private static final String BODY_INDENT = "  ";

    /**
     * Injects counters and break guards into the loops present in the map.
     *
     * @param lines shader source lines
     * @param startOffset loops on this line or before it are neither numbered nor changed
     * @param ceilings loop index to maximum iteration count
     * @return a new list of lines
     */
    public static List<String> capLoopIterations(List<String> lines, int startOffset, Map<Integer, Integer> ceilings) {
        if (lines == null) {
            throw new IllegalArgumentException("Lines cannot be null");
        }
        if (ceilings == null || ceilings.isEmpty()) {
            return new ArrayList<>(lines);
        }

        SourceBuffer source = SourceBuffer.of(lines);
        List<String> result = new ArrayList<>(lines.size() + ceilings.size() * 3);
        Map<Integer, List<PendingClose>> pendingCloses = new HashMap<>();
        int loopIndex = 0;
        int capped = 0;

        int i = 0;
        while (i < source.size()) {
            LoopHeader header = i > startOffset ? LoopHeader.parse(source, i) : null;
            if (header == null) {
                emitLine(source, i, pendingCloses.remove(i), result);
                i++;
                continue;
            }

            int index = loopIndex++;
            Integer ceiling = ceilings.get(index);
            int next = ceiling == null ? -1 : insertGuard(source, header, index, ceiling, result, pendingCloses);
            if (next < 0) {
                emitLine(source, i, pendingCloses.remove(i), result);
                i++;
                continue;
            }

            capped++;
            for (int consumed = i; consumed < next; consumed++) {
                emitCloses(pendingCloses.remove(consumed), result);
            }
            i = next;
        }

        LOGGER.debug("Capped {} of {} loops", capped, loopIndex);
        return result;
    }

    /**
     * Emits the counter declaration, the header and the guarded start of the body.
     * Nothing is emitted when the body cannot be located.
     *
     * @return the next line to process, or -1 if the loop was not guarded
     */
    private static int insertGuard(SourceBuffer source, LoopHeader header, int index, int ceiling,
                                   List<String> result, Map<Integer, List<PendingClose>> pendingCloses) {
        String indent = indentOf(source.raw(header.getLine()));
        String counter = COUNTER_PREFIX + index;
        String guard = "if (++" + counter + " > " + ceiling + ") break;";
        String guardLine = indent + BODY_INDENT + guard;

        int closeLine = header.getCloseLine();
        int column = header.getCloseColumn() + 1;
        String raw = source.raw(closeLine);

        int[] start = LoopHeader.findStatementStart(source, closeLine, column);
        if (start == null) {
            LOGGER.warn("Cannot guard loop {} at line {}: no body", index, header.getLine());
            return -1;
        }

        List<String> emitted = new ArrayList<>();
        emitted.add(indent + "int " + counter + " = 0;");
        for (int h = header.getLine(); h < closeLine; h++) {
            emitted.add(source.raw(h));
        }

        // Step 1: Braced body, the brace on the header line or after it
        if (source.code(start[0]).charAt(start[1]) == '{') {
            if (start[0] != closeLine) {
                emitted.add(raw);
                for (int blank = closeLine + 1; blank < start[0]; blank++) {
                    emitted.add(source.raw(blank));
                }
            }
            String braceRaw = source.raw(start[0]);
            int at = start[1] + 1;
            if (source.code(start[0]).substring(at).isBlank()) {
                emitted.add(braceRaw);
                emitted.add(guardLine);
            } else {
                emitted.add(braceRaw.substring(0, at) + " " + guard + braceRaw.substring(at));
            }
            result.addAll(emitted);
            return start[0] + 1;
        }

        int[] end = LoopHeader.findStatementEnd(source, start[0], start[1]);
        if (end == null) {
            LOGGER.warn("Cannot guard loop {} at line {}: body never ends", index, header.getLine());
            return -1;
        }

        // Step 2: Statement body entirely on the header line
        if (start[0] == closeLine && end[0] == closeLine) {
            String statement = raw.substring(start[1], end[1]).trim();
            emitted.add(raw.substring(0, column) + " { " + guard + " " + statement + " }" + raw.substring(end[1]));
            result.addAll(emitted);
            return closeLine + 1;
        }

        // Step 3: Braceless body over later lines gets braces, closed once its last line is emitted
        if (start[0] == closeLine) {
            emitted.add(raw.substring(0, column) + " { " + guard + " " + raw.substring(start[1]).trim());
        } else {
            emitted.add(raw.substring(0, column) + " {" + raw.substring(column));
            emitted.add(guardLine);
        }
        pendingCloses.computeIfAbsent(end[0], line -> new ArrayList<>()).add(new PendingClose(end[1], indent + "}"));
        result.addAll(emitted);
        return closeLine + 1;
    }

    /**
     * Emits a line unchanged, followed by the braces of loop bodies ending on it. Code
     * after the end of the outermost body moves to its own line.
     */
    private static void emitLine(SourceBuffer source, int line, List<PendingClose> closes, List<String> result) {
        String raw = source.raw(line);
        if (closes == null) {
            result.add(raw);
            return;
        }

        int cut = 0;
        for (PendingClose close : closes) {
            cut = Math.max(cut, close.column);
        }
        String trailing = source.code(line).substring(cut);
        if (trailing.isBlank()) {
            result.add(raw);
            emitCloses(closes, result);
        } else {
            result.add(raw.substring(0, cut));
            emitCloses(closes, result);
            result.add(indentOf(raw) + raw.substring(cut).trim());
        }
    }

    private static void emitCloses(List<PendingClose> closes, List<String> result) {
        if (closes == null) {
            return;
        }
        // Inner loops were registered last
        for (int i = closes.size() - 1; i >= 0; i--) {
            result.add(closes.get(i).text);
        }
    }

    private static String indentOf(String raw) {
        int end = 0;
        while (end < raw.length() && Character.isWhitespace(raw.charAt(end))) {
            end++;
        }
        return raw.substring(0, end);
    }

    /**
     * Closing brace owed to a braceless loop body ending at a column of a later line.
     */
    private static class PendingClose {
        private final int column;
        private final String text;

        PendingClose(int column, String text) {
            this.column = column;
            this.text = text;
        }
    }
}
