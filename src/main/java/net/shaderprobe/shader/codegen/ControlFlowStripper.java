package net.shaderprobe.shader.codegen;

import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Removes conditionals and loops from a range of lines so that every body
 * statement runs exactly once: loops keep only their init clause, both branches
 * of a conditional are taken, and braces belonging to removed headers disappear.
 */
public class ControlFlowStripper {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlFlowStripper.class);

    public static final String LOOP_INIT_COMMENT = "  // Loop init (first iteration only)";

    private static final Pattern HEADER = Pattern.compile("\\s*(else\\s+if|if|for|while|else|do)\\b");

    private static final Pattern CONTINUATION = Pattern.compile("^\\s*\\}\\s*(else\\b|while\\s*\\()");

    private static final Pattern JUMP = Pattern.compile("(?:return\\b[^;]*|break|continue|discard)\\s*;");

    private static final Pattern LEADING_WHITESPACE = Pattern.compile("^\\s*");

    /**
     * Strips the lines from {@code fromLine} to {@code toLine} inclusive.
     *
     * @return the rewritten lines; removed lines are absent
     */
    public List<String> strip(SourceBuffer source, int fromLine, int toLine) {
        List<String> result = new ArrayList<>();
        State state = new State();
        int removed = 0;

        int last = Math.min(toLine, source.size() - 1);
        for (int i = Math.max(0, fromLine); i <= last; i++) {
            String line = processLine(source.raw(i), source.code(i), state);
            if (line != null) {
                result.add(line);
            } else {
                removed++;
            }
        }

        LOGGER.debug("Stripped control flow from lines {}..{}: {} lines removed", fromLine, last, removed);
        return result;
    }

    private String processLine(String raw, String code, State state) {
        if (code.isBlank()) {
            // Blank or comment-only
            return raw;
        }

        String indent = indentOf(raw);

        if (state.conditionDepth > 0) {
            int after = skipCondition(code, 0, state);
            if (after < 0) {
                return null;
            }
            return finishHeader(raw, code, after, indent, null, null, state);
        }

        int column = 0;
        String keptBrace = null;

        // Step 1: A leading '}' that continues an if/else chain or ends a do-while
        Matcher continuation = CONTINUATION.matcher(code);
        if (continuation.find()) {
            if (!state.pop()) {
                keptBrace = "}";
            }
            if (continuation.group(1).startsWith("while")) {
                return keptBrace != null ? indent + keptBrace : null;
            }
            column = continuation.start(1);
        }

        // Step 2: Control-flow headers
        Matcher header = HEADER.matcher(code);
        header.region(column, code.length());
        if (header.lookingAt()) {
            String keyword = header.group(1);
            if (keyword.equals("else") || keyword.equals("do")) {
                return finishHeader(raw, code, header.end(), indent, keptBrace, null, state);
            }

            int open = nextNonWhitespace(code, header.end());
            if (open >= 0 && code.charAt(open) == '(') {
                int close = matchParen(code, open);
                String init = keyword.equals("for") ? forInit(raw, code, open, close) : null;

                if (close < 0) {
                    state.conditionDepth = parenDepth(code, open);
                    return joinParts(indent, keptBrace, init, null);
                }
                if (keyword.equals("while") && code.substring(close + 1).trim().equals(";")) {
                    // do-while trailer on its own line
                    return joinParts(indent, keptBrace, null, null);
                }
                return finishHeader(raw, code, close + 1, indent, keptBrace, init, state);
            }
        }

        // Step 3: Ordinary statement line
        StringBuilder body = new StringBuilder(raw.substring(0, column));
        boolean hasCode = walk(raw, code, column, state, body);
        if (!hasCode && keptBrace == null) {
            return null;
        }
        return body.toString();
    }

    /**
     * Emits what remains of a header line after its condition.
     */
    private String finishHeader(String raw, String code, int from, String indent,
                                String keptBrace, String init, State state) {
        state.expectOpen = true;
        StringBuilder body = new StringBuilder();
        boolean hasCode = walk(raw, code, from, state, body);
        return joinParts(indent, keptBrace, init, hasCode ? body.toString().trim() : null);
    }

    private String joinParts(String indent, String keptBrace, String init, String body) {
        List<String> parts = new ArrayList<>();
        if (keptBrace != null) {
            parts.add(keptBrace);
        }
        if (init != null) {
            parts.add(init + ";");
        }
        if (body != null && !body.isEmpty()) {
            parts.add(body);
        }
        if (parts.isEmpty()) {
            return null;
        }
        return indent + String.join(" ", parts) + (init != null ? LOOP_INIT_COMMENT : "");
    }

    /**
     * Copies raw characters from a column onward, dropping braces that belong to
     * removed headers and jump statements that would leave a removed block.
     *
     * @return true if any code survived
     */
    private boolean walk(String raw, String code, int from, State state, StringBuilder out) {
        boolean hasCode = false;
        boolean statementStart = true;

        for (int c = from; c < code.length(); c++) {
            char ch = code.charAt(c);

            if (state.expectOpen && !Character.isWhitespace(ch)) {
                state.expectOpen = false;
                if (ch == '{') {
                    state.push(true);
                    statementStart = true;
                    continue;
                }
                state.bracelessBody = true;
            }

            if (statementStart && Character.isLetter(ch) && (state.bracelessBody || state.innermostStripped())) {
                Matcher jump = JUMP.matcher(code);
                jump.region(c, code.length());
                if (jump.lookingAt()) {
                    c = jump.end() - 1;
                    state.bracelessBody = false;
                    continue;
                }
            }

            if (ch == '{') {
                state.push(false);
                out.append(raw.charAt(c));
                hasCode = true;
                statementStart = true;
            } else if (ch == '}') {
                if (!state.pop()) {
                    out.append(raw.charAt(c));
                    hasCode = true;
                }
                statementStart = true;
            } else {
                out.append(raw.charAt(c));
                if (!Character.isWhitespace(ch)) {
                    hasCode = true;
                    statementStart = ch == ';';
                    if (ch == ';') {
                        state.bracelessBody = false;
                    }
                }
            }
        }

        return hasCode;
    }

    /**
     * Continues a condition that started on an earlier line.
     *
     * @return the column after the closing parenthesis, or -1 if still open
     */
    private int skipCondition(String code, int from, State state) {
        for (int c = from; c < code.length(); c++) {
            char ch = code.charAt(c);
            if (ch == '(') {
                state.conditionDepth++;
            } else if (ch == ')') {
                state.conditionDepth--;
                if (state.conditionDepth == 0) {
                    return c + 1;
                }
            }
        }
        return -1;
    }

    /**
     * Extracts the init clause of a for header, or null if it is empty or not on this line.
     */
    private static String forInit(String raw, String code, int open, int close) {
        int end = close < 0 ? code.length() : close;
        int depth = 0;
        for (int c = open + 1; c < end; c++) {
            char ch = code.charAt(c);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            } else if (ch == ';' && depth == 0) {
                String init = raw.substring(open + 1, c).trim();
                return init.isEmpty() ? null : init;
            }
        }
        return null;
    }

    static int matchParen(String code, int open) {
        int depth = 0;
        for (int c = open; c < code.length(); c++) {
            char ch = code.charAt(c);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
                if (depth == 0) {
                    return c;
                }
            }
        }
        return -1;
    }

    private static int parenDepth(String code, int open) {
        int depth = 0;
        for (int c = open; c < code.length(); c++) {
            char ch = code.charAt(c);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth--;
            }
        }
        return Math.max(depth, 1);
    }

    private static int nextNonWhitespace(String code, int from) {
        for (int c = from; c < code.length(); c++) {
            if (!Character.isWhitespace(code.charAt(c))) {
                return c;
            }
        }
        return -1;
    }

    static String indentOf(String raw) {
        Matcher matcher = LEADING_WHITESPACE.matcher(raw);
        return matcher.find() ? matcher.group() : "";
    }

    /**
     * Brace stack and pending-header flags carried from line to line.
     */
    private static class State {
        private final Deque<Boolean> braces = new ArrayDeque<>();
        private boolean expectOpen;
        private boolean bracelessBody;
        private int conditionDepth;

        void push(boolean stripped) {
            braces.push(stripped);
        }

        /**
         * Pops a brace.
         *
         * @return true if the closed block belonged to a removed header
         */
        boolean pop() {
            Boolean stripped = braces.poll();
            return stripped != null && stripped;
        }

        boolean innermostStripped() {
            Boolean top = braces.peek();
            return top != null && top;
        }
    }
}
