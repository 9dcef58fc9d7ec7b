package net.shaderprobe.shader.parser;

import net.shaderprobe.shader.source.SourceBuffer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Position of a for or while loop header, whose condition may span several lines.
 */
public class LoopHeader {
    private static final Pattern LOOP_START = Pattern.compile("^\\s*(for|while)\\s*\\(");

    private static final Pattern STATEMENT_KEYWORD = Pattern.compile("(for|while|if)\\s*\\(");
    private static final Pattern ELSE_KEYWORD = Pattern.compile("else\\b");
    private static final Pattern DO_KEYWORD = Pattern.compile("do\\b");

    private static final int MAX_HEADER_LINES = 10;

    private final String keyword;
    private final int line;
    private final int closeLine;
    private final int closeColumn;

    private LoopHeader(String keyword, int line, int closeLine, int closeColumn) {
        this.keyword = keyword;
        this.line = line;
        this.closeLine = closeLine;
        this.closeColumn = closeColumn;
    }

    /**
     * Parses a loop header starting on a line. A while that is directly followed by
     * ';' ends a do-while and is not a loop header.
     *
     * @return the header, or null if the line does not start a loop
     */
    public static LoopHeader parse(SourceBuffer source, int line) {
        Matcher start = LOOP_START.matcher(source.code(line));
        if (!start.find()) {
            return null;
        }

        int depth = 0;
        int last = Math.min(source.size() - 1, line + MAX_HEADER_LINES);
        for (int i = line; i <= last; i++) {
            String code = source.code(i);
            for (int c = i == line ? start.end() - 1 : 0; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '(') {
                    depth++;
                } else if (ch == ')') {
                    depth--;
                    if (depth == 0) {
                        if (code.substring(c + 1).trim().startsWith(";")) {
                            return null;
                        }
                        return new LoopHeader(start.group(1), line, i, c);
                    }
                }
            }
        }
        return null;
    }

    public String getKeyword() {
        return keyword;
    }

    /**
     * Line holding the for/while keyword.
     */
    public int getLine() {
        return line;
    }

    /**
     * Line holding the parenthesis that closes the loop condition.
     */
    public int getCloseLine() {
        return closeLine;
    }

    public int getCloseColumn() {
        return closeColumn;
    }

    /**
     * Code following the closing parenthesis on its line.
     */
    public String restOf(SourceBuffer source) {
        return source.code(closeLine).substring(closeColumn + 1);
    }

    /**
     * Header text from the keyword to the closing parenthesis, whitespace collapsed.
     */
    public String text(SourceBuffer source) {
        StringBuilder text = new StringBuilder();
        for (int i = line; i <= closeLine; i++) {
            String code = source.code(i);
            text.append(i == closeLine ? code.substring(0, closeColumn + 1) : code).append(' ');
        }
        return text.toString().trim().replaceAll("\\s+", " ");
    }

    /**
     * Finds the line on which the loop body ends: the brace closing a braced body,
     * or the end of a single statement body.
     *
     * @return the end line, or -1 if the body never ends
     */
    public int findBodyEnd(SourceBuffer source) {
        int[] end = findStatementEnd(source, closeLine, closeColumn + 1);
        return end == null ? -1 : end[0];
    }

    /**
     * Finds the end of the statement starting at or after a position. Braced blocks,
     * nested loops, if/else chains and do-while statements are followed to their end.
     *
     * @return {line, column just past the statement}, or null if it never ends
     */
    public static int[] findStatementEnd(SourceBuffer source, int line, int column) {
        int[] start = findStatementStart(source, line, column);
        if (start == null) {
            return null;
        }
        String code = source.code(start[0]).substring(start[1]);

        if (code.startsWith("{")) {
            return matchClosing(source, start[0], start[1], '{', '}');
        }

        Matcher keyword = STATEMENT_KEYWORD.matcher(code);
        if (keyword.lookingAt()) {
            int[] condition = matchClosing(source, start[0], start[1] + keyword.end() - 1, '(', ')');
            if (condition == null) {
                return null;
            }
            int[] body = findStatementEnd(source, condition[0], condition[1]);
            if (body == null || !keyword.group(1).equals("if")) {
                return body;
            }
            int[] next = findStatementStart(source, body[0], body[1]);
            if (next != null && ELSE_KEYWORD.matcher(source.code(next[0]).substring(next[1])).lookingAt()) {
                return findStatementEnd(source, next[0], next[1] + "else".length());
            }
            return body;
        }

        if (DO_KEYWORD.matcher(code).lookingAt()) {
            int[] body = findStatementEnd(source, start[0], start[1] + "do".length());
            return body == null ? null : findSemicolon(source, body[0], body[1]);
        }

        return findSemicolon(source, start[0], start[1]);
    }

    /**
     * Position of the first code character at or after a position, or null at the end
     * of the source.
     */
    public static int[] findStatementStart(SourceBuffer source, int line, int column) {
        for (int i = line; i < source.size(); i++) {
            String code = source.code(i);
            for (int c = i == line ? column : 0; c < code.length(); c++) {
                if (!Character.isWhitespace(code.charAt(c))) {
                    return new int[] {i, c};
                }
            }
        }
        return null;
    }

    /**
     * Position just past the bracket matching the opening one at the given position.
     */
    private static int[] matchClosing(SourceBuffer source, int line, int column, char open, char close) {
        int depth = 0;
        for (int i = line; i < source.size(); i++) {
            String code = source.code(i);
            for (int c = i == line ? column : 0; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == open) {
                    depth++;
                } else if (ch == close) {
                    depth--;
                    if (depth == 0) {
                        return new int[] {i, c + 1};
                    }
                }
            }
        }
        return null;
    }

    private static int[] findSemicolon(SourceBuffer source, int line, int column) {
        int depth = 0;
        for (int i = line; i < source.size(); i++) {
            String code = source.code(i);
            for (int c = i == line ? column : 0; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '(') {
                    depth++;
                } else if (ch == ')') {
                    depth--;
                } else if (ch == ';' && depth <= 0) {
                    return new int[] {i, c + 1};
                }
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return String.format("LoopHeader{%s at line %d, closes at %d:%d}", keyword, line, closeLine, closeColumn);
    }
}
