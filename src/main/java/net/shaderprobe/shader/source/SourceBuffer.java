package net.shaderprobe.shader.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Line-oriented view of a shader source produced by a single tokenizing pass.
 * Every raw line has a matching "code" line of the same length in which comments
 * are blanked out, so columns found in the code text are valid in the raw text.
 * Quoted text, as in an #include directive, is neither a comment nor counted in
 * the brace totals.
 */
public class SourceBuffer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SourceBuffer.class);

    private final List<String> rawLines;
    private final List<String> codeLines;
    private final int[] openBraces;
    private final int[] closeBraces;

    private SourceBuffer(List<String> rawLines) {
        this.rawLines = Collections.unmodifiableList(new ArrayList<>(rawLines));
        this.codeLines = Collections.unmodifiableList(stripComments(this.rawLines));
        this.openBraces = new int[rawLines.size()];
        this.closeBraces = new int[rawLines.size()];

        for (int i = 0; i < codeLines.size(); i++) {
            String code = codeLines.get(i);
            boolean inString = false;
            for (int c = 0; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '"') {
                    inString = !inString;
                } else if (inString) {
                    continue;
                } else if (ch == '{') {
                    openBraces[i]++;
                } else if (ch == '}') {
                    closeBraces[i]++;
                }
            }
        }
    }

    /**
     * Splits source text on newlines and tokenizes it.
     */
    public static SourceBuffer of(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Shader source cannot be null");
        }
        return new SourceBuffer(Arrays.asList(source.split("\n", -1)));
    }

    /**
     * Tokenizes an already split list of lines.
     */
    public static SourceBuffer of(List<String> lines) {
        if (lines == null) {
            throw new IllegalArgumentException("Shader lines cannot be null");
        }
        return new SourceBuffer(lines);
    }

    /**
     * Replaces line and block comments with spaces, keeping line lengths intact.
     * Block comments may span several lines.
     */
    private static List<String> stripComments(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        boolean inBlockComment = false;
        int blockComments = 0;

        for (String line : lines) {
            StringBuilder code = new StringBuilder(line.length());
            boolean inString = false;
            int i = 0;

            while (i < line.length()) {
                char ch = line.charAt(i);
                char next = i + 1 < line.length() ? line.charAt(i + 1) : '\0';

                if (inBlockComment) {
                    if (ch == '*' && next == '/') {
                        code.append("  ");
                        inBlockComment = false;
                        i += 2;
                    } else {
                        code.append(' ');
                        i++;
                    }
                    continue;
                }

                if (inString) {
                    code.append(ch);
                    if (ch == '"') {
                        inString = false;
                    }
                    i++;
                    continue;
                }

                if (ch == '/' && next == '/') {
                    while (i < line.length()) {
                        code.append(' ');
                        i++;
                    }
                    break;
                }

                if (ch == '/' && next == '*') {
                    code.append("  ");
                    inBlockComment = true;
                    blockComments++;
                    i += 2;
                    continue;
                }

                if (ch == '"') {
                    inString = true;
                }
                code.append(ch);
                i++;
            }

            result.add(code.toString());
        }

        if (inBlockComment) {
            LOGGER.debug("Unterminated block comment runs to end of source");
        }
        LOGGER.trace("Tokenized {} lines ({} block comments)", lines.size(), blockComments);
        return result;
    }

    public int size() {
        return rawLines.size();
    }

    public List<String> getRawLines() {
        return rawLines;
    }

    public String raw(int line) {
        return rawLines.get(line);
    }

    /**
     * Gets the comment-free text of a line.
     */
    public String code(int line) {
        return codeLines.get(line);
    }

    public int openBraces(int line) {
        return openBraces[line];
    }

    public int closeBraces(int line) {
        return closeBraces[line];
    }

    /**
     * Net brace balance of a line: opens minus closes.
     */
    public int netBraces(int line) {
        return openBraces[line] - closeBraces[line];
    }

    public boolean isValidLine(int line) {
        return line >= 0 && line < rawLines.size();
    }

    /**
     * Counts the '{' and '}' characters of a single line, ignoring comments.
     * Used on lines that were produced after tokenization.
     */
    public static int netBraces(String line) {
        return SourceBuffer.of(List.of(line)).netBraces(0);
    }

    @Override
    public String toString() {
        return String.format("SourceBuffer{lines=%d}", rawLines.size());
    }
}
