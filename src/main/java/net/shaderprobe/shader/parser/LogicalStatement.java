package net.shaderprobe.shader.parser;

/**
 * A statement that may span several physical lines, joined into one text.
 */
public class LogicalStatement {
    private final String text;
    private final int startLine;
    private final int endLine;
    private final boolean terminated;

    public LogicalStatement(String text, int startLine, int endLine, boolean terminated) {
        this.text = text;
        this.startLine = startLine;
        this.endLine = endLine;
        this.terminated = terminated;
    }

    /**
     * Comment-free text of the covered lines, trimmed and joined with single spaces.
     */
    public String getText() {
        return text;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    /**
     * False when the statement ran past the scan limit without a terminator.
     */
    public boolean isTerminated() {
        return terminated;
    }

    public boolean isMultiLine() {
        return endLine > startLine;
    }

    @Override
    public String toString() {
        return String.format("LogicalStatement{lines=%d..%d, text='%s'}", startLine, endLine, text);
    }
}
