package net.shaderprobe.shader.context;

import java.util.Objects;

/**
 * A loop whose body contains the debugged line.
 */
public class DebugLoopInfo {
    private final int loopIndex;
    private final int lineNumber;
    private final int endLine;
    private final String loopHeader;
    private Integer maxIter;

    public DebugLoopInfo(int loopIndex, int lineNumber, int endLine, String loopHeader) {
        this.loopIndex = loopIndex;
        this.lineNumber = lineNumber;
        this.endLine = endLine;
        this.loopHeader = loopHeader;
    }

    /**
     * Position of the loop in the numbering used for iteration ceilings.
     */
    public int getLoopIndex() {
        return loopIndex;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getEndLine() {
        return endLine;
    }

    public String getLoopHeader() {
        return loopHeader;
    }

    /**
     * Iteration ceiling, or null for no limit.
     */
    public Integer getMaxIter() {
        return maxIter;
    }

    public void setMaxIter(Integer maxIter) {
        if (maxIter != null && maxIter < 0) {
            throw new IllegalArgumentException("Iteration ceiling cannot be negative: " + maxIter);
        }
        this.maxIter = maxIter;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DebugLoopInfo)) return false;
        DebugLoopInfo other = (DebugLoopInfo) obj;
        return loopIndex == other.loopIndex
            && lineNumber == other.lineNumber
            && endLine == other.endLine
            && Objects.equals(loopHeader, other.loopHeader)
            && Objects.equals(maxIter, other.maxIter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(loopIndex, lineNumber, endLine, loopHeader, maxIter);
    }

    @Override
    public String toString() {
        return String.format("DebugLoopInfo{#%d '%s' lines %d..%d, maxIter=%s}",
            loopIndex, loopHeader, lineNumber, endLine, maxIter);
    }
}
