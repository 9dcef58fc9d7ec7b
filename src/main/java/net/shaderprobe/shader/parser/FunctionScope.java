package net.shaderprobe.shader.parser;

import java.util.Objects;

/**
 * The function enclosing a target line, as found by the {@link ScopeResolver}.
 * A scope without a name means the line sits at global level.
 */
public class FunctionScope {
    private static final FunctionScope GLOBAL = new FunctionScope(null, -1, -1);

    private final String name;
    private final int startLine;
    private final int endLine;

    public FunctionScope(String name, int startLine, int endLine) {
        this.name = name;
        this.startLine = startLine;
        this.endLine = endLine;
    }

    public static FunctionScope global() {
        return GLOBAL;
    }

    public String getName() {
        return name;
    }

    /**
     * Line holding the function header, or -1 at global level.
     */
    public int getStartLine() {
        return startLine;
    }

    /**
     * Line holding the closing brace, or -1 if the function never closes.
     */
    public int getEndLine() {
        return endLine;
    }

    public boolean isInsideFunction() {
        return name != null;
    }

    public boolean isTerminated() {
        return endLine >= 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionScope)) return false;
        FunctionScope other = (FunctionScope) obj;
        return startLine == other.startLine
            && endLine == other.endLine
            && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, startLine, endLine);
    }

    @Override
    public String toString() {
        return String.format("FunctionScope{name='%s', start=%d, end=%d}", name, startLine, endLine);
    }
}
