package net.shaderprobe.shader.parser;

import java.util.*;

/**
 * A call of a function inside another function, with its argument expressions.
 */
public class CallSite {
    private final String functionName;
    private final int line;
    private final List<String> arguments;

    public CallSite(String functionName, int line, List<String> arguments) {
        this.functionName = functionName;
        this.line = line;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * Line on which the call starts.
     */
    public int getLine() {
        return line;
    }

    /**
     * Argument expressions, trimmed, in call order.
     */
    public List<String> getArguments() {
        return arguments;
    }

    @Override
    public String toString() {
        return String.format("CallSite{%s(%s) at line %d}", functionName, String.join(", ", arguments), line);
    }
}
