package net.shaderprobe.shader.context;

import java.util.*;

/**
 * Everything a host panel needs to show about the function around a debugged line.
 */
public class DebugFunctionContext {
    private final String functionName;
    private final String returnType;
    private final List<DebugParameterInfo> parameters;
    private final boolean isFunction;
    private final List<DebugLoopInfo> loops;

    public DebugFunctionContext(String functionName, String returnType, List<DebugParameterInfo> parameters,
                                boolean isFunction, List<DebugLoopInfo> loops) {
        this.functionName = functionName;
        this.returnType = returnType;
        this.parameters = new ArrayList<>(parameters);
        this.isFunction = isFunction;
        this.loops = new ArrayList<>(loops);
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getReturnType() {
        return returnType;
    }

    public List<DebugParameterInfo> getParameters() {
        return parameters != null ? parameters : Collections.emptyList();
    }

    /**
     * False when the line sits in the entry function.
     */
    public boolean isFunction() {
        return isFunction;
    }

    /**
     * Containing loops, outermost first.
     */
    public List<DebugLoopInfo> getLoops() {
        return loops != null ? loops : Collections.emptyList();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DebugFunctionContext)) return false;
        DebugFunctionContext other = (DebugFunctionContext) obj;
        return isFunction == other.isFunction
            && Objects.equals(functionName, other.functionName)
            && Objects.equals(returnType, other.returnType)
            && Objects.equals(getParameters(), other.getParameters())
            && Objects.equals(getLoops(), other.getLoops());
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, returnType, getParameters(), isFunction, getLoops());
    }

    @Override
    public String toString() {
        return String.format("DebugFunctionContext{%s %s, %d parameters, %d loops}",
            returnType, functionName, getParameters().size(), getLoops().size());
    }
}
