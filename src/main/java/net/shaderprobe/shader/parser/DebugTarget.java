package net.shaderprobe.shader.parser;

import java.util.Objects;

/**
 * The variable whose value is visualized, with a type that is always supported.
 */
public class DebugTarget {
    /**
     * Synthetic variable that captures the value of a return expression.
     */
    public static final String RETURN_VARIABLE = "_dbgReturn";

    private final String name;
    private final GlslType type;

    public DebugTarget(String name, GlslType type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public GlslType getType() {
        return type;
    }

    public boolean isReturnValue() {
        return RETURN_VARIABLE.equals(name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DebugTarget)) return false;
        DebugTarget other = (DebugTarget) obj;
        return name.equals(other.name) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return String.format("DebugTarget{%s %s}", type, name);
    }
}
