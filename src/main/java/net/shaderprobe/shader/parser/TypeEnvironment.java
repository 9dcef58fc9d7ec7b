package net.shaderprobe.shader.parser;

import java.util.*;

/**
 * Flat map from identifier to GLSL type keyword. Later bindings of a name
 * overwrite earlier ones; there is no lexical scoping.
 */
public class TypeEnvironment {
    private final Map<String, String> bindings = new LinkedHashMap<>();

    /**
     * Binds a name, replacing any earlier binding.
     */
    public void bind(String name, String typeKeyword) {
        bindings.put(name, typeKeyword);
    }

    public boolean contains(String name) {
        return bindings.containsKey(name);
    }

    /**
     * Gets the type keyword bound to a name, or null.
     */
    public String typeOf(String name) {
        return bindings.get(name);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(bindings);
    }

    public int size() {
        return bindings.size();
    }

    @Override
    public String toString() {
        return "TypeEnvironment" + bindings;
    }
}
