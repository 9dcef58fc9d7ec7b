package net.shaderprobe.shader.parser;

import java.util.*;

/**
 * GLSL types whose values can be visualized through the color output.
 */
public enum GlslType {
    FLOAT("float"),
    VEC2("vec2"),
    VEC3("vec3"),
    VEC4("vec4"),
    MAT2("mat2"),
    MAT3("mat3"),
    MAT4("mat4");

    /**
     * Order in which declaration patterns are tried. Wider vectors come first.
     */
    public static final List<GlslType> DECLARATION_ORDER = List.of(VEC4, VEC3, VEC2, FLOAT, MAT2, MAT3, MAT4);

    private static final Map<String, GlslType> BY_KEYWORD;

    static {
        Map<String, GlslType> map = new HashMap<>();
        for (GlslType type : values()) {
            map.put(type.keyword, type);
        }
        BY_KEYWORD = Collections.unmodifiableMap(map);
    }

    private final String keyword;

    GlslType(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isMatrix() {
        return this == MAT2 || this == MAT3 || this == MAT4;
    }

    /**
     * Looks up a supported type by its GLSL keyword.
     *
     * @return the type, or empty for unsupported keywords such as int or sampler2D
     */
    public static Optional<GlslType> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_KEYWORD.get(keyword.trim()));
    }

    @Override
    public String toString() {
        return keyword;
    }
}
