package net.shaderprobe.shader.parser;

import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the {@link TypeEnvironment} visible at a target line from the enclosing
 * function's parameters and every typed declaration up to the target.
 */
public class TypeEnvironmentBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(TypeEnvironmentBuilder.class);

    /**
     * Parameter types recorded in the environment. Only the visualizable subset
     * can become a debug target.
     */
    private static final Set<String> PARAMETER_TYPES = Set.of(
        "vec2", "vec3", "vec4", "float", "int", "bool", "mat2", "mat3", "mat4", "sampler2D"
    );

    private static final Map<GlslType, Pattern> DECLARATION_PATTERNS;

    static {
        Map<GlslType, Pattern> patterns = new EnumMap<>(GlslType.class);
        for (GlslType type : GlslType.DECLARATION_ORDER) {
            patterns.put(type, Pattern.compile("\\b" + type.getKeyword() + "\\s+(\\w+)\\s*[=;]"));
        }
        DECLARATION_PATTERNS = Collections.unmodifiableMap(patterns);
    }

    /**
     * Builds the environment for a target line.
     *
     * @param source tokenized source
     * @param scope enclosing function, may be global
     * @param boundLine last line scanned for declarations (inclusive)
     */
    public TypeEnvironment build(SourceBuffer source, FunctionScope scope, int boundLine) {
        return build(source, scope, 0, boundLine);
    }

    /**
     * Builds the environment from the scope's parameters and the declarations
     * between two lines (inclusive).
     */
    public TypeEnvironment build(SourceBuffer source, FunctionScope scope, int fromLine, int boundLine) {
        TypeEnvironment environment = new TypeEnvironment();

        // Step 1: Seed from the enclosing function's parameters
        if (scope.isInsideFunction()) {
            FunctionSignature signature = FunctionSignature.parse(source, scope.getStartLine());
            if (signature != null) {
                for (FunctionSignature.Parameter parameter : signature.getParameters()) {
                    if (PARAMETER_TYPES.contains(parameter.getType())) {
                        environment.bind(parameter.getName(), parameter.getType());
                    }
                }
            }
        }

        // Step 2: Every typed declaration up to the bound
        int last = Math.min(boundLine, source.size() - 1);
        for (int i = Math.max(0, fromLine); i <= last; i++) {
            String code = source.code(i);
            for (GlslType type : GlslType.DECLARATION_ORDER) {
                Matcher matcher = DECLARATION_PATTERNS.get(type).matcher(code);
                if (matcher.find()) {
                    environment.bind(matcher.group(1), type.getKeyword());
                }
            }
        }

        LOGGER.trace("Type environment at line {}: {}", boundLine, environment);
        return environment;
    }
}
