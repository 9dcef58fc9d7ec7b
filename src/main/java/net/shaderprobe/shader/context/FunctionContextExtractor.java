package net.shaderprobe.shader.context;

import net.shaderprobe.shader.config.ShaderDebugConfig;
import net.shaderprobe.shader.parser.FunctionScope;
import net.shaderprobe.shader.parser.FunctionSignature;
import net.shaderprobe.shader.parser.LoopHeader;
import net.shaderprobe.shader.parser.ScopeResolver;
import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Describes the function around a line: its signature, candidate arguments for
 * each parameter, and the loops that contain the line.
 */
public class FunctionContextExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionContextExtractor.class);

    private static final Set<String> CONTEXT_RETURN_TYPES = Set.of(
        "void", "float", "vec2", "vec3", "vec4", "mat2", "mat3", "mat4", "int", "bool"
    );

    private static final Set<String> PARAMETER_TYPES = Set.of(
        "vec2", "vec3", "vec4", "float", "int", "bool", "mat2", "mat3", "mat4", "sampler2D"
    );

    private final ShaderDebugConfig config;
    private final ScopeResolver scopeResolver = new ScopeResolver();

    public FunctionContextExtractor(ShaderDebugConfig config) {
        this.config = config;
    }

    /**
     * Extracts the context of a line.
     *
     * @return the context, or null if the line is outside every function
     */
    public DebugFunctionContext extract(String source, int line) {
        SourceBuffer buffer = SourceBuffer.of(source);
        if (!buffer.isValidLine(line)) {
            throw new IllegalArgumentException("Line " + line + " outside source of " + buffer.size() + " lines");
        }

        FunctionScope scope = scopeResolver.resolve(buffer, line);
        if (!scope.isInsideFunction()) {
            return null;
        }

        FunctionSignature signature = FunctionSignature.parse(buffer, scope.getStartLine());
        String returnType = signature != null && CONTEXT_RETURN_TYPES.contains(signature.getReturnType())
            ? signature.getReturnType()
            : "void";

        List<DebugParameterInfo> parameters = new ArrayList<>();
        if (signature != null) {
            for (FunctionSignature.Parameter parameter : signature.getParameters()) {
                if (parameter.isOutOnly() || !PARAMETER_TYPES.contains(parameter.getType())) {
                    continue;
                }
                parameters.add(describe(parameter));
            }
        }

        List<DebugLoopInfo> loops = containingLoops(buffer, scope, line);
        boolean isFunction = !scope.getName().equals(config.getEntryFunction());

        DebugFunctionContext context = new DebugFunctionContext(scope.getName(), returnType, parameters, isFunction, loops);
        LOGGER.debug("Context for line {}: {}", line, context);
        return context;
    }

    private DebugParameterInfo describe(FunctionSignature.Parameter parameter) {
        String type = parameter.getType();
        String centered = "((2.0 * " + config.getCoordInput() + " - " + config.getResolutionUniform() + ".xy) / "
            + config.getResolutionUniform() + ".y)";

        String uvValue;
        String centeredValue;
        String defaultValue;
        switch (type) {
            case "vec2":
                uvValue = "uv";
                centeredValue = centered;
                defaultValue = "vec2(0.5)";
                break;
            case "float":
                uvValue = "uv.x";
                centeredValue = centered + ".x";
                defaultValue = "0.5";
                break;
            case "vec3":
                uvValue = "vec3(uv, 0.0)";
                centeredValue = "vec3(" + centered + ", 0.0)";
                defaultValue = "vec3(0.5)";
                break;
            case "vec4":
                uvValue = "vec4(uv, 0.0, 1.0)";
                centeredValue = "vec4(" + centered + ", 0.0, 1.0)";
                defaultValue = "vec4(0.5)";
                break;
            case "int":
                uvValue = "int(uv.x * 10.0)";
                centeredValue = "int(" + centered + ".x * 10.0)";
                defaultValue = "1";
                break;
            case "bool":
                uvValue = "uv.x > 0.5";
                centeredValue = config.getCoordInput() + ".x > " + config.getResolutionUniform() + ".x * 0.5";
                defaultValue = "true";
                break;
            case "mat2":
            case "mat3":
            case "mat4":
                uvValue = type + "(uv.x)";
                centeredValue = type + "(" + centered + ".x)";
                defaultValue = type + "(1.0)";
                break;
            default:
                // Textures have no coordinate-derived form
                uvValue = config.getDefaultSampler();
                centeredValue = config.getDefaultSampler();
                defaultValue = config.getDefaultSampler();
                break;
        }

        ParameterMode mode = type.equals("vec2") ? ParameterMode.UV : ParameterMode.CUSTOM;
        return new DebugParameterInfo(parameter.getName(), type, uvValue, centeredValue, defaultValue, mode);
    }

    /**
     * Loops of the function whose body contains the line, outermost first. Indices
     * count every loop after the function header, matching the loop capper.
     */
    private List<DebugLoopInfo> containingLoops(SourceBuffer buffer, FunctionScope scope, int line) {
        List<DebugLoopInfo> loops = new ArrayList<>();
        int functionEnd = scope.isTerminated() ? scope.getEndLine() : buffer.size() - 1;
        int loopIndex = 0;

        for (int i = scope.getStartLine() + 1; i <= functionEnd; i++) {
            LoopHeader header = LoopHeader.parse(buffer, i);
            if (header == null) {
                continue;
            }

            int index = loopIndex++;
            int end = header.findBodyEnd(buffer);
            if (end < 0) {
                end = functionEnd;
            }

            boolean closingLine = line == end && buffer.code(end).trim().startsWith("}");
            if (line > header.getLine() && line <= end && !closingLine) {
                loops.add(new DebugLoopInfo(index, header.getLine(), end, header.text(buffer)));
            }
        }

        return loops;
    }
}
