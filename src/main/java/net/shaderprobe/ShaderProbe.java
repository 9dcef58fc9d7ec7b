package net.shaderprobe;

import net.shaderprobe.shader.ShaderDebugger;
import net.shaderprobe.shader.codegen.DebugOptions;
import net.shaderprobe.shader.codegen.NormalizeMode;
import net.shaderprobe.shader.codegen.VisualizationOptions;
import net.shaderprobe.shader.config.ShaderDebugConfig;
import net.shaderprobe.shader.context.DebugContextCodec;
import net.shaderprobe.shader.context.DebugFunctionContext;
import net.shaderprobe.shader.context.FunctionContextExtractor;
import net.shaderprobe.shader.parser.FunctionScope;
import net.shaderprobe.shader.parser.FunctionSignature;
import net.shaderprobe.shader.parser.ScopeResolver;
import net.shaderprobe.shader.preprocessing.BraceBalancer;
import net.shaderprobe.shader.preprocessing.LoopIterationCapper;
import net.shaderprobe.shader.preprocessing.OutputPostProcessor;
import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Entry points for line-level shader debugging, using the configuration found on
 * the classpath.
 */
public final class ShaderProbe {
    public static final String ID = "shaderprobe";

    public static final Logger LOGGER = LoggerFactory.getLogger(ID);

    private static final ShaderDebugConfig CONFIG = ShaderDebugConfig.load();
    private static final ShaderDebugger DEBUGGER = new ShaderDebugger(CONFIG);
    private static final FunctionContextExtractor CONTEXT_EXTRACTOR = new FunctionContextExtractor(CONFIG);
    private static final OutputPostProcessor POST_PROCESSOR = new OutputPostProcessor(CONFIG);

    private ShaderProbe() {
    }

    /**
     * Rewrites a shader so its output shows the value written on a line.
     *
     * @param source complete shader source
     * @param targetLine 0-based line index
     * @param rawLine the line's text as shown to the user, or null
     * @return the debug program, or null if the line has no visualizable target
     */
    public static String transform(String source, int targetLine, String rawLine) {
        return DEBUGGER.transform(source, targetLine, rawLine);
    }

    public static String transform(String source, int targetLine, String rawLine, DebugOptions options) {
        return DEBUGGER.transform(source, targetLine, rawLine, options);
    }

    /**
     * Bounds the selected loops after {@code startOffset} with iteration counters.
     */
    public static List<String> capLoopIterations(List<String> lines, int startOffset, Map<Integer, Integer> ceilings) {
        return LoopIterationCapper.capLoopIterations(lines, startOffset, ceilings);
    }

    /**
     * Appends a '}' line for every brace left open after {@code startOffset}.
     */
    public static List<String> closeOpenBraces(List<String> lines, int startOffset) {
        return BraceBalancer.closeOpenBraces(lines, startOffset);
    }

    /**
     * Normalizes or thresholds the final color of an unmodified shader.
     *
     * @return the processed source, or null when nothing applies
     */
    public static String applyOutputPostProcessing(String source, NormalizeMode mode, Double stepEdge) {
        return POST_PROCESSOR.apply(source, mode, stepEdge);
    }

    /**
     * Describes the function around a line for a host panel.
     *
     * @return the context, or null at global level
     */
    public static DebugFunctionContext extractFunctionContext(String source, int line) {
        return CONTEXT_EXTRACTOR.extract(source, line);
    }

    /**
     * Turns a context edited by the host into generator options. Parameter indices
     * are matched against the full signature of the function around the line.
     */
    public static DebugOptions toDebugOptions(String source, int line, DebugFunctionContext context,
                                              VisualizationOptions visualization) {
        SourceBuffer buffer = SourceBuffer.of(source);
        ScopeResolver resolver = new ScopeResolver();
        FunctionScope scope = resolver.resolve(buffer, line);

        List<String> names = new ArrayList<>();
        FunctionSignature signature = scope.isInsideFunction()
            ? FunctionSignature.parse(buffer, scope.getStartLine())
            : null;
        if (signature != null) {
            for (FunctionSignature.Parameter parameter : signature.getParameters()) {
                names.add(parameter.getName());
            }
        }

        DebugOptions options = DebugOptions.builder()
            .customArguments(DebugContextCodec.customArguments(context, names))
            .visualization(visualization)
            .build();
        LOGGER.debug("Options for line {} from context: {}", line, options);
        return options;
    }

    public static ShaderDebugConfig getConfig() {
        return CONFIG;
    }
}
