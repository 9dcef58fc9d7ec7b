package net.shaderprobe.shader.codegen;

import net.shaderprobe.shader.config.ShaderDebugConfig;
import net.shaderprobe.shader.parser.*;
import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes a fresh entry function that calls a helper and visualizes its result.
 * Arguments come from an existing call in the original entry function when they
 * can be reproduced there, and from per-type defaults otherwise.
 */
public class EntryPointSynthesizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(EntryPointSynthesizer.class);

    public static final String RESULT_VARIABLE = "result";

    private static final Pattern SIMPLE_ARGUMENT = Pattern.compile("^([A-Za-z_]\\w*)(?:\\.[xyzwrgba]+)?$");

    private static final Pattern USES_UV = Pattern.compile("\\buv\\b");

    private static final Pattern CONTROL_LINE = Pattern.compile(
        "^\\s*(?:if|else|for|while|do|switch|case|default|return|break|continue|discard)\\b"
    );

    private final ShaderDebugConfig config;
    private final Visualizer visualizer;
    private final CallSiteFinder callSiteFinder = new CallSiteFinder();
    private final TypeEnvironmentBuilder environmentBuilder = new TypeEnvironmentBuilder();

    public EntryPointSynthesizer(ShaderDebugConfig config) {
        this.config = config;
        this.visualizer = new Visualizer(config.getColorOutput());
    }

    /**
     * Builds the entry function lines.
     *
     * @param source original source
     * @param helper signature of the helper being debugged
     * @param resultType type the rewritten helper now returns
     * @param entryScope the original entry function, or null if the source has none
     * @param options argument overrides and visualization
     */
    public List<String> synthesize(SourceBuffer source, FunctionSignature helper, GlslType resultType,
                                   FunctionScope entryScope, DebugOptions options) {
        List<String> lines = new ArrayList<>();
        lines.add(config.entryHeader());

        List<String> setup = new ArrayList<>();
        List<String> arguments = reuseCallSite(source, helper, entryScope, setup);
        boolean reused = arguments != null;

        if (reused) {
            applyOverrides(helper, arguments, setup, options);
        } else {
            arguments = defaultArguments(helper, setup, options);
            boolean needsUv = arguments.stream().anyMatch(a -> USES_UV.matcher(a).find())
                || setup.stream().anyMatch(s -> USES_UV.matcher(s).find());
            if (needsUv) {
                lines.add(uvSetupLine());
            }
        }
        lines.addAll(setup);

        lines.add("  " + resultType.getKeyword() + " " + RESULT_VARIABLE + " = " + helper.getName()
            + "(" + String.join(", ", arguments) + ");");
        lines.addAll(visualizer.visualize(RESULT_VARIABLE, resultType, options.getVisualization()));
        lines.add("}");

        LOGGER.debug("Synthesized {} call of '{}' with arguments {}", reused ? "reused" : "default",
            helper.getName(), arguments);
        return lines;
    }

    /**
     * Reuses the first call of the helper in the entry function if every argument
     * is a variable declared there.
     *
     * @return the arguments, or null when the call can't be reproduced
     */
    private List<String> reuseCallSite(SourceBuffer source, FunctionSignature helper, FunctionScope entryScope,
                                       List<String> setup) {
        if (entryScope == null || !entryScope.isInsideFunction()) {
            return null;
        }

        int entryEnd = entryScope.isTerminated() ? entryScope.getEndLine() : source.size() - 1;
        CallSite call = callSiteFinder.findFirstCall(source, helper.getName(), entryScope.getStartLine() + 1, entryEnd);
        if (call == null || call.getArguments().size() != helper.getParameters().size()) {
            return null;
        }

        TypeEnvironment visible = environmentBuilder.build(source, entryScope, entryScope.getStartLine(), call.getLine());
        for (String argument : call.getArguments()) {
            Matcher matcher = SIMPLE_ARGUMENT.matcher(argument);
            if (!matcher.matches() || !visible.contains(matcher.group(1))) {
                LOGGER.debug("Argument '{}' of call at line {} is not a declared variable", argument, call.getLine());
                return null;
            }
        }

        for (int i = entryScope.getStartLine() + 1; i < call.getLine(); i++) {
            String code = source.code(i);
            if (code.isBlank() || code.indexOf('{') >= 0 || code.indexOf('}') >= 0
                || CONTROL_LINE.matcher(code).find()) {
                continue;
            }
            setup.add("  " + code.trim());
        }

        return new ArrayList<>(call.getArguments());
    }

    /**
     * Replaces reused arguments with custom expressions. A writable parameter gets a
     * local initialized to the expression instead.
     */
    private void applyOverrides(FunctionSignature helper, List<String> arguments, List<String> setup,
                                DebugOptions options) {
        for (Map.Entry<Integer, String> override : options.getCustomArguments().entrySet()) {
            int index = override.getKey();
            if (index >= arguments.size()) {
                warnOutOfRange(helper, index);
                continue;
            }

            FunctionSignature.Parameter parameter = helper.getParameters().get(index);
            if (parameter.isWritable()) {
                setup.add("  " + parameter.getType() + " " + writableName(index) + " = " + override.getValue() + ";");
                arguments.set(index, writableName(index));
            } else {
                arguments.set(index, override.getValue());
            }
        }
    }

    private List<String> defaultArguments(FunctionSignature helper, List<String> setup, DebugOptions options) {
        List<String> arguments = new ArrayList<>();
        List<FunctionSignature.Parameter> parameters = helper.getParameters();

        for (Integer index : options.getCustomArguments().keySet()) {
            if (index >= parameters.size()) {
                warnOutOfRange(helper, index);
            }
        }

        for (int i = 0; i < parameters.size(); i++) {
            FunctionSignature.Parameter parameter = parameters.get(i);
            String custom = options.getCustomArgument(i);
            String value = custom != null ? custom : defaultValue(parameter.getType());

            if (parameter.isWritable()) {
                // out and inout need an l-value
                setup.add("  " + parameter.getType() + " " + writableName(i) + " = " + value + ";");
                arguments.add(writableName(i));
            } else {
                arguments.add(value);
            }
        }
        return arguments;
    }

    /**
     * Default argument expression for a parameter type.
     */
    public String defaultValue(String type) {
        switch (type) {
            case "vec2":
                return "uv";
            case "vec3":
                return "vec3(0.5)";
            case "vec4":
                return "vec4(0.5)";
            case "float":
                return "0.5";
            case "int":
                return "1";
            case "bool":
                return "true";
            case "mat2":
            case "mat3":
            case "mat4":
                return type + "(1.0)";
            case "sampler2D":
                return config.getDefaultSampler();
            default:
                return "0.0";
        }
    }

    public String uvSetupLine() {
        return "  vec2 uv = " + config.getCoordInput() + " / " + config.getResolutionUniform() + ".xy;";
    }

    private void warnOutOfRange(FunctionSignature helper, int index) {
        LOGGER.warn("Ignoring override for parameter {} of '{}': it has only {} parameters",
            index, helper.getName(), helper.getParameters().size());
    }

    private static String writableName(int index) {
        return "_dbgArg" + index;
    }
}
