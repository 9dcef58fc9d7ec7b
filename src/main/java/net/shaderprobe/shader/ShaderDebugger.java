package net.shaderprobe.shader;

import net.shaderprobe.shader.codegen.DebugOptions;
import net.shaderprobe.shader.codegen.DebugProgramGenerator;
import net.shaderprobe.shader.codegen.RewritePlan;
import net.shaderprobe.shader.codegen.VisualizationOptions;
import net.shaderprobe.shader.config.ShaderDebugConfig;
import net.shaderprobe.shader.parser.*;
import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a fragment shader so that its color output shows the value written on
 * a chosen line. Analysis runs in a fixed order: scope, type environment, statement,
 * target. Any step that finds nothing usable ends the request with no program.
 */
public class ShaderDebugger {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShaderDebugger.class);

    private final ShaderDebugConfig config;
    private final ScopeResolver scopeResolver = new ScopeResolver();
    private final TypeEnvironmentBuilder environmentBuilder = new TypeEnvironmentBuilder();
    private final StatementJoiner statementJoiner;
    private final TargetDetector targetDetector = new TargetDetector();
    private final DebugProgramGenerator generator;

    public ShaderDebugger() {
        this(ShaderDebugConfig.defaults());
    }

    public ShaderDebugger(ShaderDebugConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.config = config;
        this.statementJoiner = new StatementJoiner(config.getStatementScanLimit());
        this.generator = new DebugProgramGenerator(config);
    }

    /**
     * Transforms a shader with the configured visualization and no argument overrides.
     *
     * @see #transform(String, int, String, DebugOptions)
     */
    public String transform(String source, int targetLine, String rawLine) {
        DebugOptions options = DebugOptions.builder()
            .visualization(VisualizationOptions.normalized(config.getNormalizeMode()))
            .build();
        return transform(source, targetLine, rawLine, options);
    }

    /**
     * Transforms a shader so that it outputs the value written on a line.
     *
     * @param source complete shader source
     * @param targetLine 0-based index of the line to inspect
     * @param rawLine text of that line as the user sees it, or null to read it from the source
     * @param options argument overrides and visualization
     * @return the debug program, or null if the line writes nothing that can be shown
     * @throws IllegalArgumentException if the source is null or the line is out of range
     */
    public String transform(String source, int targetLine, String rawLine, DebugOptions options) {
        SourceBuffer buffer = SourceBuffer.of(source);
        if (!buffer.isValidLine(targetLine)) {
            throw new IllegalArgumentException("Target line " + targetLine + " outside source of "
                + buffer.size() + " lines");
        }
        DebugOptions effective = options != null ? options : DebugOptions.defaults();

        // Step 1: Enclosing function
        FunctionScope scope = scopeResolver.resolve(buffer, targetLine);
        if (scope.isInsideFunction() && !scope.isTerminated()) {
            LOGGER.debug("Function '{}' is unterminated, generating up to end of document", scope.getName());
        }

        // Step 2: Names visible at the target
        TypeEnvironment environment = environmentBuilder.build(buffer, scope, targetLine);

        // Step 3: Full statement around the target
        LogicalStatement statement = statementJoiner.join(buffer, targetLine);
        if (!statement.isTerminated()) {
            LOGGER.debug("Statement at line {} has no terminator, using the line alone", targetLine);
        }

        // Step 4: Variable written by the statement
        String returnType = null;
        if (scope.isInsideFunction()) {
            FunctionSignature signature = FunctionSignature.parse(buffer, scope.getStartLine());
            returnType = signature != null ? signature.getReturnType() : null;
        }
        DebugTarget target = targetDetector.detect(statement.getText(), environment, returnType);
        if (target == null) {
            LOGGER.debug("No debug target on line {}: '{}'", targetLine, statement.getText());
            return null;
        }

        RewritePlan plan = RewritePlan.of(scope, config.getEntryFunction(), target, statement);
        LOGGER.debug("Line {}: {}", targetLine, plan);

        return generator.generate(buffer, plan, rawLine, effective);
    }

    public ShaderDebugConfig getConfig() {
        return config;
    }
}
