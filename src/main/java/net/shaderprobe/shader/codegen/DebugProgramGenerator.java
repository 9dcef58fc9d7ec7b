package net.shaderprobe.shader.codegen;

import net.shaderprobe.shader.config.ShaderDebugConfig;
import net.shaderprobe.shader.parser.*;
import net.shaderprobe.shader.preprocessing.BraceBalancer;
import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a {@link RewritePlan} into a complete shader whose only output is the
 * value of the debug target.
 */
public class DebugProgramGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(DebugProgramGenerator.class);

    private static final Pattern HEADER_RETURN_TYPE = Pattern.compile(
        "^(\\s*)(?:" + ScopeResolver.RETURN_TYPES + ")(\\s+\\w+\\s*\\()"
    );

    private static final Pattern RETURN_KEYWORD = Pattern.compile("\\breturn\\b\\s*");

    private final ShaderDebugConfig config;
    private final Visualizer visualizer;
    private final ControlFlowStripper stripper = new ControlFlowStripper();
    private final ScopeResolver scopeResolver = new ScopeResolver();
    private final EntryPointSynthesizer synthesizer;

    public DebugProgramGenerator(ShaderDebugConfig config) {
        this.config = config;
        this.visualizer = new Visualizer(config.getColorOutput());
        this.synthesizer = new EntryPointSynthesizer(config);
    }

    /**
     * Generates the debug program for a plan.
     *
     * @param source tokenized original source
     * @param plan what to generate
     * @param rawLine text of the target line as shown to the user, used for one-liners
     * @param options argument overrides and visualization
     * @return the program text, or null if the plan cannot be realized
     */
    public String generate(SourceBuffer source, RewritePlan plan, String rawLine, DebugOptions options) {
        List<String> lines;
        switch (plan.getStrategy()) {
            case TRUNCATE_AND_CLOSE:
                lines = truncateAndClose(source, plan, options);
                break;
            case WRAP_AND_CALL:
                lines = wrapAndCall(source, plan, options);
                break;
            case ONE_LINER:
                lines = oneLiner(source, plan, rawLine, options);
                break;
            default:
                throw new IllegalStateException("Unknown strategy: " + plan.getStrategy());
        }

        if (lines == null) {
            return null;
        }
        return String.join("\n", lines);
    }

    /**
     * Keeps the entry function up to the target statement, then visualizes and closes it.
     */
    private List<String> truncateAndClose(SourceBuffer source, RewritePlan plan, DebugOptions options) {
        int start = plan.getScope().getStartLine();
        LogicalStatement statement = plan.getStatement();
        DebugTarget target = plan.getTarget();

        List<String> lines = new ArrayList<>(source.getRawLines().subList(0, start));
        lines.addAll(stripper.strip(source, start, statement.getEndLine()));
        dropTrailingCloses(lines, start);
        lines.addAll(visualizer.visualize(target.getName(), target.getType(), options.getVisualization()));

        return BraceBalancer.closeOpenBraces(lines, start);
    }

    /**
     * Makes the helper return the target value and calls it from a new entry function.
     */
    private List<String> wrapAndCall(SourceBuffer source, RewritePlan plan, DebugOptions options) {
        FunctionScope scope = plan.getScope();
        DebugTarget target = plan.getTarget();
        LogicalStatement statement = plan.getStatement();
        int helperStart = scope.getStartLine();

        FunctionSignature signature = FunctionSignature.parse(source, helperStart);
        if (signature == null) {
            LOGGER.warn("Could not parse header of '{}' at line {}", scope.getName(), helperStart);
            return null;
        }

        // Step 1: Capture a returned value and retype the helper
        List<String> rewritten = new ArrayList<>(source.getRawLines());
        if (target.isReturnValue()) {
            int returnLine = statement.getStartLine();
            Matcher returnKeyword = RETURN_KEYWORD.matcher(source.code(returnLine));
            if (returnKeyword.find()) {
                String raw = rewritten.get(returnLine);
                rewritten.set(returnLine, raw.substring(0, returnKeyword.start()) + target.getType().getKeyword()
                    + " " + DebugTarget.RETURN_VARIABLE + " = " + raw.substring(returnKeyword.end()));
            }
        }

        Matcher header = HEADER_RETURN_TYPE.matcher(rewritten.get(helperStart));
        rewritten.set(helperStart, header.replaceFirst("$1" + target.getType().getKeyword() + "$2"));
        SourceBuffer helperSource = SourceBuffer.of(rewritten);

        // Step 2: Everything before the helper except an earlier entry function
        int entryStart = scopeResolver.findFunction(source, config.getEntryFunction());
        FunctionScope entryScope = null;
        if (entryStart >= 0) {
            entryScope = new FunctionScope(config.getEntryFunction(), entryStart,
                scopeResolver.findFunctionEnd(source, entryStart));
        }

        List<String> lines = new ArrayList<>();
        for (int i = 0; i < helperStart; i++) {
            if (entryScope != null && entryStart < helperStart && i >= entryStart
                && (i <= entryScope.getEndLine() || !entryScope.isTerminated())) {
                continue;
            }
            lines.add(source.raw(i));
        }

        // Step 3: The helper body up to the statement, returning the target
        int helperOffset = lines.size();
        lines.addAll(stripper.strip(helperSource, helperStart, statement.getEndLine()));
        dropTrailingCloses(lines, helperOffset);
        lines.add("  return " + target.getName() + ";");
        lines = BraceBalancer.closeOpenBraces(lines, helperOffset);

        // Step 4: A new entry function calling the helper
        lines.add("");
        lines.addAll(synthesizer.synthesize(source, signature, target.getType(), entryScope, options));
        return lines;
    }

    /**
     * Runs a statement that lives outside every function inside a fresh entry function.
     */
    private List<String> oneLiner(SourceBuffer source, RewritePlan plan, String rawLine, DebugOptions options) {
        LogicalStatement statement = plan.getStatement();
        DebugTarget target = plan.getTarget();

        String body;
        if (statement.isMultiLine()) {
            body = statement.getText();
        } else if (rawLine != null) {
            body = rawLine.trim();
        } else {
            body = source.raw(statement.getStartLine()).trim();
        }

        List<String> lines = new ArrayList<>();
        lines.add(config.entryHeader());
        lines.add("  " + body);
        lines.addAll(visualizer.visualize(target.getName(), target.getType(), options.getVisualization()));
        lines.add("}");
        return lines;
    }

    /**
     * Removes closing braces that follow the target statement on its last line, as in
     * a function written on one line. The brace balancer closes them again after the
     * visualization.
     */
    private static void dropTrailingCloses(List<String> lines, int fromIndex) {
        if (lines.size() <= fromIndex) {
            return;
        }

        int last = lines.size() - 1;
        String raw = lines.get(last);
        String code = SourceBuffer.of(List.of(raw)).code(0);
        int semicolon = code.lastIndexOf(';');
        if (semicolon < 0) {
            return;
        }

        String rest = code.substring(semicolon + 1);
        if (rest.indexOf('}') >= 0 && rest.replace("}", "").isBlank()) {
            lines.set(last, raw.substring(0, semicolon + 1));
        }
    }
}
