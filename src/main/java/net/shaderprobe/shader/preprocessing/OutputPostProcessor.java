package net.shaderprobe.shader.preprocessing;

import net.shaderprobe.shader.codegen.NormalizeMode;
import net.shaderprobe.shader.codegen.Visualizer;
import net.shaderprobe.shader.config.ShaderDebugConfig;
import net.shaderprobe.shader.parser.ScopeResolver;
import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Applies normalization or a step threshold to the final color of an unmodified
 * program, so the whole image can be inspected the same way as a debug target.
 */
public class OutputPostProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(OutputPostProcessor.class);

    private final ShaderDebugConfig config;
    private final ScopeResolver scopeResolver = new ScopeResolver();

    public OutputPostProcessor(ShaderDebugConfig config) {
        this.config = config;
    }

    /**
     * Inserts post-processing statements before the entry function's closing brace.
     *
     * @param source complete shader source
     * @param mode normalization to apply
     * @param stepEdge threshold for step(), or null
     * @return the processed source, or null if there is nothing to apply or no closed entry function
     */
    public String apply(String source, NormalizeMode mode, Double stepEdge) {
        if (source == null) {
            throw new IllegalArgumentException("Shader source cannot be null");
        }
        NormalizeMode normalize = mode != null ? mode : NormalizeMode.OFF;
        if (normalize == NormalizeMode.OFF && stepEdge == null) {
            return null;
        }

        SourceBuffer buffer = SourceBuffer.of(source);
        int entryStart = scopeResolver.findFunction(buffer, config.getEntryFunction());
        if (entryStart < 0) {
            LOGGER.debug("No {} function found for output post-processing", config.getEntryFunction());
            return null;
        }

        int entryEnd = scopeResolver.findFunctionEnd(buffer, entryStart);
        if (entryEnd < 0) {
            LOGGER.debug("{} function is never closed", config.getEntryFunction());
            return null;
        }

        String color = config.getColorOutput();
        List<String> inserted = new ArrayList<>();
        if (normalize == NormalizeMode.SOFT) {
            inserted.add("  " + color + ".rgb = " + color + ".rgb / (abs(" + color + ".rgb) + vec3(1.0)) * 0.5 + 0.5;");
        } else if (normalize == NormalizeMode.ABS) {
            inserted.add("  " + color + ".rgb = abs(" + color + ".rgb) / (abs(" + color + ".rgb) + vec3(1.0));");
        }
        if (stepEdge != null) {
            inserted.add(new Visualizer(color).stepLine(stepEdge));
        }

        List<String> lines = new ArrayList<>(buffer.getRawLines());
        String closing = lines.get(entryEnd);
        int brace = lastCloseBrace(buffer.code(entryEnd));

        if (closing.substring(0, brace).isBlank()) {
            lines.addAll(entryEnd, inserted);
        } else {
            // Closing brace shares its line with code
            lines.set(entryEnd, closing.substring(0, brace));
            List<String> tail = new ArrayList<>(inserted);
            tail.add(closing.substring(brace));
            lines.addAll(entryEnd + 1, tail);
        }

        LOGGER.debug("Applied output post-processing: normalize={}, step={}", normalize.getName(), stepEdge);
        return String.join("\n", lines);
    }

    private static int lastCloseBrace(String code) {
        return code.lastIndexOf('}');
    }
}
