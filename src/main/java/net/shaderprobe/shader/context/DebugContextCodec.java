package net.shaderprobe.shader.context;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import net.shaderprobe.shader.codegen.DebugOptions;
import net.shaderprobe.shader.codegen.VisualizationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Exchanges {@link DebugFunctionContext} with a host as JSON and turns an edited
 * context back into generator inputs.
 */
public class DebugContextCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(DebugContextCodec.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public static String toJson(DebugFunctionContext context) {
        return GSON.toJson(context);
    }

    /**
     * Parses a context sent back by the host.
     *
     * @throws com.google.gson.JsonSyntaxException if the text is not valid JSON for a context
     */
    public static DebugFunctionContext fromJson(String json) {
        return GSON.fromJson(json, DebugFunctionContext.class);
    }

    /**
     * Saves a context next to a shader so a session can be restored.
     */
    public static void save(DebugFunctionContext context, Path file) {
        try {
            Files.writeString(file, toJson(context));
            LOGGER.info("Saved debug context for '{}' to: {}", context.getFunctionName(), file);

        } catch (IOException e) {
            LOGGER.error("Failed to save debug context to: {}", file, e);
        }
    }

    /**
     * Loads a saved context, or returns null if the file is missing or unreadable.
     */
    public static DebugFunctionContext load(Path file) {
        try {
            if (Files.exists(file)) {
                return fromJson(Files.readString(file));
            }
        } catch (IOException e) {
            LOGGER.error("Failed to load debug context from: {}", file, e);
        }
        return null;
    }

    /**
     * Argument expressions for the synthesized call, keyed by parameter index of the
     * full signature. Only helpers get arguments; out parameters are not listed in
     * the context, so indices are recomputed against the parameter names.
     */
    public static Map<Integer, String> customArguments(DebugFunctionContext context, List<String> signatureNames) {
        Map<Integer, String> arguments = new TreeMap<>();
        if (context == null || !context.isFunction()) {
            return arguments;
        }

        for (DebugParameterInfo parameter : context.getParameters()) {
            int index = signatureNames.indexOf(parameter.getName());
            String value = parameter.selectedValue();
            if (index >= 0 && value != null && !value.isBlank()) {
                arguments.put(index, value);
            }
        }
        return arguments;
    }

    /**
     * Argument expressions keyed by position in the context's parameter list, which
     * equals the signature position when the helper has no out parameters.
     */
    public static Map<Integer, String> customArguments(DebugFunctionContext context) {
        List<String> names = new ArrayList<>();
        if (context != null) {
            for (DebugParameterInfo parameter : context.getParameters()) {
                names.add(parameter.getName());
            }
        }
        return customArguments(context, names);
    }

    /**
     * Iteration ceilings for the loops the host has capped.
     */
    public static Map<Integer, Integer> loopCeilings(DebugFunctionContext context) {
        Map<Integer, Integer> ceilings = new TreeMap<>();
        if (context == null) {
            return ceilings;
        }

        for (DebugLoopInfo loop : context.getLoops()) {
            if (loop.getMaxIter() != null) {
                ceilings.put(loop.getLoopIndex(), loop.getMaxIter());
            }
        }
        return ceilings;
    }

    /**
     * Builds generator options from an edited context.
     */
    public static DebugOptions toDebugOptions(DebugFunctionContext context, VisualizationOptions visualization) {
        return DebugOptions.builder()
            .customArguments(customArguments(context))
            .visualization(visualization)
            .build();
    }
}
