package net.shaderprobe.shader.parser;

import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Return type, name and parameter list of a function header.
 */
public class FunctionSignature {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionSignature.class);

    private static final Pattern PARAMETER = Pattern.compile(
        "^\\s*(?:const\\s+)?(?:(in|out|inout)\\s+)?(?:(?:lowp|mediump|highp)\\s+)?(\\w+)\\s+(\\w+)\\s*(?:\\[[^\\]]*\\])?\\s*$"
    );

    private static final int MAX_HEADER_LINES = 10;

    private final String returnType;
    private final String name;
    private final List<Parameter> parameters;

    public FunctionSignature(String returnType, String name, List<Parameter> parameters) {
        this.returnType = returnType;
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    /**
     * Parses the header starting at the given line. The parameter list may continue
     * over following lines.
     *
     * @return the signature, or null if the line is not a function header
     */
    public static FunctionSignature parse(SourceBuffer source, int headerLine) {
        if (!source.isValidLine(headerLine)) {
            return null;
        }

        Matcher header = ScopeResolver.FUNCTION_HEADER.matcher(source.code(headerLine));
        if (!header.find()) {
            return null;
        }

        StringBuilder parameterText = new StringBuilder();
        int depth = 0;
        boolean closed = false;
        int lastLine = Math.min(source.size(), headerLine + MAX_HEADER_LINES);

        outer:
        for (int i = headerLine; i < lastLine; i++) {
            String code = source.code(i);
            int from = i == headerLine ? header.end() - 1 : 0;
            for (int c = from; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '(') {
                    depth++;
                    if (depth == 1) {
                        continue;
                    }
                } else if (ch == ')') {
                    depth--;
                    if (depth == 0) {
                        closed = true;
                        break outer;
                    }
                }
                parameterText.append(ch);
            }
            parameterText.append(' ');
        }

        if (!closed) {
            LOGGER.debug("Parameter list of '{}' at line {} is not closed", header.group(2), headerLine);
        }

        return new FunctionSignature(header.group(1), header.group(2), parseParameters(parameterText.toString()));
    }

    /**
     * Parses a comma separated GLSL parameter list. Entries that do not look like
     * "[qualifier] type name" (including a lone "void") are skipped.
     */
    public static List<Parameter> parseParameters(String parameterText) {
        List<Parameter> parameters = new ArrayList<>();
        if (parameterText == null || parameterText.isBlank()) {
            return parameters;
        }

        for (String entry : parameterText.split(",")) {
            Matcher matcher = PARAMETER.matcher(entry);
            if (matcher.matches()) {
                String qualifier = matcher.group(1) != null ? matcher.group(1) : "in";
                parameters.add(new Parameter(qualifier, matcher.group(2), matcher.group(3)));
            } else if (!entry.isBlank() && !entry.trim().equals("void")) {
                LOGGER.trace("Skipping unrecognized parameter '{}'", entry.trim());
            }
        }
        return parameters;
    }

    public String getReturnType() {
        return returnType;
    }

    /**
     * Gets the return type if it can be visualized.
     */
    public Optional<GlslType> getVisualizableReturnType() {
        return GlslType.fromKeyword(returnType);
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return String.format("FunctionSignature{%s %s(%s)}", returnType, name, parameters);
    }

    /**
     * A single declared parameter.
     */
    public static class Parameter {
        private final String qualifier;
        private final String type;
        private final String name;

        public Parameter(String qualifier, String type, String name) {
            this.qualifier = qualifier;
            this.type = type;
            this.name = name;
        }

        public String getType() {
            return type;
        }

        public String getName() {
            return name;
        }

        /**
         * True for out and inout parameters, which need an l-value argument.
         */
        public boolean isWritable() {
            return "out".equals(qualifier) || "inout".equals(qualifier);
        }

        public boolean isOutOnly() {
            return "out".equals(qualifier);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Parameter)) return false;
            Parameter other = (Parameter) obj;
            return qualifier.equals(other.qualifier) && type.equals(other.type) && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(qualifier, type, name);
        }

        @Override
        public String toString() {
            return qualifier + " " + type + " " + name;
        }
    }
}
