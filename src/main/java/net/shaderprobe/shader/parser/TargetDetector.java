package net.shaderprobe.shader.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which variable a statement writes, trying a fixed list of patterns in
 * priority order. The first pattern that yields a known variable decides.
 */
public class TargetDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(TargetDetector.class);

    private static final Pattern RETURN_STATEMENT = Pattern.compile("(?:^|[{;])\\s*return\\s+[^;]+;");

    private static final Map<GlslType, Pattern> DECLARATIONS;

    private static final List<Pattern> REASSIGNMENTS = List.of(
        Pattern.compile("(\\w+)\\s*\\*="),
        Pattern.compile("(\\w+)\\s*\\+="),
        Pattern.compile("(\\w+)\\s*-="),
        Pattern.compile("(\\w+)\\s*/="),
        Pattern.compile("^\\s*(\\w+)\\s*=(?!\\s*=)")
    );

    private static final String MEMBER_OPERATOR = "\\s*(?:\\*=|\\+=|-=|/=|=(?!=))";

    private static final List<Pattern> MEMBER_WRITES = List.of(
        Pattern.compile("(\\w+)\\.[xyzw]\\b" + MEMBER_OPERATOR),
        Pattern.compile("(\\w+)\\.[rgba]\\b" + MEMBER_OPERATOR),
        Pattern.compile("(\\w+)\\.(?:[xyzw]{2,4}|[rgba]{2,4})\\b" + MEMBER_OPERATOR)
    );

    static {
        Map<GlslType, Pattern> declarations = new LinkedHashMap<>();
        for (GlslType type : GlslType.DECLARATION_ORDER) {
            declarations.put(type, Pattern.compile("\\b" + type.getKeyword() + "\\s+(\\w+)\\s*=(?!=)"));
        }
        DECLARATIONS = Collections.unmodifiableMap(declarations);
    }

    /**
     * Detects the debug target of a statement.
     *
     * @param statement joined statement text
     * @param environment names visible at the statement
     * @param returnType return type keyword of the enclosing function, or null at global level
     * @return the target, or null if nothing visualizable is written
     */
    public DebugTarget detect(String statement, TypeEnvironment environment, String returnType) {
        if (statement == null || statement.isBlank()) {
            return null;
        }

        // Step 1: Return statements capture the function result
        Optional<GlslType> visualizableReturn = GlslType.fromKeyword(returnType);
        if (visualizableReturn.isPresent() && RETURN_STATEMENT.matcher(statement).find()) {
            return new DebugTarget(DebugTarget.RETURN_VARIABLE, visualizableReturn.get());
        }

        // Step 2: Typed declarations
        for (Map.Entry<GlslType, Pattern> entry : DECLARATIONS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(statement);
            if (matcher.find()) {
                return new DebugTarget(matcher.group(1), entry.getKey());
            }
        }

        // Step 3: Compound and plain reassignment of a known variable
        String written = findKnownName(REASSIGNMENTS, statement, environment);

        // Step 4: Member and swizzle writes visualize the whole base variable
        if (written == null) {
            written = findKnownName(MEMBER_WRITES, statement, environment);
        }

        if (written == null) {
            return null;
        }

        Optional<GlslType> type = GlslType.fromKeyword(environment.typeOf(written));
        if (type.isEmpty()) {
            LOGGER.debug("Variable '{}' has unsupported type '{}'", written, environment.typeOf(written));
            return null;
        }
        return new DebugTarget(written, type.get());
    }

    /**
     * Returns the name captured by the first pattern whose match is a known variable.
     */
    private String findKnownName(List<Pattern> patterns, String statement, TypeEnvironment environment) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(statement);
            if (matcher.find() && environment.contains(matcher.group(1))) {
                return matcher.group(1);
            }
        }
        return null;
    }
}
