package net.shaderprobe.shader.parser;

import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the function that lexically encloses a line by walking braces backward
 * from it, then locates the function's closing brace by walking forward.
 */
public class ScopeResolver {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScopeResolver.class);

    /**
     * Return-type keywords a function header may start with.
     */
    public static final String RETURN_TYPES =
        "void|float|double|int|uint|bool|[biud]?vec[234]|d?mat[234](?:x[234])?";

    public static final Pattern FUNCTION_HEADER = Pattern.compile(
        "^\\s*(" + RETURN_TYPES + ")\\s+(\\w+)\\s*\\("
    );

    private static final Pattern BARE_OPEN_BRACE = Pattern.compile("^\\s*\\{\\s*$");

    /**
     * Resolves the scope of a line.
     *
     * @param source tokenized shader source
     * @param targetLine 0-based line index
     * @return the enclosing function, or {@link FunctionScope#global()} if there is none
     */
    public FunctionScope resolve(SourceBuffer source, int targetLine) {
        if (!source.isValidLine(targetLine)) {
            throw new IllegalArgumentException("Target line " + targetLine + " outside source of "
                + source.size() + " lines");
        }

        int depth = 0;
        for (int i = targetLine; i >= 0; i--) {
            depth += source.closeBraces(i) - source.openBraces(i);

            Matcher header = FUNCTION_HEADER.matcher(source.code(i));
            if (header.find() && isEnclosingHeader(source, i, depth)) {
                String name = header.group(2);
                int end = findFunctionEnd(source, i);
                if (end < 0) {
                    LOGGER.debug("Function '{}' starting at line {} is never closed", name, i);
                }
                return new FunctionScope(name, i, end);
            }

            if (depth > 0) {
                // More closes than opens: the target sits after a function body
                break;
            }
        }

        return FunctionScope.global();
    }

    private boolean isEnclosingHeader(SourceBuffer source, int line, int depth) {
        if (depth < 0) {
            return true;
        }
        if (depth != 0) {
            return false;
        }
        if (source.openBraces(line) > 0) {
            return true;
        }
        return source.isValidLine(line + 1) && BARE_OPEN_BRACE.matcher(source.code(line + 1)).matches();
    }

    /**
     * Scans forward from a function header to the brace that closes its body.
     *
     * @return the closing line, or -1 if the body never closes
     */
    public int findFunctionEnd(SourceBuffer source, int headerLine) {
        int depth = 0;
        boolean opened = false;

        for (int i = headerLine; i < source.size(); i++) {
            String code = source.code(i);
            for (int c = 0; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '{') {
                    depth++;
                    opened = true;
                } else if (ch == '}') {
                    depth--;
                    if (opened && depth == 0) {
                        return i;
                    }
                }
            }
        }

        return -1;
    }

    /**
     * Finds the header line of the first function with the given name that has a body.
     *
     * @return the header line, or -1 if no such function exists
     */
    public int findFunction(SourceBuffer source, String name) {
        for (int i = 0; i < source.size(); i++) {
            Matcher header = FUNCTION_HEADER.matcher(source.code(i));
            if (header.find() && header.group(2).equals(name) && isEnclosingHeader(source, i, 0)) {
                return i;
            }
        }
        return -1;
    }
}
