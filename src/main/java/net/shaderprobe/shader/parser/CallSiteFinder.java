package net.shaderprobe.shader.parser;

import net.shaderprobe.shader.source.SourceBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates calls of a function within a line range and splits their arguments
 * on top-level commas.
 */
public class CallSiteFinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(CallSiteFinder.class);

    private static final int MAX_CALL_LINES = 10;

    /**
     * Finds the first call of a function between two lines (inclusive). Lines that
     * declare a function of that name are skipped.
     *
     * @return the call, or null if there is none
     */
    public CallSite findFirstCall(SourceBuffer source, String functionName, int fromLine, int toLine) {
        Pattern call = Pattern.compile("\\b" + Pattern.quote(functionName) + "\\s*\\(");
        Pattern declaration = Pattern.compile(
            "^\\s*(?:" + ScopeResolver.RETURN_TYPES + ")\\s+" + Pattern.quote(functionName) + "\\s*\\("
        );

        int last = Math.min(toLine, source.size() - 1);
        for (int i = Math.max(0, fromLine); i <= last; i++) {
            String code = source.code(i);
            if (declaration.matcher(code).find()) {
                continue;
            }

            Matcher matcher = call.matcher(code);
            if (matcher.find()) {
                List<String> arguments = readArguments(source, i, matcher.end() - 1);
                if (arguments != null) {
                    CallSite site = new CallSite(functionName, i, arguments);
                    LOGGER.debug("Found {}", site);
                    return site;
                }
            }
        }

        return null;
    }

    /**
     * Reads the argument list that starts at an opening parenthesis.
     *
     * @return the arguments, or null if the parenthesis is never closed
     */
    private List<String> readArguments(SourceBuffer source, int line, int openColumn) {
        List<String> arguments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        int last = Math.min(source.size() - 1, line + MAX_CALL_LINES);

        for (int i = line; i <= last; i++) {
            String code = source.code(i);
            for (int c = i == line ? openColumn : 0; c < code.length(); c++) {
                char ch = code.charAt(c);
                if (ch == '(' || ch == '[') {
                    depth++;
                    if (depth == 1) {
                        continue;
                    }
                } else if (ch == ')' || ch == ']') {
                    depth--;
                    if (depth == 0) {
                        String argument = current.toString().trim();
                        if (!argument.isEmpty() || !arguments.isEmpty()) {
                            arguments.add(argument);
                        }
                        return arguments;
                    }
                } else if (ch == ',' && depth == 1) {
                    arguments.add(current.toString().trim());
                    current.setLength(0);
                    continue;
                }
                current.append(ch);
            }
            current.append(' ');
        }

        return null;
    }
}
