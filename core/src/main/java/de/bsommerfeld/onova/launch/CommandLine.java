package de.bsommerfeld.onova.launch;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Joins and splits command lines using the Windows argument quoting rules
 * (the ones {@code CommandLineToArgvW} and the C runtime apply).
 *
 * <ul>
 * <li>arguments containing whitespace or quotes are wrapped in {@code "..."}</li>
 * <li>an embedded quote is written as {@code \"}</li>
 * <li>backslashes are literal unless they precede a quote, in which case
 * they are doubled</li>
 * </ul>
 *
 * <p>
 * {@code split(join(args))} returns {@code args} unchanged for any input.
 */
public final class CommandLine {

    private CommandLine() {
    }

    public static String join(List<String> arguments) {
        return arguments.stream().map(CommandLine::quote).collect(Collectors.joining(" "));
    }

    public static String quote(String argument) {
        if (!argument.isEmpty() && argument.chars().noneMatch(c -> Character.isWhitespace(c) || c == '"')) {
            return argument;
        }

        StringBuilder sb = new StringBuilder("\"");
        int backslashes = 0;
        for (int i = 0; i < argument.length(); i++) {
            char c = argument.charAt(i);
            if (c == '\\') {
                backslashes++;
                continue;
            }
            if (c == '"') {
                sb.append("\\".repeat(backslashes * 2 + 1));
            } else {
                sb.append("\\".repeat(backslashes));
            }
            backslashes = 0;
            sb.append(c);
        }
        // Backslashes before the closing quote must be doubled
        sb.append("\\".repeat(backslashes * 2));
        return sb.append('"').toString();
    }

    public static List<String> split(String commandLine) {
        List<String> result = new ArrayList<>();
        if (commandLine == null) {
            return result;
        }

        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean tokenStarted = false;

        int i = 0;
        while (i < commandLine.length()) {
            char c = commandLine.charAt(i);

            if (c == '\\') {
                int backslashes = 0;
                while (i < commandLine.length() && commandLine.charAt(i) == '\\') {
                    backslashes++;
                    i++;
                }
                tokenStarted = true;
                if (i < commandLine.length() && commandLine.charAt(i) == '"') {
                    current.append("\\".repeat(backslashes / 2));
                    if (backslashes % 2 == 1) {
                        current.append('"');
                        i++;
                    }
                } else {
                    current.append("\\".repeat(backslashes));
                }
                continue;
            }

            if (c == '"') {
                inQuotes = !inQuotes;
                tokenStarted = true;
            } else if (!inQuotes && Character.isWhitespace(c)) {
                if (tokenStarted) {
                    result.add(current.toString());
                    current.setLength(0);
                    tokenStarted = false;
                }
            } else {
                current.append(c);
                tokenStarted = true;
            }
            i++;
        }

        if (tokenStarted) {
            result.add(current.toString());
        }
        return result;
    }
}
