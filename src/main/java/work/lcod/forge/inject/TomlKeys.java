package work.lcod.forge.inject;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Key splitting and value quoting for the TOML line editor.
 */
final class TomlKeys {
    private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z0-9_-]+");

    private TomlKeys() {}

    /**
     * Splits a dotted key expression ({@code registries."my.repo"}) into unquoted segments.
     */
    static List<String> split(String expression) {
        var segments = new ArrayList<String>();
        var current = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < expression.length(); i++) {
            char ch = expression.charAt(i);
            if (quote != 0) {
                if (ch == '\\' && quote == '"' && i + 1 < expression.length()) {
                    current.append(unescape(expression.charAt(++i)));
                } else if (ch == quote) {
                    quote = 0;
                } else {
                    current.append(ch);
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '.') {
                segments.add(current.toString().trim());
                current.setLength(0);
            } else if (!Character.isWhitespace(ch)) {
                current.append(ch);
            }
        }
        segments.add(current.toString().trim());
        return segments;
    }

    /**
     * Index of the first {@code =} outside quotes, or -1.
     */
    static int assignmentIndex(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quote != 0) {
                if (ch == '\\' && quote == '"') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }
            if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '#') {
                return -1;
            } else if (ch == '=') {
                return i;
            }
        }
        return -1;
    }

    static String renderKey(String segment) {
        return BARE_KEY.matcher(segment).matches() ? segment : quote(segment);
    }

    static String renderPath(List<String> path) {
        var parts = new ArrayList<String>(path.size());
        for (String segment : path) {
            parts.add(renderKey(segment));
        }
        return String.join(".", parts);
    }

    static String quote(String value) {
        var builder = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '"' -> builder.append("\\\"");
                case '\\' -> builder.append("\\\\");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> {
                    if (ch < 0x20 || ch == 0x7f) {
                        builder.append(String.format("\\u%04X", (int) ch));
                    } else {
                        builder.append(ch);
                    }
                }
            }
        }
        return builder.append('"').toString();
    }

    private static char unescape(char ch) {
        return switch (ch) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> ch;
        };
    }
}
