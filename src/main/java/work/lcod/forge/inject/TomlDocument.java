package work.lcod.forge.inject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Line-oriented TOML editor. Values are replaced or appended inside their table section while
 * every other line (comments, ordering, unrelated tables) is kept verbatim. A table that is
 * already defined inline ({@code name = { index = "..." }}) or through dotted keys in a parent
 * section is edited where it is defined. tomlj validates the document before and after each
 * edit.
 */
public final class TomlDocument {
    private final List<String> lines;
    private final String newline;
    private boolean trailingNewline;

    private TomlDocument(List<String> lines, String newline, boolean trailingNewline) {
        this.lines = lines;
        this.newline = newline;
        this.trailingNewline = trailingNewline;
    }

    public static TomlDocument parse(String text) {
        var source = text == null ? "" : text;
        var parsed = Toml.parse(source);
        if (parsed.hasErrors()) {
            throw new ConfigurationException("Invalid TOML: " + parsed.errors().get(0).toString());
        }
        var newline = source.contains("\r\n") ? "\r\n" : "\n";
        var lines = new ArrayList<String>();
        boolean trailing = false;
        if (!source.isEmpty()) {
            lines.addAll(Arrays.asList(source.split(Pattern.quote(newline), -1)));
            if (lines.get(lines.size() - 1).isEmpty()) {
                lines.remove(lines.size() - 1);
                trailing = true;
            }
        }
        return new TomlDocument(lines, newline, trailing);
    }

    /**
     * Sets {@code key} inside {@code table} to a string value, creating the table at the end of
     * the document when it has no header yet.
     */
    public TomlDocument setString(List<String> table, String key, String value) {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        var rendered = TomlKeys.renderKey(key) + " = " + TomlKeys.quote(value);
        var section = findSection(table);
        if (section != null) {
            replaceOrInsert(section, key, rendered);
        } else if (!setInParent(table, key, value)) {
            if (!lines.isEmpty() && !lines.get(lines.size() - 1).isBlank()) {
                lines.add("");
            }
            lines.add("[" + TomlKeys.renderPath(table) + "]");
            lines.add(rendered);
            trailingNewline = true;
        }
        var check = toToml();
        var path = new ArrayList<>(table);
        path.add(key);
        if (!value.equals(check.getString(path))) {
            throw new ConfigurationException("Unable to set " + TomlKeys.renderPath(path) + ": the key is defined outside its table section");
        }
        return this;
    }

    public String render() {
        var text = String.join(newline, lines);
        return trailingNewline && !lines.isEmpty() ? text + newline : text;
    }

    public TomlParseResult toToml() {
        var parsed = Toml.parse(render());
        if (parsed.hasErrors()) {
            throw new ConfigurationException("Edit produced invalid TOML: " + parsed.errors().get(0).toString());
        }
        return parsed;
    }

    private void replaceOrInsert(Section section, String key, String rendered) {
        boolean inMultiline = false;
        for (int i = section.start(); i < section.end(); i++) {
            var line = lines.get(i);
            if (!inMultiline && keyMatches(line, key)) {
                lines.set(i, leadingWhitespace(line) + rendered);
                return;
            }
            inMultiline = toggles(line) != inMultiline;
        }
        insertAtEnd(section, rendered);
    }

    private void insertAtEnd(Section section, String line) {
        int insertAt = section.end();
        while (insertAt > section.start() && lines.get(insertAt - 1).isBlank()) {
            insertAt--;
        }
        lines.add(insertAt, line);
    }

    // the table has no header of its own; look for it inline or as dotted keys under an ancestor
    private boolean setInParent(List<String> table, String key, String value) {
        for (int depth = table.size() - 1; depth >= 0; depth--) {
            var parent = findSection(table.subList(0, depth));
            if (parent == null) {
                continue;
            }
            var rest = table.subList(depth, table.size());
            if (setInline(parent, rest, key, value) || setDotted(parent, rest, key, value)) {
                return true;
            }
        }
        return false;
    }

    private boolean setInline(Section section, List<String> rest, String key, String value) {
        boolean inMultiline = false;
        for (int i = section.start(); i < section.end(); i++) {
            var line = lines.get(i);
            if (!inMultiline) {
                int index = TomlKeys.assignmentIndex(line);
                if (index > 0 && rest.equals(TomlKeys.split(line.substring(0, index)))) {
                    int open = line.indexOf('{', index);
                    if (open < 0 || !line.substring(index + 1, open).isBlank()) {
                        return false;
                    }
                    lines.set(i, withInlineEntry(line, open, key, value));
                    return true;
                }
            }
            inMultiline = toggles(line) != inMultiline;
        }
        return false;
    }

    private boolean setDotted(Section section, List<String> rest, String key, String value) {
        var full = new ArrayList<>(rest);
        full.add(key);
        var rendered = TomlKeys.renderPath(full) + " = " + TomlKeys.quote(value);
        boolean found = false;
        boolean inMultiline = false;
        for (int i = section.start(); i < section.end(); i++) {
            var line = lines.get(i);
            if (!inMultiline) {
                int index = TomlKeys.assignmentIndex(line);
                if (index > 0) {
                    var path = TomlKeys.split(line.substring(0, index));
                    if (path.equals(full)) {
                        lines.set(i, leadingWhitespace(line) + rendered);
                        return true;
                    }
                    found |= path.size() > rest.size() && path.subList(0, rest.size()).equals(rest);
                }
            }
            inMultiline = toggles(line) != inMultiline;
        }
        if (found) {
            insertAtEnd(section, rendered);
        }
        return found;
    }

    /**
     * Replaces or appends {@code key} inside the single-line inline table opening at {@code open}.
     */
    private static String withInlineEntry(String line, int open, String key, String value) {
        var entry = TomlKeys.renderKey(key) + " = " + TomlKeys.quote(value);
        var entries = new ArrayList<int[]>();
        int depth = 0;
        int entryStart = open + 1;
        int close = -1;
        char quote = 0;
        for (int i = open + 1; i < line.length() && close < 0; i++) {
            char ch = line.charAt(i);
            if (quote != 0) {
                if (ch == '\\' && quote == '"') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == '{' || ch == '[') {
                depth++;
            } else if (ch == ']' || (ch == '}' && depth > 0)) {
                depth--;
            } else if (ch == '}') {
                entries.add(new int[] {entryStart, i});
                close = i;
            } else if (ch == ',' && depth == 0) {
                entries.add(new int[] {entryStart, i});
                entryStart = i + 1;
            }
        }
        if (close < 0) {
            throw new ConfigurationException("Unterminated inline table: " + line.trim());
        }
        for (var bounds : entries) {
            var text = line.substring(bounds[0], bounds[1]);
            int index = TomlKeys.assignmentIndex(text);
            if (index > 0 && List.of(key).equals(TomlKeys.split(text.substring(0, index)))) {
                var replaced = leadingWhitespace(text) + entry + trailingWhitespace(text);
                return line.substring(0, bounds[0]) + replaced + line.substring(bounds[1]);
            }
        }
        var body = line.substring(open + 1, close).stripTrailing();
        var merged = body.isBlank() ? " " + entry + " " : body + ", " + entry + " ";
        return line.substring(0, open + 1) + merged + line.substring(close);
    }

    private Section findSection(List<String> table) {
        List<String> currentPath = List.of();
        int currentStart = 0;
        boolean inMultiline = false;
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i);
            if (!inMultiline) {
                var trimmed = line.trim();
                if (trimmed.startsWith("[")) {
                    if (table.equals(currentPath)) {
                        return new Section(currentStart, i);
                    }
                    currentPath = trimmed.startsWith("[[") ? null : headerPath(trimmed);
                    currentStart = i + 1;
                }
            }
            inMultiline = toggles(line) != inMultiline;
        }
        return table.equals(currentPath) ? new Section(currentStart, lines.size()) : null;
    }

    private static List<String> headerPath(String trimmed) {
        char quote = 0;
        for (int i = 1; i < trimmed.length(); i++) {
            char ch = trimmed.charAt(i);
            if (quote != 0) {
                if (ch == '\\' && quote == '"') {
                    i++;
                } else if (ch == quote) {
                    quote = 0;
                }
            } else if (ch == '"' || ch == '\'') {
                quote = ch;
            } else if (ch == ']') {
                return TomlKeys.split(trimmed.substring(1, i));
            }
        }
        return null;
    }

    private static boolean keyMatches(String line, String key) {
        int index = TomlKeys.assignmentIndex(line);
        if (index <= 0) {
            return false;
        }
        return List.of(key).equals(TomlKeys.split(line.substring(0, index)));
    }

    private static boolean toggles(String line) {
        return (occurrences(line, "\"\"\"") + occurrences(line, "'''")) % 2 == 1;
    }

    private static int occurrences(String line, String token) {
        int count = 0;
        int from = 0;
        while ((from = line.indexOf(token, from)) >= 0) {
            count++;
            from += token.length();
        }
        return count;
    }

    private static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return line.substring(0, i);
    }

    private static String trailingWhitespace(String line) {
        int i = line.length();
        while (i > 0 && Character.isWhitespace(line.charAt(i - 1))) {
            i--;
        }
        return line.substring(i);
    }

    private record Section(int start, int end) {}
}
