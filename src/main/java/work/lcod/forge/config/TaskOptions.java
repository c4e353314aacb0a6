package work.lcod.forge.config;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.forge.settings.Secret;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Typed view over a task's {@code with} block. Every conversion error names the task and key.
 */
public final class TaskOptions {
    private final String taskId;
    private final Map<String, Object> values;

    public TaskOptions(String taskId, Map<String, Object> values) {
        this.taskId = taskId;
        this.values = values == null ? Map.of() : values;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Optional<String> string(String key) {
        var value = values.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw invalid(key, "a string");
        }
        return Optional.of(value.toString());
    }

    public String string(String key, String fallback) {
        return string(key).orElse(fallback);
    }

    public String requireString(String key) {
        return string(key).filter(value -> !value.isBlank()).orElseThrow(() -> invalid(key, "a non-empty string"));
    }

    public boolean bool(String key, boolean fallback) {
        var value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        var text = value.toString().trim().toLowerCase();
        if (text.equals("true") || text.equals("false")) {
            return Boolean.parseBoolean(text);
        }
        throw invalid(key, "a boolean");
    }

    public Optional<Boolean> optionalBool(String key) {
        return has(key) ? Optional.of(bool(key, false)) : Optional.empty();
    }

    public Optional<Path> path(String key) {
        return string(key).filter(value -> !value.isBlank()).map(Path::of);
    }

    public List<String> stringList(String key) {
        var value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof String text) {
            return text.isBlank() ? List.of() : List.of(text);
        }
        if (!(value instanceof List<?> list)) {
            throw invalid(key, "a list of strings");
        }
        var result = new ArrayList<String>(list.size());
        for (var item : list) {
            if (item == null || item instanceof Map<?, ?> || item instanceof List<?>) {
                throw invalid(key, "a list of strings");
            }
            result.add(item.toString());
        }
        return result;
    }

    public Map<String, String> stringMap(String key) {
        var result = new LinkedHashMap<String, String>();
        for (var entry : map(key).entrySet()) {
            var item = entry.getValue();
            if (item instanceof Map<?, ?> || item instanceof List<?>) {
                throw invalid(key + "." + entry.getKey(), "a string");
            }
            result.put(entry.getKey(), item == null ? "" : item.toString());
        }
        return result;
    }

    /**
     * Map of secrets; each value is a literal string or {@code {env: VARIABLE}}.
     */
    public Map<String, Secret> secretMap(String key) {
        var result = new LinkedHashMap<String, Secret>();
        for (var entry : map(key).entrySet()) {
            result.put(entry.getKey(), toSecret(key + "." + entry.getKey(), entry.getValue()));
        }
        return result;
    }

    static Secret toSecret(String key, Object value) {
        if (value instanceof Map<?, ?> ref) {
            var env = ref.get("env");
            if (env != null) {
                return Secret.fromEnv(env.toString());
            }
            var literal = ref.get("value");
            if (literal != null) {
                return Secret.of(literal.toString());
            }
            throw new ConfigurationException("Secret " + key + " must define 'env' or 'value'");
        }
        if (value == null || value instanceof List<?>) {
            throw new ConfigurationException("Secret " + key + " must be a string or {env: NAME}");
        }
        return Secret.of(value.toString());
    }

    private Map<String, Object> map(String key) {
        var value = values.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw invalid(key, "a mapping");
        }
        var result = new LinkedHashMap<String, Object>();
        raw.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private ConfigurationException invalid(String key, String expected) {
        return new ConfigurationException("Task " + taskId + ": option '" + key + "' must be " + expected);
    }
}
