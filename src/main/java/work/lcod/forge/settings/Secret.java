package work.lcod.forge.settings;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Reference to secret material. The value is either held literally or looked up from the
 * environment when it is revealed. {@link #toString()} never prints the value.
 */
public final class Secret {
    public static final String MASK = "[MASKED]";

    private final String literal;
    private final String variable;
    private final Function<String, String> environment;

    private Secret(String literal, String variable, Function<String, String> environment) {
        this.literal = literal;
        this.variable = variable;
        this.environment = environment;
    }

    public static Secret of(String value) {
        Objects.requireNonNull(value, "value");
        return new Secret(value, null, null);
    }

    public static Secret fromEnv(String variable) {
        return fromEnv(variable, System::getenv);
    }

    public static Secret fromEnv(String variable, Map<String, String> environment) {
        return fromEnv(variable, environment::get);
    }

    private static Secret fromEnv(String variable, Function<String, String> environment) {
        if (variable == null || variable.isBlank()) {
            throw new ConfigurationException("secret environment variable name is required");
        }
        return new Secret(null, variable.trim(), environment);
    }

    /**
     * Returns the secret value. Only call this where the value is handed to a file or a process.
     */
    public String reveal() {
        if (literal != null) {
            return literal;
        }
        String value = environment.apply(variable);
        if (value == null) {
            throw new ConfigurationException("secret environment variable " + variable + " is not defined");
        }
        return value;
    }

    /**
     * Safe description of where the secret comes from, suitable for logs.
     */
    public String describe() {
        return variable != null ? "env:" + variable : MASK;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Secret that)) return false;
        return Objects.equals(literal, that.literal) && Objects.equals(variable, that.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(literal, variable);
    }

    @Override
    public String toString() {
        return MASK;
    }
}
