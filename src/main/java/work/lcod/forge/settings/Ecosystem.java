package work.lcod.forge.settings;

import java.util.Locale;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Package ecosystems a registry can belong to.
 */
public enum Ecosystem {
    CARGO,
    DOCKER,
    HELM,
    PYTHON;

    public static Ecosystem from(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("ecosystem is required");
        }
        try {
            return Ecosystem.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported ecosystem: " + value);
        }
    }
}
