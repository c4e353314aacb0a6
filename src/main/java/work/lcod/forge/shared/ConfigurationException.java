package work.lcod.forge.shared;

/**
 * Invalid registry, auth or task declaration. Fatal while the build graph is being constructed.
 */
public class ConfigurationException extends ForgeException {
    public ConfigurationException(String message) {
        super("configuration_error", message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("configuration_error", message, cause);
    }
}
