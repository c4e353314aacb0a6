package work.lcod.forge.shared;

/**
 * Base of every error raised by the task graph, the scheduler and the credential injector.
 * Carries a stable machine-readable code next to the human message.
 */
public class ForgeException extends RuntimeException {
    private final String code;

    public ForgeException(String code, String message) {
        super(message);
        this.code = code;
    }

    public ForgeException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
