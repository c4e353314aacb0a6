package work.lcod.forge.inject;

import java.nio.file.Path;
import work.lcod.forge.shared.ForgeException;

/**
 * A patched configuration file could not be put back. Secrets may remain on disk, so this is
 * fatal for the whole run and never reported as an ordinary task failure.
 */
public final class CredentialRestoreException extends ForgeException {
    private final Path file;

    public CredentialRestoreException(Path file, Throwable cause) {
        super("credential_restore_failed", "Failed to restore " + file + " after credential injection: " + describe(cause), cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        var message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
