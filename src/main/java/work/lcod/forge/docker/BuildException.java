package work.lcod.forge.docker;

import work.lcod.forge.shared.ForgeException;

/**
 * An image build or push did not complete.
 */
public final class BuildException extends ForgeException {
    private final BuildBackend backend;
    private final int exitCode;

    public BuildException(BuildBackend backend, String message, int exitCode) {
        super("image_build_failed", "[" + backend.id() + "] " + message);
        this.backend = backend;
        this.exitCode = exitCode;
    }

    public BuildException(BuildBackend backend, String message, Throwable cause) {
        super("image_build_failed", "[" + backend.id() + "] " + message, cause);
        this.backend = backend;
        this.exitCode = -1;
    }

    public BuildBackend backend() {
        return backend;
    }

    /**
     * Exit code of the failing command, or -1 when the build failed before running one.
     */
    public int exitCode() {
        return exitCode;
    }
}
