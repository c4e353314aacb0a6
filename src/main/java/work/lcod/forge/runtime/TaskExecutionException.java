package work.lcod.forge.runtime;

import work.lcod.forge.exec.Invocation;
import work.lcod.forge.shared.ForgeException;

/**
 * A backend invocation exited with a code the task does not accept.
 */
public final class TaskExecutionException extends ForgeException {
    private final int exitCode;
    private final String stderr;

    public TaskExecutionException(Invocation command, int exitCode, String stderr) {
        super("task_execution_failed", command.program() + " exited with code " + exitCode + summarize(stderr));
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public int exitCode() {
        return exitCode;
    }

    public String stderr() {
        return stderr;
    }

    private static String summarize(String stderr) {
        if (stderr == null || stderr.isBlank()) {
            return "";
        }
        var lines = stderr.strip().split("\\R");
        return ": " + lines[lines.length - 1];
    }
}
