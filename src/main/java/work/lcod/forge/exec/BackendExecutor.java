package work.lcod.forge.exec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Runs one external tool invocation ({@code cargo}, {@code docker}, {@code helm}, {@code poetry},
 * {@code pytest}, {@code twine}, ...). Implementations never throw for a nonzero exit code;
 * callers decide which codes are failures.
 */
public interface BackendExecutor {
    ProcessResult execute(Invocation command, Map<String, String> env, Path workingDir, String stdin)
        throws IOException, InterruptedException;

    default ProcessResult execute(Invocation command, Map<String, String> env, Path workingDir)
        throws IOException, InterruptedException {
        return execute(command, env, workingDir, null);
    }
}
