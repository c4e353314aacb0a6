package work.lcod.forge.runtime;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.exec.BackendExecutor;
import work.lcod.forge.exec.Invocation;
import work.lcod.forge.exec.ProcessResult;
import work.lcod.forge.graph.Task;
import work.lcod.forge.inject.CredentialInjector;
import work.lcod.forge.settings.SettingsStore;

/**
 * What a running task may touch: the frozen settings, the backend executor, the credential
 * injector and the results of the tasks it depends on. Output of every invocation is captured
 * for the run report.
 */
public final class TaskContext {
    private static final Logger log = LoggerFactory.getLogger(TaskContext.class);

    private final Task task;
    private final SettingsStore settings;
    private final Path projectDirectory;
    private final BackendExecutor executor;
    private final CredentialInjector injector;
    private final CancellationToken cancellationToken;
    private final Map<String, Map<String, Object>> results;
    private final StringBuilder output = new StringBuilder();

    public TaskContext(
        Task task,
        SettingsStore settings,
        Path projectDirectory,
        BackendExecutor executor,
        CredentialInjector injector,
        CancellationToken cancellationToken,
        Map<String, Map<String, Object>> results
    ) {
        this.task = Objects.requireNonNull(task, "task");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.projectDirectory = Objects.requireNonNull(projectDirectory, "projectDirectory");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.injector = Objects.requireNonNull(injector, "injector");
        this.cancellationToken = cancellationToken == null ? new CancellationToken() : cancellationToken;
        this.results = results == null ? Map.of() : results;
    }

    public Task task() {
        return task;
    }

    public SettingsStore settings() {
        return settings;
    }

    public Path projectDirectory() {
        return projectDirectory;
    }

    public Path resolve(Path path) {
        return projectDirectory.resolve(path).toAbsolutePath().normalize();
    }

    public Path resolve(String path) {
        return resolve(Path.of(path));
    }

    public BackendExecutor executor() {
        return executor;
    }

    public CredentialInjector injector() {
        return injector;
    }

    /**
     * Result published by a dependency; empty when the dependency returned nothing.
     */
    public Map<String, Object> resultOf(String taskId) {
        return results.getOrDefault(taskId, Map.of());
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public void ensureNotCancelled() {
        if (cancellationToken.isCancelled()) {
            throw new TaskCancelledException("Task " + task.id() + " cancelled: " + cancellationToken.reason());
        }
    }

    public ProcessResult exec(Invocation command) throws Exception {
        return exec(command, Map.of(), null);
    }

    public ProcessResult exec(Invocation command, Map<String, String> env) throws Exception {
        return exec(command, env, null);
    }

    public ProcessResult exec(Invocation command, Map<String, String> env, Path workingDir) throws Exception {
        return exec(command, env, workingDir, null, Set.of(0));
    }

    /**
     * Runs {@code command} in {@code workingDir} (the project directory when {@code null}) and
     * fails with {@link TaskExecutionException} unless the exit code is one of {@code acceptedExitCodes}.
     */
    public ProcessResult exec(
        Invocation command,
        Map<String, String> env,
        Path workingDir,
        String stdin,
        Set<Integer> acceptedExitCodes
    ) throws Exception {
        ensureNotCancelled();
        var directory = workingDir == null ? projectDirectory : resolve(workingDir);
        log.info("[{}] $ {}", task.id(), command);
        appendOutput("$ " + command + System.lineSeparator());
        var result = executor.execute(command, env == null ? Map.of() : env, directory, stdin);
        appendOutput(result.stdout());
        appendOutput(result.stderr());
        if (!acceptedExitCodes.contains(result.exitCode())) {
            throw new TaskExecutionException(command, result.exitCode(), result.stderr());
        }
        return result;
    }

    public void println(String line) {
        appendOutput(line + System.lineSeparator());
    }

    public synchronized String output() {
        return output.toString();
    }

    private synchronized void appendOutput(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        output.append(text);
        if (!text.endsWith("\n")) {
            output.append(System.lineSeparator());
        }
    }
}
