package work.lcod.forge.api;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.forge.exec.BackendExecutor;
import work.lcod.forge.exec.ProcessBackendExecutor;
import work.lcod.forge.runtime.CancellationToken;

/**
 * Immutable configuration of one build run.
 */
public record BuildRunConfiguration(
    Path buildFile,
    List<String> goals,
    int parallelism,
    Optional<Duration> timeout,
    LogLevel logLevel,
    BackendExecutor executor,
    CancellationToken cancellationToken
) {
    public BuildRunConfiguration {
        Objects.requireNonNull(buildFile, "buildFile");
        goals = goals == null ? List.of() : List.copyOf(goals);
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(cancellationToken, "cancellationToken");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path buildFile;
        private List<String> goals = List.of();
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.INFO;
        private BackendExecutor executor = new ProcessBackendExecutor();
        private CancellationToken cancellationToken = new CancellationToken();

        public Builder buildFile(Path buildFile) {
            this.buildFile = buildFile;
            return this;
        }

        public Builder goals(List<String> goals) {
            this.goals = goals;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder executor(BackendExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public BuildRunConfiguration build() {
            return new BuildRunConfiguration(buildFile, goals, parallelism, timeout, logLevel, executor, cancellationToken);
        }
    }
}
