package work.lcod.forge.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.config.BuildFileLoader;
import work.lcod.forge.config.TaskTypeRegistry;
import work.lcod.forge.config.TaskTypes;
import work.lcod.forge.inject.CredentialInjector;
import work.lcod.forge.runtime.RunAbortedException;
import work.lcod.forge.runtime.Scheduler;
import work.lcod.forge.shared.ForgeException;

/**
 * Public entry point for embedding forge: load the build file, run the requested goals and
 * report. Never throws for build problems; they end up in the {@link RunResult}.
 */
public final class BuildRunner {
    private static final Logger log = LoggerFactory.getLogger(BuildRunner.class);

    private final TaskTypeRegistry taskTypes;
    private final Map<String, String> environment;

    public BuildRunner() {
        this(TaskTypes.create(), System.getenv());
    }

    public BuildRunner(TaskTypeRegistry taskTypes, Map<String, String> environment) {
        this.taskTypes = taskTypes;
        this.environment = environment;
    }

    public RunResult run(BuildRunConfiguration configuration) {
        configuration.logLevel().apply();
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("buildFile", configuration.buildFile().toString());
        metadata.put("goals", configuration.goals());
        metadata.put("parallelism", configuration.parallelism());
        try {
            var session = new BuildFileLoader(taskTypes, environment).load(configuration.buildFile());
            var scheduler = Scheduler.builder()
                .parallelism(configuration.parallelism())
                .executor(configuration.executor())
                .injector(new CredentialInjector(session.settings()))
                .cancellationToken(configuration.cancellationToken())
                .timeout(configuration.timeout().orElse(null))
                .build();
            var report = scheduler.run(session.graph(), configuration.goals());
            return RunResult.of(report, metadata, started);
        } catch (RunAbortedException ex) {
            log.error("Run aborted: {}", ex.getCause().getMessage());
            return RunResult.aborted(ex.report(), ex.getMessage(), metadata, started);
        } catch (ForgeException ex) {
            metadata.put("code", ex.code());
            if (Boolean.getBoolean("forge.debug")) {
                log.error("Build failed before execution", ex);
            }
            return RunResult.invalid(ex.getMessage(), metadata, started);
        }
    }
}
