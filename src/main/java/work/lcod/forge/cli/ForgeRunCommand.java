package work.lcod.forge.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import picocli.CommandLine;
import work.lcod.forge.api.BuildRunConfiguration;
import work.lcod.forge.api.BuildRunner;
import work.lcod.forge.api.LogLevel;
import work.lcod.forge.api.RunResult;
import work.lcod.forge.config.BuildFileLoader;
import work.lcod.forge.config.TaskTypes;
import work.lcod.forge.runtime.CancellationToken;
import work.lcod.forge.shared.ConfigurationException;
import work.lcod.forge.shared.DurationParser;

@CommandLine.Command(
    name = "forge",
    description = "Run build tasks with scoped registry credentials.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ForgeRunCommand implements Callable<Integer> {
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    @CommandLine.Option(
        names = {"-f", "--file"},
        description = "Build file.",
        defaultValue = "forge.yaml"
    )
    private Path buildFile;

    @CommandLine.Parameters(
        paramLabel = "GOAL",
        arity = "0..*",
        description = "Tasks to run together with their dependencies (default: all)."
    )
    private List<String> goals = new ArrayList<>();

    @CommandLine.Option(
        names = {"-j", "--parallelism"},
        description = "Maximum number of tasks running at once (default: available processors).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer parallelism;

    @CommandLine.Option(
        names = "--timeout",
        description = "Stop dispatching after this duration (e.g. 90s, 10m, 1h).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = "info"
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--json",
        description = "Print the run report as JSON."
    )
    private boolean json;

    @CommandLine.Option(
        names = {"-l", "--list"},
        description = "List the declared tasks and exit."
    )
    private boolean list;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        if (!Files.isRegularFile(buildFile)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Build file not found: " + buildFile);
        }
        LogLevel logLevel = resolveLogLevel();
        PrintWriter out = spec.commandLine().getOut();
        if (list) {
            logLevel.apply();
            var session = new BuildFileLoader(TaskTypes.create()).load(buildFile);
            for (var declaration : session.declarations()) {
                String description = declaration.description() == null ? "" : "  " + declaration.description();
                out.println(declaration.id() + " [" + declaration.type() + "]" + description);
            }
            out.flush();
            return 0;
        }

        Optional<Duration> timeout = resolveTimeout();
        var builder = BuildRunConfiguration.builder()
            .buildFile(buildFile)
            .goals(goals)
            .timeout(timeout)
            .logLevel(logLevel);
        if (parallelism != null) {
            if (parallelism < 1) {
                throw new CommandLine.ParameterException(spec.commandLine(), "--parallelism must be >= 1");
            }
            builder.parallelism(parallelism);
        }
        var token = new CancellationToken();
        builder.cancellationToken(token);
        var finished = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> awaitCancelled(token, finished), "forge-shutdown"));
        RunResult result;
        try {
            result = new BuildRunner().run(builder.build());
        } finally {
            finished.countDown();
        }

        if (json) {
            out.println(result.toPrettyJson());
        } else {
            result.summaryLines().forEach(out::println);
        }
        out.flush();
        return result.exitCode();
    }

    // Ctrl-C: stop dispatching and give running tasks a chance to restore their credential files.
    private static void awaitCancelled(CancellationToken token, CountDownLatch finished) {
        if (finished.getCount() == 0) {
            return;
        }
        token.cancel("interrupted");
        try {
            finished.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private LogLevel resolveLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private Optional<Duration> resolveTimeout() {
        try {
            return DurationParser.parse(timeoutRaw);
        } catch (ConfigurationException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid --timeout: " + ex.getMessage());
        }
    }
}
