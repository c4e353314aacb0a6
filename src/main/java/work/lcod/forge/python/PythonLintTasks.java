package work.lcod.forge.python;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.forge.config.TaskDeclaration;
import work.lcod.forge.config.TaskOptions;
import work.lcod.forge.config.TaskTypeRegistry;
import work.lcod.forge.exec.Invocation;
import work.lcod.forge.graph.Task;
import work.lcod.forge.runtime.TaskContext;
import work.lcod.forge.settings.SettingsStore;

/**
 * black, isort and flake8 over the project sources. Each tool sees the {@code sources}
 * (default {@code src}), the {@code tests} or {@code test} directory when one exists, and any
 * {@code additionalFiles}. With {@code check: true} black and isort only report.
 */
public final class PythonLintTasks {
    public static final String BLACK = "python.black";
    public static final String ISORT = "python.isort";
    public static final String FLAKE8 = "python.flake8";

    private PythonLintTasks() {}

    public static TaskTypeRegistry register(TaskTypeRegistry registry) {
        registry.register(BLACK, PythonLintTasks::black);
        registry.register(ISORT, PythonLintTasks::isort);
        registry.register(FLAKE8, PythonLintTasks::flake8);
        return registry;
    }

    static Task black(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var check = options.bool("check", false);
        var config = options.string("config");
        var args = options.stringList("args");
        return tool(declaration, "black", check, context -> Invocation.builder("black")
            .args(targets(context, options, true))
            .argIf(check, "--check")
            .option("--config", config.orElse(null))
            .args(args)
            .build());
    }

    static Task isort(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var check = options.bool("check", false);
        var config = options.string("config");
        var args = options.stringList("args");
        return tool(declaration, "isort", check, context -> Invocation.builder("isort")
            .args(targets(context, options, true))
            .argIf(check, "--check-only")
            .option("--settings-file", config.orElse(null))
            .args(args)
            .build());
    }

    static Task flake8(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var config = options.string("config");
        var args = options.stringList("args");
        return tool(declaration, "flake8", true, context -> Invocation.builder("flake8")
            .args(targets(context, options, false))
            .option("--config", config.orElse(null))
            .args(args)
            .build());
    }

    private static Task tool(TaskDeclaration declaration, String program, boolean check, CommandFactory command) {
        return declaration.taskBuilder().backend(program).group(check ? "check" : "fmt")
            .runner(context -> {
                context.exec(command.create(context));
                return Map.of();
            })
            .build();
    }

    // relative to the project directory, which is the working directory of the tool
    static List<String> targets(TaskContext context, TaskOptions options, boolean withAdditionalFiles) {
        var targets = new ArrayList<String>(options.stringList("sources"));
        if (targets.isEmpty()) {
            targets.add("src");
        }
        testsDirectory(context, options).ifPresent(targets::add);
        if (withAdditionalFiles) {
            targets.addAll(options.stringList("additionalFiles"));
        }
        return targets;
    }

    private static Optional<String> testsDirectory(TaskContext context, TaskOptions options) {
        var configured = options.string("testsDir");
        if (configured.isPresent()) {
            return configured;
        }
        for (var candidate : List.of("tests", "test")) {
            if (Files.isDirectory(context.resolve(candidate))) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @FunctionalInterface
    private interface CommandFactory {
        Invocation create(TaskContext context);
    }
}
