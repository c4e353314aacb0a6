package work.lcod.forge.exec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import work.lcod.forge.config.TaskDeclaration;
import work.lcod.forge.config.TaskTypeRegistry;
import work.lcod.forge.graph.Task;
import work.lcod.forge.settings.SettingsStore;
import work.lcod.forge.shared.ConfigurationException;

/**
 * The generic {@code exec} task: one command, optionally run inside a credential scope.
 *
 * <pre>
 * - id: lint
 *   type: exec
 *   with:
 *     command: [cargo, clippy]
 *     env: { RUSTFLAGS: "-D warnings" }
 *     acceptExitCodes: [0, 1]
 *     inject: { file: .cargo/config.toml, registry: private-repo }
 * </pre>
 */
public final class ExecTasks {
    public static final String TYPE = "exec";

    private ExecTasks() {}

    public static TaskTypeRegistry register(TaskTypeRegistry registry) {
        return registry.register(TYPE, ExecTasks::create);
    }

    static Task create(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var command = options.stringList("command");
        if (command.isEmpty()) {
            throw new ConfigurationException("Task " + declaration.id() + ": option 'command' is required");
        }
        var invocation = Invocation.builder(command.get(0)).args(command.subList(1, command.size())).build();
        var env = options.stringMap("env");
        var workingDir = options.path("workingDir").orElse(null);
        var accepted = new HashSet<Integer>();
        for (var code : options.stringList("acceptExitCodes")) {
            try {
                accepted.add(Integer.parseInt(code.trim()));
            } catch (NumberFormatException ex) {
                throw new ConfigurationException("Task " + declaration.id() + ": invalid exit code " + code, ex);
            }
        }
        if (accepted.isEmpty()) {
            accepted.add(0);
        }

        var builder = declaration.taskBuilder().backend(TYPE);
        var inject = options.stringMap("inject");
        var injectFile = inject.get("file");
        var injectRegistry = inject.get("registry");
        if (!inject.isEmpty() && (injectFile == null || injectRegistry == null)) {
            throw new ConfigurationException("Task " + declaration.id() + ": 'inject' needs both 'file' and 'registry'");
        }
        var registry = injectRegistry == null ? null : settings.resolve(injectRegistry);
        if (injectFile != null) {
            builder.resource(Path.of(injectFile));
        }
        options.stringList("resources").forEach(resource -> builder.resource(Path.of(resource)));

        if (options.bool("upToDateWhenOutputsExist", false) && !declaration.outputs().isEmpty()) {
            builder.upToDateWhen(context -> declaration.outputs().stream().allMatch(output -> Files.exists(context.resolve(output))));
        }
        return builder.runner(context -> {
            if (registry == null) {
                return result(context.exec(invocation, env, workingDir, null, accepted));
            }
            return context.injector().withInjectedAuth(context.resolve(injectFile), registry,
                () -> result(context.exec(invocation, env, workingDir, null, accepted)));
        }).build();
    }

    private static Map<String, Object> result(ProcessResult result) {
        return Map.of("exitCode", result.exitCode(), "stdout", result.stdout());
    }
}
