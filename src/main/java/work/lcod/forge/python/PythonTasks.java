package work.lcod.forge.python;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.config.TaskDeclaration;
import work.lcod.forge.config.TaskTypeRegistry;
import work.lcod.forge.exec.Invocation;
import work.lcod.forge.graph.Task;
import work.lcod.forge.inject.TomlDocument;
import work.lcod.forge.runtime.TaskContext;
import work.lcod.forge.settings.Ecosystem;
import work.lcod.forge.settings.Registry;
import work.lcod.forge.settings.SettingsStore;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Poetry, pytest and twine tasks for Python projects. Package index credentials are injected
 * into the project-local {@code poetry.toml} only while {@code poetry install} runs.
 */
public final class PythonTasks {
    private static final Logger log = LoggerFactory.getLogger(PythonTasks.class);

    public static final String INSTALL = "python.install";
    public static final String BUILD = "python.build";
    public static final String PYTEST = "python.pytest";
    public static final String PUBLISH = "python.publish";
    public static final String DISTRIBUTIONS = "distributions";

    static final Path POETRY_TOML = Path.of("poetry.toml");
    static final Path PYPROJECT_TOML = Path.of("pyproject.toml");
    static final int PYTEST_NO_TESTS_COLLECTED = 5;

    private PythonTasks() {}

    public static TaskTypeRegistry register(TaskTypeRegistry registry) {
        registry.register(INSTALL, PythonTasks::install);
        registry.register(BUILD, PythonTasks::build);
        registry.register(PYTEST, PythonTasks::pytest);
        registry.register(PUBLISH, PythonTasks::publish);
        return registry;
    }

    static Task install(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var registries = new ArrayList<Registry>();
        var names = options.stringList("registries");
        if (names.isEmpty()) {
            for (var registry : settings.registries(Ecosystem.PYTHON)) {
                if (settings.credentialsFor(registry).isPresent()) {
                    registries.add(registry);
                }
            }
        } else {
            names.forEach(name -> registries.add(settings.resolve(name)));
        }
        var command = Invocation.builder("poetry").args("install", "--no-interaction")
            .args(options.stringList("args"))
            .build();
        var builder = declaration.taskBuilder().backend("poetry").resource(POETRY_TOML);
        options.path("environment").ifPresent(environment ->
            builder.upToDateWhen(context -> Files.isDirectory(context.resolve(environment))));
        return builder.runner(context -> {
            context.injector().withInjectedAuth(context.resolve(POETRY_TOML), registries, () -> context.exec(command));
            return Map.of("registries", registries.stream().map(Registry::name).collect(Collectors.toList()));
        }).build();
    }

    /**
     * {@code poetry build}; the distributions end up in {@code outputDirectory}. A {@code version}
     * is applied to {@code pyproject.toml} for the duration of the build only.
     */
    static Task build(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var outputDirectory = options.path("outputDirectory").orElse(Path.of("build", "dist"));
        var version = options.string("version").filter(value -> !value.isBlank());
        var builder = declaration.taskBuilder().backend("poetry").group("build");
        version.ifPresent(ignored -> builder.resource(PYPROJECT_TOML));
        return builder.runner(context -> {
            List<Path> distributions;
            if (version.isPresent()) {
                log.info("Temporarily setting the project version to {}", version.get());
                distributions = context.injector().withPatchedFile(context.resolve(PYPROJECT_TOML),
                    text -> withPoetryVersion(text, version.get()),
                    () -> poetryBuild(context, context.resolve(outputDirectory)));
            } else {
                distributions = poetryBuild(context, context.resolve(outputDirectory));
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put(DISTRIBUTIONS, distributions.stream().map(Path::toString).collect(Collectors.toList()));
            version.ifPresent(value -> result.put("version", value));
            return result;
        }).build();
    }

    static String withPoetryVersion(String text, String version) {
        return TomlDocument.parse(text).setString(List.of("tool", "poetry"), "version", version).render();
    }

    private static List<Path> poetryBuild(TaskContext context, Path outputDirectory) throws Exception {
        var distDir = context.resolve("dist");
        boolean outputInsideDist = outputDirectory.startsWith(distDir);
        if (!outputInsideDist) {
            deleteRecursively(distDir);
        }
        context.exec(Invocation.of("poetry", "build"));
        if (outputInsideDist) {
            return list(distDir);
        }
        Files.createDirectories(outputDirectory);
        var produced = new ArrayList<Path>();
        for (var file : list(distDir)) {
            produced.add(Files.move(file, outputDirectory.resolve(file.getFileName()), StandardCopyOption.REPLACE_EXISTING));
        }
        deleteRecursively(distDir);
        return produced;
    }

    static Task pytest(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var testsDir = options.path("testsDir");
        var ignore = options.stringList("ignore");
        var allowNoTests = options.bool("allowNoTests", false);
        var accepted = allowNoTests ? Set.of(0, PYTEST_NO_TESTS_COLLECTED) : Set.of(0);
        return declaration.taskBuilder().backend("pytest").group("test")
            .runner(context -> {
                var directory = testsDir.map(context::resolve).orElseGet(() -> detectTestsDirectory(context));
                if (directory == null) {
                    if (allowNoTests) {
                        context.println("No tests directory, nothing to run");
                        return Map.of("tests", false);
                    }
                    throw new ConfigurationException("Task " + declaration.id() + ": no tests directory configured and none found");
                }
                var command = Invocation.builder("pytest").args("-vv", directory.toString());
                ignore.forEach(path -> command.args("--ignore", context.resolve(path).toString()));
                var result = context.exec(command.build(), Map.of(), null, null, accepted);
                return Map.of("tests", result.exitCode() != PYTEST_NO_TESTS_COLLECTED);
            })
            .build();
    }

    private static Path detectTestsDirectory(TaskContext context) {
        for (var candidate : List.of("tests", "test")) {
            var directory = context.resolve(candidate);
            if (Files.isDirectory(directory)) {
                return directory;
            }
        }
        return null;
    }

    /**
     * {@code twine upload}. Credentials travel in {@code TWINE_USERNAME}/{@code TWINE_PASSWORD};
     * a publish token is used as {@code __token__}.
     */
    static Task publish(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var registry = settings.resolve(options.requireString("registry"));
        if (registry.ecosystem() != Ecosystem.PYTHON) {
            throw new ConfigurationException("Task " + declaration.id() + ": registry " + registry.name() + " is not a python package index");
        }
        var distributions = options.stringList("distributions");
        var from = options.string("from");
        if (distributions.isEmpty() && from.isEmpty()) {
            throw new ConfigurationException("Task " + declaration.id() + ": set 'distributions' or 'from'");
        }
        var builder = declaration.taskBuilder().backend("twine").group("publish");
        from.filter(id -> !declaration.dependsOn().contains(id)).ifPresent(id -> builder.dependsOn(List.of(id)));
        return builder.runner(context -> {
            var files = new ArrayList<String>();
            distributions.forEach(path -> files.add(context.resolve(path).toString()));
            if (from.isPresent()) {
                var produced = context.resultOf(from.get()).get(DISTRIBUTIONS);
                if (produced instanceof List<?> list) {
                    list.forEach(item -> files.add(String.valueOf(item)));
                }
            }
            if (files.isEmpty()) {
                throw new ConfigurationException("Task " + declaration.id() + ": nothing to publish");
            }
            var env = new HashMap<String, String>();
            if (registry.publishToken().isPresent()) {
                env.put("TWINE_USERNAME", "__token__");
                env.put("TWINE_PASSWORD", registry.publishToken().get().reveal());
            } else {
                var credentials = context.settings().credentialsFor(registry);
                if (credentials.isPresent()) {
                    env.put("TWINE_USERNAME", credentials.get().principal());
                    env.put("TWINE_PASSWORD", credentials.get().secret().reveal());
                }
            }
            var command = Invocation.builder("twine").args("upload", "--non-interactive", "--repository-url", registry.url())
                .args(files)
                .build();
            context.exec(command, env);
            return Map.of(DISTRIBUTIONS, files, "registry", registry.name());
        }).build();
    }

    private static List<Path> list(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.sorted().collect(Collectors.toList());
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            for (var path : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                Files.delete(path);
            }
        }
    }
}
