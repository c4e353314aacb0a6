package work.lcod.forge.cargo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.config.TaskDeclaration;
import work.lcod.forge.config.TaskOptions;
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
 * Task types for Rust crates built with Cargo. Tasks that talk to private registries inject
 * them into {@code .cargo/config.toml} for the duration of the cargo call.
 */
public final class CargoTasks {
    private static final Logger log = LoggerFactory.getLogger(CargoTasks.class);

    public static final String SYNC_CONFIG = "cargo.syncConfig";
    public static final String BUILD = "cargo.build";
    public static final String TEST = "cargo.test";
    public static final String CLIPPY = "cargo.clippy";
    public static final String FMT = "cargo.fmt";
    public static final String PUBLISH = "cargo.publish";

    public static final Path DEFAULT_CONFIG_FILE = Path.of(".cargo", "config.toml");
    public static final String BUILD_FLAGS_ENV = "FORGE_CARGO_BUILD_FLAGS";
    static final String MANAGED_HEADER = "# This file is managed by forge. Manual edits to this file will be overwritten.";

    private CargoTasks() {}

    public static TaskTypeRegistry register(TaskTypeRegistry registry) {
        registry.register(SYNC_CONFIG, CargoTasks::syncConfig);
        registry.register(BUILD, (declaration, settings) -> cargo(declaration, settings, "build"));
        registry.register(TEST, (declaration, settings) -> cargo(declaration, settings, "test"));
        registry.register(CLIPPY, CargoTasks::clippy);
        registry.register(FMT, CargoTasks::fmt);
        registry.register(PUBLISH, CargoTasks::publish);
        return registry;
    }

    /**
     * Writes the index URL of the cargo registries into the config file, permanently and without
     * credentials. Up-to-date when the file already has that content.
     */
    static Task syncConfig(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var file = options.path("file").orElse(DEFAULT_CONFIG_FILE);
        var replace = options.bool("replace", false);
        var registries = registries(options, settings, true);
        return declaration.taskBuilder()
            .backend("cargo")
            .output(file)
            .resource(file)
            .upToDateWhen(context -> {
                var target = context.resolve(file);
                return Files.isRegularFile(target)
                    && Files.readString(target, StandardCharsets.UTF_8).equals(renderConfig(target, replace, registries));
            })
            .runner(context -> {
                var target = context.resolve(file);
                var content = renderConfig(target, replace, registries);
                Files.createDirectories(target.getParent());
                Files.writeString(target, content, StandardCharsets.UTF_8);
                context.println("Wrote " + registries.size() + " registries to " + target);
                return Map.of("file", target.toString());
            })
            .build();
    }

    static String renderConfig(Path target, boolean replace, List<Registry> registries) throws IOException {
        var existing = !replace && Files.isRegularFile(target) ? Files.readString(target, StandardCharsets.UTF_8) : "";
        if (replace) {
            existing = MANAGED_HEADER + "\n";
        }
        var document = TomlDocument.parse(existing);
        for (var registry : registries) {
            document.setString(List.of("registries", registry.name()), "index", registry.url());
        }
        return document.render();
    }

    /**
     * {@code cargo build} and {@code cargo test}.
     */
    static Task cargo(TaskDeclaration declaration, SettingsStore settings, String subcommand) {
        var options = declaration.options();
        var mode = options.string("mode", "debug");
        if (!mode.equals("debug") && !mode.equals("release")) {
            throw new ConfigurationException("Task " + declaration.id() + ": mode must be debug or release, got " + mode);
        }
        var command = Invocation.builder("cargo").arg(subcommand)
            .argIf(mode.equals("release"), "--release")
            .args(options.stringList("args"))
            .args(extraBuildFlags())
            .build();
        var env = new HashMap<>(options.stringMap("env"));
        options.optionalBool("incremental").ifPresent(incremental -> env.put("CARGO_INCREMENTAL", incremental ? "1" : "0"));
        var configFile = options.path("configFile").orElse(DEFAULT_CONFIG_FILE);
        var registries = registries(options, settings, false);
        var builder = declaration.taskBuilder().backend("cargo");
        if (!registries.isEmpty()) {
            builder.resource(configFile);
        }
        return builder.runner(context -> {
            context.injector().withInjectedAuth(context.resolve(configFile), registries, () -> context.exec(command, env));
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("mode", mode);
            if (subcommand.equals("build")) {
                result.put("binaries", binaries(context, mode));
            }
            return result;
        }).build();
    }

    static Task clippy(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var command = Invocation.builder("cargo").arg("clippy");
        if (options.bool("fix", false)) {
            command.arg("--fix");
            var allow = options.string("allow", "staged");
            switch (allow) {
                case "staged" -> command.arg("--allow-staged");
                case "dirty" -> command.arg("--allow-dirty");
                case "none" -> { }
                default -> throw new ConfigurationException("Task " + declaration.id() + ": invalid allow '" + allow + "'");
            }
        }
        command.args(options.stringList("args"));
        var invocation = command.build();
        return declaration.taskBuilder().backend("cargo").group("check")
            .runner(context -> {
                context.exec(invocation);
                return Map.of();
            })
            .build();
    }

    static Task fmt(TaskDeclaration declaration, SettingsStore settings) {
        var check = declaration.options().bool("check", false);
        var invocation = Invocation.builder("cargo").arg("fmt").argIf(check, "--check").build();
        return declaration.taskBuilder().backend("cargo").group(check ? "check" : "fmt")
            .description(check ? "Run `cargo fmt --check`." : "Run `cargo fmt`.")
            .runner(context -> {
                context.exec(invocation);
                return Map.of();
            })
            .build();
    }

    /**
     * {@code cargo publish --registry <name>}. The publish token reaches cargo only through the
     * injected config file; with {@code version} set, {@code Cargo.toml} is bumped for the call.
     */
    static Task publish(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var registry = settings.resolve(options.requireString("registry"));
        if (registry.ecosystem() != Ecosystem.CARGO) {
            throw new ConfigurationException("Task " + declaration.id() + ": registry " + registry.name() + " is not a cargo registry");
        }
        registry.requirePublishToken();
        var version = options.string("version").filter(value -> !value.isBlank());
        boolean allowDirty = options.bool("allowDirty", false) || version.isPresent();
        var invocation = Invocation.builder("cargo").arg("publish")
            .args(options.stringList("args"))
            .args("--registry", registry.name())
            .argIf(!options.bool("verify", true), "--no-verify")
            .argIf(allowDirty, "--allow-dirty")
            .build();
        var configFile = options.path("configFile").orElse(DEFAULT_CONFIG_FILE);
        var manifest = options.path("manifest").orElse(Path.of("Cargo.toml"));
        var builder = declaration.taskBuilder().backend("cargo").resource(configFile);
        version.ifPresent(ignored -> builder.resource(manifest));
        return builder.runner(context -> {
            var config = context.resolve(configFile);
            if (version.isEmpty()) {
                context.injector().withInjectedAuth(config, registry, () -> context.exec(invocation));
            } else {
                log.info("Temporarily setting the version of {} to {}", manifest, version.get());
                context.injector().withPatchedFile(context.resolve(manifest),
                    text -> CargoManifest.withVersion(text, version.get()),
                    () -> context.injector().withInjectedAuth(config, registry, () -> context.exec(invocation)));
            }
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("registry", registry.name());
            version.ifPresent(value -> result.put("version", value));
            return result;
        }).build();
    }

    private static List<Registry> registries(TaskOptions options, SettingsStore settings, boolean defaultToAll) {
        var names = options.stringList("registries");
        if (names.isEmpty()) {
            return defaultToAll ? settings.registries(Ecosystem.CARGO) : List.of();
        }
        var registries = new ArrayList<Registry>();
        for (var name : names) {
            registries.add(settings.resolve(name));
        }
        return registries;
    }

    private static List<String> binaries(TaskContext context, String mode) throws IOException {
        var manifestFile = context.resolve("Cargo.toml");
        if (!Files.isRegularFile(manifestFile)) {
            return List.of();
        }
        var targetDir = System.getenv().getOrDefault("CARGO_TARGET_DIR", "target");
        var binaries = new ArrayList<String>();
        for (var name : CargoManifest.read(manifestFile).binaries()) {
            binaries.add(context.resolve(targetDir).resolve(mode).resolve(name).toString());
        }
        return binaries;
    }

    private static List<String> extraBuildFlags() {
        var flags = System.getenv(BUILD_FLAGS_ENV);
        if (flags == null || flags.isBlank()) {
            return List.of();
        }
        return List.of(flags.trim().split("\\s+"));
    }
}
