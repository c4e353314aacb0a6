package work.lcod.forge.helm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import work.lcod.forge.config.TaskDeclaration;
import work.lcod.forge.config.TaskTypeRegistry;
import work.lcod.forge.exec.Invocation;
import work.lcod.forge.graph.Task;
import work.lcod.forge.runtime.TaskContext;
import work.lcod.forge.settings.Ecosystem;
import work.lcod.forge.settings.Registry;
import work.lcod.forge.settings.SettingsStore;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Helm chart packaging and OCI push. Registry auth is injected into the file named by
 * {@code HELM_REGISTRY_CONFIG}, which uses the docker {@code config.json} format.
 */
public final class HelmTasks {
    public static final String PACKAGE = "helm.package";
    public static final String PUSH = "helm.push";
    public static final String CHART_FILE = "chartFile";

    static final Path DEFAULT_DESTINATION = Path.of("build", "helm");
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private HelmTasks() {}

    public static TaskTypeRegistry register(TaskTypeRegistry registry) {
        registry.register(PACKAGE, HelmTasks::helmPackage);
        registry.register(PUSH, HelmTasks::push);
        return registry;
    }

    static Task helmPackage(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var chart = Path.of(options.requireString("chart"));
        var destination = options.path("destination").orElse(DEFAULT_DESTINATION);
        var version = options.string("version");
        var appVersion = options.string("appVersion");
        return declaration.taskBuilder().backend("helm").group("build")
            .runner(context -> {
                var chartDir = context.resolve(chart);
                var outputDir = context.resolve(destination);
                Files.createDirectories(outputDir);
                var command = Invocation.builder("helm").args("package", chartDir.toString())
                    .args("--destination", outputDir.toString())
                    .option("--appVersion", appVersion.orElse(null))
                    .option("--version", version.orElse(null))
                    .build();
                context.exec(command);
                var chartFile = outputDir.resolve(chartFileName(chartDir, version));
                if (!Files.isRegularFile(chartFile)) {
                    throw new IllegalStateException("helm package did not produce " + chartFile);
                }
                return Map.of(CHART_FILE, chartFile.toString());
            })
            .build();
    }

    /**
     * {@code <name>-<version>.tgz} from {@code Chart.yaml}, with the version override applied.
     */
    static String chartFileName(Path chartDir, Optional<String> version) throws IOException {
        JsonNode chart = YAML.readTree(chartDir.resolve("Chart.yaml").toFile());
        var name = chart.path("name").asText("");
        if (name.isBlank()) {
            throw new ConfigurationException("Chart.yaml in " + chartDir + " has no name");
        }
        var chartVersion = version.orElseGet(() -> chart.path("version").asText(""));
        return name + "-" + chartVersion + ".tgz";
    }

    static Task push(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        Registry registry = settings.resolve(options.requireString("registry"));
        if (registry.ecosystem() != Ecosystem.HELM && registry.ecosystem() != Ecosystem.DOCKER) {
            throw new ConfigurationException("Task " + declaration.id() + ": registry " + registry.name() + " is not an OCI registry");
        }
        var chart = options.path("chart");
        var from = options.string("from");
        if (chart.isEmpty() && from.isEmpty()) {
            throw new ConfigurationException("Task " + declaration.id() + ": set 'chart' or 'from'");
        }
        var builder = declaration.taskBuilder().backend("helm").group("publish");
        from.filter(id -> !declaration.dependsOn().contains(id)).ifPresent(id -> builder.dependsOn(List.of(id)));
        var registryConfig = options.path("registryConfig").orElseGet(HelmTasks::defaultRegistryConfig);
        var login = options.bool("login", false);
        builder.resource(registryConfig);
        return builder.runner(context -> {
            var chartFile = chart.isPresent()
                ? context.resolve(chart.get())
                : Path.of(String.valueOf(context.resultOf(from.get()).get(CHART_FILE)));
            var config = context.resolve(registryConfig);
            var env = new HashMap<String, String>();
            env.put("HELM_REGISTRY_CONFIG", config.toString());
            var push = Invocation.of("helm", "push", chartFile.toString(), remote(registry));
            if (login) {
                // helm writes the login into the config itself; the scope puts the file back afterwards
                context.injector().withPatchedFile(config, text -> text.isBlank() ? "{}\n" : text, () -> {
                    var credentials = context.settings().credentialsFor(registry)
                        .orElseThrow(() -> new ConfigurationException("registry " + registry.name() + " has no credentials"));
                    var loginCommand = Invocation.of("helm", "registry", "login", registry.endpoint(),
                        "-u", credentials.principal(), "--password-stdin");
                    context.exec(loginCommand, env, null, credentials.secret().reveal() + "\n", Set.of(0));
                    return context.exec(push, env);
                });
            } else {
                context.injector().withInjectedAuth(config, registry, () -> context.exec(push, env));
            }
            return Map.of(CHART_FILE, chartFile.toString(), "remote", remote(registry));
        }).build();
    }

    /**
     * {@code oci://} reference of the registry; the URL scheme is dropped.
     */
    static String remote(Registry registry) {
        var url = registry.url();
        int scheme = url.indexOf("://");
        var location = scheme >= 0 ? url.substring(scheme + 3) : url;
        while (location.endsWith("/")) {
            location = location.substring(0, location.length() - 1);
        }
        return "oci://" + location;
    }

    private static Path defaultRegistryConfig() {
        var configured = System.getenv("HELM_REGISTRY_CONFIG");
        if (configured != null && !configured.isBlank()) {
            return Path.of(configured);
        }
        return Path.of(System.getProperty("user.home"), ".config", "helm", "registry", "config.json");
    }
}
