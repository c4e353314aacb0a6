package work.lcod.forge.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.graph.TaskGraph;
import work.lcod.forge.settings.Credentials;
import work.lcod.forge.settings.Ecosystem;
import work.lcod.forge.settings.RegistryOptions;
import work.lcod.forge.settings.Secret;
import work.lcod.forge.settings.SettingsStore;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Reads a YAML (or JSON) build file into a {@link SettingsStore} and a {@link TaskGraph}.
 *
 * <pre>
 * settings:
 *   auth:
 *     - { host: example.jfrog.io, principal: ci, secret: { env: JFROG_TOKEN } }
 *   registries:
 *     - { name: private-repo, url: "...", ecosystem: cargo, publishToken: { env: CARGO_TOKEN } }
 * tasks:
 *   - { id: build, type: cargo.build, with: { mode: release } }
 *   - { id: publish, type: cargo.publish, dependsOn: [build], with: { registry: private-repo } }
 * </pre>
 */
public final class BuildFileLoader {
    private static final Logger log = LoggerFactory.getLogger(BuildFileLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final TaskTypeRegistry taskTypes;
    private final Map<String, String> environment;

    public BuildFileLoader(TaskTypeRegistry taskTypes) {
        this(taskTypes, System.getenv());
    }

    /**
     * @param environment resolves {@code {env: NAME}} secrets of the settings section
     */
    public BuildFileLoader(TaskTypeRegistry taskTypes, Map<String, String> environment) {
        this.taskTypes = taskTypes;
        this.environment = environment;
    }

    public BuildSession load(Path buildFile) {
        var projectDirectory = buildFile.toAbsolutePath().normalize().getParent();
        try (var in = Files.newInputStream(buildFile)) {
            return load(in, projectDirectory);
        } catch (IOException ex) {
            throw new ConfigurationException("Failed to read build file " + buildFile + ": " + ex.getMessage(), ex);
        }
    }

    public BuildSession load(InputStream in, Path projectDirectory) throws IOException {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Invalid build file: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            root = YAML_MAPPER.createObjectNode();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Build file must be a mapping with 'settings' and 'tasks'");
        }
        var settings = new SettingsStore();
        loadSettings(root.path("settings"), settings);
        var graph = new TaskGraph(settings, projectDirectory);
        var declarations = readTasks(root.path("tasks"));
        for (var declaration : declarations) {
            graph.addTask(taskTypes.create(declaration, settings));
        }
        log.debug("Loaded {} registries and {} tasks", settings.registries().size(), declarations.size());
        return new BuildSession(settings, graph, declarations);
    }

    private void loadSettings(JsonNode node, SettingsStore settings) {
        if (node.isMissingNode() || node.isNull()) {
            return;
        }
        for (var auth : array(node.path("auth"), "settings.auth")) {
            settings.addAuth(
                text(auth, "host", "settings.auth"),
                text(auth, "principal", "settings.auth"),
                secret(auth.get("secret"), "settings.auth.secret")
            );
        }
        for (var registry : array(node.path("registries"), "settings.registries")) {
            var name = text(registry, "name", "settings.registries");
            var where = "registry " + name;
            var ecosystem = Ecosystem.from(text(registry, "ecosystem", where));
            var options = RegistryOptions.of(ecosystem);
            var read = registry.get("readCredentials");
            if (read != null && !read.isNull()) {
                options = options.withReadCredentials(new Credentials(
                    text(read, "principal", where + " readCredentials"),
                    secret(read.get("secret"), where + " readCredentials.secret")
                ));
            }
            var token = registry.get("publishToken");
            if (token != null && !token.isNull()) {
                options = options.withPublishToken(secret(token, where + " publishToken"));
            }
            settings.addRegistry(name, text(registry, "url", where), options);
        }
    }

    private List<TaskDeclaration> readTasks(JsonNode node) {
        var declarations = new ArrayList<TaskDeclaration>();
        for (var task : array(node, "tasks")) {
            var id = text(task, "id", "tasks");
            var where = "task " + id;
            var with = task.get("with");
            Map<String, Object> options = with == null || with.isNull() ? Map.of() : YAML_MAPPER.convertValue(with, MAP_TYPE);
            declarations.add(new TaskDeclaration(
                id,
                text(task, "type", where),
                strings(task.path("dependsOn"), where + " dependsOn"),
                strings(task.path("outputs"), where + " outputs").stream().map(Path::of).collect(Collectors.toList()),
                optionalText(task, "description"),
                optionalText(task, "group"),
                options
            ));
        }
        return declarations;
    }

    private Secret secret(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            throw new ConfigurationException(where + " is required");
        }
        if (node.isTextual()) {
            return Secret.of(node.asText());
        }
        if (node.isObject() && node.hasNonNull("env")) {
            return Secret.fromEnv(node.get("env").asText(), environment);
        }
        if (node.isObject() && node.hasNonNull("value")) {
            return Secret.of(node.get("value").asText());
        }
        throw new ConfigurationException(where + " must be a string, {env: NAME} or {value: ...}");
    }

    private static List<JsonNode> array(JsonNode node, String where) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ConfigurationException(where + " must be a list");
        }
        var items = new ArrayList<JsonNode>();
        for (var item : node) {
            if (!item.isObject()) {
                throw new ConfigurationException(where + " entries must be mappings");
            }
            items.add(item);
        }
        return items;
    }

    private static List<String> strings(JsonNode node, String where) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            throw new ConfigurationException(where + " must be a list of strings");
        }
        var values = new ArrayList<String>();
        node.forEach(item -> values.add(item.asText()));
        return values;
    }

    private static String text(JsonNode node, String field, String where) {
        var value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isBlank()) {
            throw new ConfigurationException(where + ": '" + field + "' is required");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
