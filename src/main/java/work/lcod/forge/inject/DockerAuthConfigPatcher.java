package work.lcod.forge.inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Merges {@code auths.<host>.auth} into a Docker-style {@code config.json}. Used for Docker
 * and for Helm's OCI registry configuration, which shares the format. Any credential helper
 * bound to the same host is dropped for the scope so the injected entry is the one used.
 */
public final class DockerAuthConfigPatcher implements ConfigPatcher {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Override
    public String patch(String existing, RegistryAuth auth) {
        var root = readRoot(existing);
        var host = auth.registry().endpoint();
        var auths = root.has("auths") && root.get("auths").isObject()
            ? (ObjectNode) root.get("auths")
            : root.putObject("auths");
        var entry = JSON.createObjectNode();
        entry.put("auth", auth.requireCredentials().basicAuthToken());
        auths.set(host, entry);
        var helpers = root.get("credHelpers");
        if (helpers instanceof ObjectNode helperNode) {
            helperNode.remove(host);
        }
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(root) + "\n";
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Unable to render docker auth config: " + ex.getOriginalMessage(), ex);
        }
    }

    private static ObjectNode readRoot(String existing) {
        if (existing == null || existing.isBlank()) {
            return JSON.createObjectNode();
        }
        try {
            JsonNode node = JSON.readTree(existing);
            if (node instanceof ObjectNode object) {
                return object;
            }
            throw new ConfigurationException("docker auth config must be a JSON object");
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Invalid docker auth config: " + ex.getOriginalMessage(), ex);
        }
    }
}
