package work.lcod.forge.inject;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.tomlj.Toml;
import work.lcod.forge.settings.Credentials;
import work.lcod.forge.settings.Ecosystem;
import work.lcod.forge.settings.Registry;
import work.lcod.forge.settings.Secret;
import work.lcod.forge.shared.ConfigurationException;

class ConfigPatcherTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void cargoPatcherWritesIndexAndToken() {
        var registry = new Registry("private-repo", "sparse+https://example.jfrog.io/api/cargo/private/index/",
            Ecosystem.CARGO, Optional.empty(), Optional.of(Secret.of("tok")));
        var existing = "[build]\njobs = 2\n";

        var patched = new CargoConfigPatcher().patch(existing, new RegistryAuth(registry, Optional.empty()));

        var toml = Toml.parse(patched);
        assertFalse(toml.hasErrors());
        assertEquals(2L, toml.getLong("build.jobs"));
        assertEquals(registry.url(), toml.getString(List.of("registries", "private-repo", "index")));
        assertEquals("tok", toml.getString(List.of("registries", "private-repo", "token")));
        assertTrue(patched.startsWith(existing));
    }

    @Test
    void cargoPatcherMergesIntoInlineRegistryTable() {
        var registry = new Registry("private-repo", "sparse+https://example.jfrog.io/api/cargo/private/index/",
            Ecosystem.CARGO, Optional.empty(), Optional.of(Secret.of("tok")));
        var existing = "[registries]\nprivate-repo = { index = \"sparse+https://old.example.com/index/\" }\n";

        var patched = new CargoConfigPatcher().patch(existing, new RegistryAuth(registry, Optional.empty()));

        var toml = Toml.parse(patched);
        assertFalse(toml.hasErrors(), patched);
        assertEquals(registry.url(), toml.getString(List.of("registries", "private-repo", "index")));
        assertEquals("tok", toml.getString(List.of("registries", "private-repo", "token")));
        assertFalse(patched.contains("[registries.private-repo]"), patched);
    }

    @Test
    void poetryPatcherMergesIntoDottedHttpBasic() {
        var registry = new Registry("internal", "https://pypi.example.com/simple", Ecosystem.PYTHON,
            Optional.empty(), Optional.empty());
        var existing = "[http-basic]\ninternal.username = \"old\"\n";

        var patched = new PoetryConfigPatcher().patch(existing, new RegistryAuth(registry, Optional.of(Credentials.of("ci", "pw"))));

        var toml = Toml.parse(patched);
        assertFalse(toml.hasErrors(), patched);
        assertEquals("ci", toml.getString(List.of("http-basic", "internal", "username")));
        assertEquals("pw", toml.getString(List.of("http-basic", "internal", "password")));
    }

    @Test
    void poetryPatcherWritesHttpBasicAndToken() {
        var registry = new Registry("internal", "https://pypi.example.com/simple", Ecosystem.PYTHON,
            Optional.empty(), Optional.of(Secret.of("pypi-tok")));
        var auth = new RegistryAuth(registry, Optional.of(Credentials.of("ci", "pw")));

        var toml = Toml.parse(new PoetryConfigPatcher().patch("", auth));

        assertEquals("ci", toml.getString(List.of("http-basic", "internal", "username")));
        assertEquals("pw", toml.getString(List.of("http-basic", "internal", "password")));
        assertEquals("pypi-tok", toml.getString(List.of("pypi-token", "internal")));
    }

    @Test
    void poetryPatcherNeedsSomethingToWrite() {
        var registry = new Registry("internal", "https://pypi.example.com/simple", Ecosystem.PYTHON,
            Optional.empty(), Optional.empty());
        assertThrows(ConfigurationException.class,
            () -> new PoetryConfigPatcher().patch("", new RegistryAuth(registry, Optional.empty())));
    }

    @Test
    void dockerPatcherMergesAuthsAndDropsHelperForHost() throws Exception {
        var registry = new Registry("images", "registry.example.com:5000/team", Ecosystem.DOCKER,
            Optional.empty(), Optional.empty());
        var existing = "{\"auths\":{\"other.example.com\":{\"auth\":\"eA==\"}},"
            + "\"credHelpers\":{\"registry.example.com:5000\":\"ecr-login\",\"gcr.io\":\"gcloud\"}}";

        var patched = new DockerAuthConfigPatcher().patch(existing, new RegistryAuth(registry, Optional.of(Credentials.of("ci", "pw"))));

        var root = JSON.readTree(patched);
        assertEquals("eA==", root.path("auths").path("other.example.com").path("auth").asText());
        assertEquals("Y2k6cHc=", root.path("auths").path("registry.example.com:5000").path("auth").asText());
        assertFalse(root.path("credHelpers").has("registry.example.com:5000"));
        assertEquals("gcloud", root.path("credHelpers").path("gcr.io").asText());
    }

    @Test
    void dockerPatcherRejectsNonObjectConfig() {
        var registry = new Registry("images", "registry.example.com", Ecosystem.DOCKER, Optional.empty(), Optional.empty());
        var auth = new RegistryAuth(registry, Optional.of(Credentials.of("ci", "pw")));
        assertThrows(ConfigurationException.class, () -> new DockerAuthConfigPatcher().patch("[]", auth));
    }
}
