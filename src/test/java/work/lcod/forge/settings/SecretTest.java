package work.lcod.forge.settings;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.forge.shared.ConfigurationException;

class SecretTest {
    @Test
    void neverPrintsTheValue() {
        var secret = Secret.of("hunter2");
        assertEquals("[MASKED]", secret.toString());
        assertEquals("hunter2", secret.reveal());
        var credentials = new Credentials("ci", secret);
        assertFalse(credentials.toString().contains("hunter2"));
    }

    @Test
    void readsEnvironmentLazily() {
        var env = new java.util.HashMap<String, String>();
        var secret = Secret.fromEnv("TOKEN", env);
        assertEquals("env:TOKEN", secret.describe());
        assertThrows(ConfigurationException.class, secret::reveal);
        env.put("TOKEN", "abc");
        assertEquals("abc", secret.reveal());
    }

    @Test
    void basicAuthTokenEncodesPrincipalAndSecret() {
        var credentials = new Credentials("ci", Secret.fromEnv("PW", Map.of("PW", "pw")));
        assertEquals("Y2k6cHc=", credentials.basicAuthToken());
    }
}
