package work.lcod.forge.settings;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Basic-auth pair. The secret stays a reference until a patcher or a command needs it.
 */
public record Credentials(String principal, Secret secret) {
    public Credentials {
        if (principal == null || principal.isBlank()) {
            throw new ConfigurationException("principal is required");
        }
        Objects.requireNonNull(secret, "secret");
    }

    public static Credentials of(String principal, String secret) {
        return new Credentials(principal, Secret.of(secret));
    }

    /**
     * {@code base64(principal:secret)} as used by Docker-style {@code config.json} files.
     */
    public String basicAuthToken() {
        var raw = principal + ":" + secret.reveal();
        return Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return "Credentials[principal=" + principal + ", secret=" + secret.describe() + "]";
    }
}
