package work.lcod.forge.settings;

import java.util.Locale;
import java.util.Objects;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Authentication material for every registry served from one host.
 */
public record AuthEntry(String host, String principal, Secret secret) {
    public AuthEntry {
        if (host == null || host.isBlank()) {
            throw new ConfigurationException("auth host is required");
        }
        if (principal == null || principal.isBlank()) {
            throw new ConfigurationException("auth principal is required for host " + host);
        }
        Objects.requireNonNull(secret, "secret");
        host = host.trim().toLowerCase(Locale.ROOT);
    }

    public Credentials credentials() {
        return new Credentials(principal, secret);
    }

    @Override
    public String toString() {
        return "AuthEntry[host=" + host + ", principal=" + principal + ", secret=" + secret.describe() + "]";
    }
}
