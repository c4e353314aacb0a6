package work.lcod.forge.inject;

import java.util.Objects;
import java.util.Optional;
import work.lcod.forge.settings.Credentials;
import work.lcod.forge.settings.Registry;
import work.lcod.forge.shared.ConfigurationException;

/**
 * A registry together with the credentials the settings store resolved for it.
 */
public record RegistryAuth(Registry registry, Optional<Credentials> credentials) {
    public RegistryAuth {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(credentials, "credentials");
    }

    public Credentials requireCredentials() {
        return credentials.orElseThrow(() -> new ConfigurationException(
            "registry " + registry.name() + " has no credentials for host " + registry.host()
        ));
    }
}
