package work.lcod.forge.settings;

import java.util.Objects;
import java.util.Optional;

/**
 * Optional attributes of a registry declaration.
 */
public record RegistryOptions(Ecosystem ecosystem, Optional<Credentials> readCredentials, Optional<Secret> publishToken) {
    public RegistryOptions {
        Objects.requireNonNull(ecosystem, "ecosystem");
        Objects.requireNonNull(readCredentials, "readCredentials");
        Objects.requireNonNull(publishToken, "publishToken");
    }

    public static RegistryOptions of(Ecosystem ecosystem) {
        return new RegistryOptions(ecosystem, Optional.empty(), Optional.empty());
    }

    public RegistryOptions withReadCredentials(Credentials credentials) {
        return new RegistryOptions(ecosystem, Optional.of(credentials), publishToken);
    }

    public RegistryOptions withPublishToken(Secret token) {
        return new RegistryOptions(ecosystem, readCredentials, Optional.of(token));
    }
}
