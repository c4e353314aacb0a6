package work.lcod.forge.settings;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import work.lcod.forge.shared.ConfigurationException;

/**
 * A named remote artifact endpoint with optional credentials.
 */
public record Registry(
    String name,
    String url,
    Ecosystem ecosystem,
    Optional<Credentials> readCredentials,
    Optional<Secret> publishToken
) {
    private static final String[] URL_PREFIXES = {"sparse+", "registry+", "git+"};

    public Registry {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("registry name is required");
        }
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("registry " + name + " has no url");
        }
        Objects.requireNonNull(ecosystem, "ecosystem");
        Objects.requireNonNull(readCredentials, "readCredentials");
        Objects.requireNonNull(publishToken, "publishToken");
        name = name.trim();
        url = url.trim();
        hostOf(name, url);
    }

    /**
     * Lower-cased host the registry is served from; accepts Cargo's {@code sparse+} style
     * prefixes and bare {@code host/path} references used by container registries.
     */
    public String host() {
        return hostOf(name, url);
    }

    /**
     * Host plus explicit port, the key container registries use in {@code config.json}.
     */
    public String endpoint() {
        var uri = uriOf(name, url);
        return uri.getPort() < 0 ? host() : host() + ":" + uri.getPort();
    }

    public Secret requirePublishToken() {
        return publishToken.orElseThrow(() -> new ConfigurationException("registry " + name + " has no publish token"));
    }

    private static String hostOf(String name, String url) {
        String host = uriOf(name, url).getHost();
        if (host == null || host.isBlank()) {
            throw new ConfigurationException("registry " + name + " url has no host: " + url);
        }
        return host.toLowerCase(Locale.ROOT);
    }

    private static URI uriOf(String name, String url) {
        String candidate = url;
        for (String prefix : URL_PREFIXES) {
            if (candidate.startsWith(prefix)) {
                candidate = candidate.substring(prefix.length());
            }
        }
        if (!candidate.contains("://")) {
            candidate = "https://" + candidate;
        }
        try {
            return new URI(candidate);
        } catch (URISyntaxException ex) {
            throw new ConfigurationException("registry " + name + " has an invalid url: " + url, ex);
        }
    }
}
