package work.lcod.forge.settings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Registries and host credentials for one build session. Writable while the build graph is
 * assembled, read-only once {@link #freeze()} has been called by the scheduler.
 */
public final class SettingsStore {
    private static final Logger log = LoggerFactory.getLogger(SettingsStore.class);

    private final Map<String, Registry> registries = new LinkedHashMap<>();
    private final Map<String, AuthEntry> auth = new LinkedHashMap<>();
    private volatile boolean frozen;

    public synchronized void addAuth(String host, String principal, Secret secret) {
        ensureMutable();
        var entry = new AuthEntry(host, principal, secret);
        if (auth.put(entry.host(), entry) != null) {
            log.debug("Replacing auth entry for host {}", entry.host());
        }
    }

    /**
     * Declares a registry. Declaring the same name again replaces the earlier entry so layered
     * configuration can override defaults.
     */
    public synchronized Registry addRegistry(String name, String url, RegistryOptions opts) {
        ensureMutable();
        if (opts == null) {
            throw new ConfigurationException("registry " + name + " has no options");
        }
        var registry = new Registry(name, url, opts.ecosystem(), opts.readCredentials(), opts.publishToken());
        if (registries.put(registry.name(), registry) != null) {
            log.debug("Registry {} redeclared, last declaration wins", registry.name());
        }
        return registry;
    }

    public synchronized Registry resolve(String name) {
        var registry = name == null ? null : registries.get(name.trim());
        if (registry == null) {
            throw new RegistryNotFoundException(name);
        }
        return registry;
    }

    public synchronized Optional<AuthEntry> authFor(String host) {
        if (host == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(auth.get(host.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Credentials used to read from (and log into) the registry: its own read credentials,
     * else the auth entry declared for its host.
     */
    public Optional<Credentials> credentialsFor(Registry registry) {
        if (registry.readCredentials().isPresent()) {
            return registry.readCredentials();
        }
        return authFor(registry.host()).map(AuthEntry::credentials);
    }

    public synchronized List<Registry> registries(Ecosystem ecosystem) {
        var result = new ArrayList<Registry>();
        for (var registry : registries.values()) {
            if (registry.ecosystem() == ecosystem) {
                result.add(registry);
            }
        }
        return result;
    }

    public synchronized Map<String, Registry> registries() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(registries));
    }

    public synchronized Map<String, AuthEntry> authEntries() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(auth));
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void ensureMutable() {
        if (frozen) {
            throw new ConfigurationException("Settings cannot change once task execution has started");
        }
    }
}
