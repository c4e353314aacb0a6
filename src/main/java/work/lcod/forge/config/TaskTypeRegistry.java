package work.lcod.forge.config;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.forge.graph.Task;
import work.lcod.forge.settings.SettingsStore;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Task types available to build files, keyed by type name ({@code cargo.publish}, ...).
 */
public final class TaskTypeRegistry {
    private final Map<String, TaskFactory> factories = new ConcurrentHashMap<>();

    public TaskTypeRegistry register(String type, TaskFactory factory) {
        factories.put(type, factory);
        return this;
    }

    public TaskFactory get(String type) {
        return factories.get(type);
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    public Task create(TaskDeclaration declaration, SettingsStore settings) {
        var factory = factories.get(declaration.type());
        if (factory == null) {
            throw new ConfigurationException("Task " + declaration.id() + " has unknown type '" + declaration.type()
                + "' (known: " + String.join(", ", types()) + ")");
        }
        return factory.create(declaration, settings);
    }
}
