package work.lcod.forge.config;

import java.util.List;
import work.lcod.forge.graph.TaskGraph;
import work.lcod.forge.settings.SettingsStore;

/**
 * A loaded build: the settings, the (not yet validated) task graph and the declarations the
 * tasks came from.
 */
public record BuildSession(SettingsStore settings, TaskGraph graph, List<TaskDeclaration> declarations) {
    public BuildSession {
        declarations = List.copyOf(declarations);
    }
}
