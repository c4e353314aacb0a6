package work.lcod.forge.config;

import work.lcod.forge.graph.Task;
import work.lcod.forge.settings.SettingsStore;

/**
 * Turns a declaration of one task type into a runnable {@link Task}. Registry names are
 * resolved here so that a typo fails before anything runs.
 */
@FunctionalInterface
public interface TaskFactory {
    Task create(TaskDeclaration declaration, SettingsStore settings);
}
