package work.lcod.forge.config;

import work.lcod.forge.cargo.CargoTasks;
import work.lcod.forge.docker.DockerTasks;
import work.lcod.forge.exec.ExecTasks;
import work.lcod.forge.helm.HelmTasks;
import work.lcod.forge.python.PythonLintTasks;
import work.lcod.forge.python.PythonTasks;

/**
 * Shared task type bootstrap so the CLI, the embedding API and tests see the same types.
 */
public final class TaskTypes {
    private TaskTypes() {}

    public static TaskTypeRegistry create() {
        var registry = new TaskTypeRegistry();
        ExecTasks.register(registry);
        CargoTasks.register(registry);
        DockerTasks.register(registry);
        HelmTasks.register(registry);
        PythonTasks.register(registry);
        PythonLintTasks.register(registry);
        return registry;
    }
}
