package work.lcod.forge.graph;

import work.lcod.forge.shared.ForgeException;

public final class UnresolvedDependencyException extends ForgeException {
    private final String taskId;
    private final String dependency;

    public UnresolvedDependencyException(String taskId, String dependency) {
        super(
            "unresolved_dependency",
            taskId == null
                ? "Unknown task: " + dependency
                : "Task " + taskId + " depends on unknown task or artifact: " + dependency
        );
        this.taskId = taskId;
        this.dependency = dependency;
    }

    /**
     * Declaring task, or {@code null} when an unknown goal was requested.
     */
    public String taskId() {
        return taskId;
    }

    public String dependency() {
        return dependency;
    }
}
