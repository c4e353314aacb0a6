package work.lcod.forge.graph;

import work.lcod.forge.shared.ForgeException;

public final class DuplicateTaskException extends ForgeException {
    private final String taskId;

    public DuplicateTaskException(String taskId) {
        super("duplicate_task", "Task already defined: " + taskId);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
