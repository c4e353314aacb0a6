package work.lcod.forge.graph;

import work.lcod.forge.shared.ForgeException;

/**
 * Raised when a task status change violates the lifecycle.
 */
public final class StateTransitionException extends ForgeException {
    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public StateTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        super("illegal_transition", "Task " + taskId + " cannot move from " + from + " to " + to);
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String taskId() {
        return taskId;
    }

    public TaskStatus from() {
        return from;
    }

    public TaskStatus to() {
        return to;
    }
}
