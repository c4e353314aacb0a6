package work.lcod.forge.graph;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a task within one run.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return allowedNext().contains(next);
    }

    private Set<TaskStatus> allowedNext() {
        return switch (this) {
            // SUCCEEDED straight from PENDING is the up-to-date path
            case PENDING -> EnumSet.of(RUNNING, SUCCEEDED, SKIPPED, CANCELLED);
            case RUNNING -> EnumSet.of(SUCCEEDED, FAILED, CANCELLED);
            default -> EnumSet.noneOf(TaskStatus.class);
        };
    }
}
