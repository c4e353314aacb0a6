package work.lcod.forge.runtime;

/**
 * Cooperative cancellation flag shared by a run and its tasks.
 */
public final class CancellationToken {
    private volatile boolean cancelled;
    private volatile String reason;

    public void cancel() {
        cancel("cancelled");
    }

    public void cancel(String reason) {
        if (!cancelled) {
            this.reason = reason;
            this.cancelled = true;
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String reason() {
        return reason;
    }
}
