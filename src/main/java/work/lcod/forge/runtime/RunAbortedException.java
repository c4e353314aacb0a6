package work.lcod.forge.runtime;

import work.lcod.forge.shared.ForgeException;

/**
 * The run stopped because a credential file could not be restored. The report describes the
 * tasks that completed before the abort; the cause is the restore failure.
 */
public final class RunAbortedException extends ForgeException {
    private final RunReport report;

    public RunAbortedException(RunReport report, Throwable cause) {
        super("run_aborted", "Run aborted: " + cause.getMessage(), cause);
        this.report = report;
    }

    public RunReport report() {
        return report;
    }
}
