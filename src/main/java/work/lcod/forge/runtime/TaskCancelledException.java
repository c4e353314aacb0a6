package work.lcod.forge.runtime;

import work.lcod.forge.shared.ForgeException;

public final class TaskCancelledException extends ForgeException {
    public TaskCancelledException(String message) {
        super("cancelled", message);
    }
}
