package work.lcod.forge.runtime;

@FunctionalInterface
public interface UpToDateCheck {
    boolean isUpToDate(TaskContext context) throws Exception;
}
