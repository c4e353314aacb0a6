package work.lcod.forge.runtime;

import java.util.Map;

/**
 * Body of a task. The returned map is published to dependent tasks through
 * {@link TaskContext#resultOf(String)}.
 */
@FunctionalInterface
public interface TaskRunner {
    Map<String, Object> run(TaskContext context) throws Exception;
}
