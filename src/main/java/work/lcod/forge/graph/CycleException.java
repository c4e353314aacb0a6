package work.lcod.forge.graph;

import java.util.List;
import work.lcod.forge.shared.ForgeException;

/**
 * The task graph contains a dependency cycle. {@link #cycle()} lists the tasks along the cycle,
 * starting and ending with the same id.
 */
public final class CycleException extends ForgeException {
    private final List<String> cycle;

    public CycleException(List<String> cycle) {
        super("dependency_cycle", "Dependency cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
