package work.lcod.forge.graph;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lcod.forge.runtime.TaskRunner;
import work.lcod.forge.settings.SettingsStore;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Directed acyclic graph of tasks keyed by id. Tasks are added while the build is assembled;
 * {@link #validate()} resolves every dependency, rejects cycles and fixes the topology.
 */
public final class TaskGraph {
    private final SettingsStore settings;
    private final Path projectDirectory;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private Map<String, List<String>> edges = Map.of();
    private Map<String, List<String>> reverseEdges = Map.of();
    private List<String> topologicalOrder = List.of();
    private volatile boolean validated;

    public TaskGraph(SettingsStore settings) {
        this(settings, null);
    }

    public TaskGraph(SettingsStore settings, Path projectDirectory) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.projectDirectory = projectDirectory == null
            ? Paths.get("").toAbsolutePath().normalize()
            : projectDirectory.toAbsolutePath().normalize();
    }

    public SettingsStore settings() {
        return settings;
    }

    public Path projectDirectory() {
        return projectDirectory;
    }

    public void addTask(String id, List<String> deps, TaskRunner runner) {
        addTask(Task.builder(id).dependsOn(deps == null ? List.of() : deps).runner(runner).build());
    }

    public synchronized void addTask(Task task) {
        Objects.requireNonNull(task, "task");
        if (validated) {
            throw new IllegalStateException("Task graph topology is fixed after validation; cannot add " + task.id());
        }
        if (tasks.containsKey(task.id())) {
            throw new DuplicateTaskException(task.id());
        }
        tasks.put(task.id(), task);
    }

    /**
     * Resolves dependencies (task ids, task outputs, existing files), rejects cycles and computes
     * a deterministic topological order. Idempotent once it has succeeded.
     */
    public synchronized void validate() {
        if (validated) {
            return;
        }
        var producers = indexOutputs();
        var resolved = new LinkedHashMap<String, List<String>>();
        for (var task : tasks.values()) {
            var deps = new ArrayList<String>();
            for (var dep : task.dependencies()) {
                var target = resolveDependency(task, dep, producers);
                if (target != null && !deps.contains(target)) {
                    deps.add(target);
                }
            }
            resolved.put(task.id(), Collections.unmodifiableList(deps));
        }
        detectCycle(resolved);

        var reverse = new LinkedHashMap<String, List<String>>();
        for (var id : tasks.keySet()) {
            reverse.put(id, new ArrayList<>());
        }
        for (var entry : resolved.entrySet()) {
            for (var dep : entry.getValue()) {
                reverse.get(dep).add(entry.getKey());
            }
        }
        reverse.replaceAll((id, list) -> Collections.unmodifiableList(list));

        this.edges = Collections.unmodifiableMap(resolved);
        this.reverseEdges = Collections.unmodifiableMap(reverse);
        this.topologicalOrder = List.copyOf(computeOrder(resolved));
        this.validated = true;
    }

    public boolean isValidated() {
        return validated;
    }

    public synchronized Optional<Task> find(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public Task task(String id) {
        return find(id).orElseThrow(() -> new UnresolvedDependencyException(null, id));
    }

    /**
     * Tasks in insertion order.
     */
    public synchronized List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    public List<String> dependenciesOf(String id) {
        requireValidated();
        return edges.getOrDefault(id, List.of());
    }

    public List<String> dependentsOf(String id) {
        requireValidated();
        return reverseEdges.getOrDefault(id, List.of());
    }

    public Set<String> transitiveDependents(String id) {
        requireValidated();
        var seen = new LinkedHashSet<String>();
        var queue = new ArrayDeque<>(dependentsOf(id));
        while (!queue.isEmpty()) {
            var next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(dependentsOf(next));
            }
        }
        return seen;
    }

    /**
     * Dependency-first order; among independent tasks the insertion order wins.
     */
    public List<String> topologicalOrder() {
        requireValidated();
        return topologicalOrder;
    }

    /**
     * The requested goals plus everything they transitively depend on, in topological order.
     */
    public Set<String> select(Collection<String> goals) {
        requireValidated();
        if (goals == null || goals.isEmpty()) {
            return new LinkedHashSet<>(topologicalOrder);
        }
        var closure = new HashSet<String>();
        var queue = new ArrayDeque<String>();
        for (var goal : goals) {
            if (!tasks.containsKey(goal)) {
                throw new UnresolvedDependencyException(null, goal);
            }
            queue.add(goal);
        }
        while (!queue.isEmpty()) {
            var next = queue.poll();
            if (closure.add(next)) {
                queue.addAll(dependenciesOf(next));
            }
        }
        var ordered = new LinkedHashSet<String>();
        for (var id : topologicalOrder) {
            if (closure.contains(id)) {
                ordered.add(id);
            }
        }
        return ordered;
    }

    public Path resolvePath(Path path) {
        return projectDirectory.resolve(path).toAbsolutePath().normalize();
    }

    private Map<Path, String> indexOutputs() {
        var producers = new HashMap<Path, String>();
        for (var task : tasks.values()) {
            for (var output : task.outputs()) {
                var previous = producers.put(resolvePath(output), task.id());
                if (previous != null && !previous.equals(task.id())) {
                    throw new ConfigurationException("Output " + output + " is declared by both " + previous + " and " + task.id());
                }
            }
        }
        return producers;
    }

    private String resolveDependency(Task task, String dep, Map<Path, String> producers) {
        if (tasks.containsKey(dep)) {
            return dep;
        }
        if (dep.startsWith(Task.FILE_PREFIX)) {
            var path = resolvePath(Paths.get(dep.substring(Task.FILE_PREFIX.length())));
            var producer = producers.get(path);
            if (producer != null) {
                return producer;
            }
            if (Files.exists(path)) {
                return null;
            }
        }
        throw new UnresolvedDependencyException(task.id(), dep);
    }

    private void detectCycle(Map<String, List<String>> resolved) {
        var state = new HashMap<String, Integer>();
        for (var root : resolved.keySet()) {
            if (state.containsKey(root)) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> iterators = new ArrayDeque<>();
            state.put(root, 1);
            path.push(root);
            iterators.push(resolved.get(root).iterator());
            while (!iterators.isEmpty()) {
                var it = iterators.peek();
                if (!it.hasNext()) {
                    iterators.pop();
                    state.put(path.pop(), 2);
                    continue;
                }
                var next = it.next();
                var mark = state.get(next);
                if (mark == null) {
                    state.put(next, 1);
                    path.push(next);
                    iterators.push(resolved.get(next).iterator());
                } else if (mark == 1) {
                    throw new CycleException(extractCycle(path, next));
                }
            }
        }
    }

    private static List<String> extractCycle(Deque<String> path, String repeated) {
        var stack = new ArrayList<>(path);
        Collections.reverse(stack);
        var cycle = new ArrayList<>(stack.subList(stack.indexOf(repeated), stack.size()));
        cycle.add(repeated);
        return cycle;
    }

    private List<String> computeOrder(Map<String, List<String>> resolved) {
        var order = new ArrayList<String>(resolved.size());
        var placed = new HashSet<String>();
        while (order.size() < resolved.size()) {
            for (var entry : resolved.entrySet()) {
                if (!placed.contains(entry.getKey()) && placed.containsAll(entry.getValue())) {
                    placed.add(entry.getKey());
                    order.add(entry.getKey());
                    break;
                }
            }
        }
        return order;
    }

    private void requireValidated() {
        if (!validated) {
            throw new IllegalStateException("Task graph has not been validated");
        }
    }
}
