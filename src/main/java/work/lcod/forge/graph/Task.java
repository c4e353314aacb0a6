package work.lcod.forge.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import work.lcod.forge.runtime.TaskRunner;
import work.lcod.forge.runtime.UpToDateCheck;

/**
 * A unit of build work. Dependencies are task ids or {@code file:<path>} artifact references;
 * resources are configuration files the task patches and must own exclusively while running.
 * Only the scheduler moves a task through its {@link TaskStatus} lifecycle.
 */
public final class Task {
    public static final String FILE_PREFIX = "file:";
    public static final String DEFAULT_BACKEND = "process";

    private final String id;
    private final List<String> dependencies;
    private final List<Path> outputs;
    private final Set<Path> resources;
    private final String backend;
    private final String description;
    private final String group;
    private final TaskRunner runner;
    private final UpToDateCheck upToDateCheck;
    private final AtomicReference<TaskStatus> status = new AtomicReference<>(TaskStatus.PENDING);

    private Task(Builder builder) {
        this.id = builder.id;
        this.dependencies = List.copyOf(builder.dependencies);
        this.outputs = List.copyOf(builder.outputs);
        this.resources = Set.copyOf(builder.resources);
        this.backend = builder.backend;
        this.description = builder.description;
        this.group = builder.group;
        this.runner = builder.runner;
        this.upToDateCheck = builder.upToDateCheck;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String id() {
        return id;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public List<Path> outputs() {
        return outputs;
    }

    public Set<Path> resources() {
        return resources;
    }

    public String backend() {
        return backend;
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public Optional<String> group() {
        return Optional.ofNullable(group);
    }

    public TaskRunner runner() {
        return runner;
    }

    public Optional<UpToDateCheck> upToDateCheck() {
        return Optional.ofNullable(upToDateCheck);
    }

    public TaskStatus status() {
        return status.get();
    }

    /**
     * Moves the task from {@code expected} to {@code next}. Reserved for the scheduler.
     */
    public void transition(TaskStatus expected, TaskStatus next) {
        if (!expected.canTransitionTo(next) || !status.compareAndSet(expected, next)) {
            throw new StateTransitionException(id, status.get(), next);
        }
    }

    @Override
    public String toString() {
        return "Task[" + id + ", " + status.get() + "]";
    }

    public static final class Builder {
        private final String id;
        private final List<String> dependencies = new ArrayList<>();
        private final List<Path> outputs = new ArrayList<>();
        private final Set<Path> resources = new LinkedHashSet<>();
        private String backend = DEFAULT_BACKEND;
        private String description;
        private String group;
        private TaskRunner runner;
        private UpToDateCheck upToDateCheck;

        private Builder(String id) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("task id is required");
            }
            this.id = id.trim();
        }

        public Builder dependsOn(String... ids) {
            return dependsOn(List.of(ids));
        }

        public Builder dependsOn(List<String> ids) {
            for (String dep : ids) {
                if (dep == null || dep.isBlank()) {
                    throw new IllegalArgumentException("blank dependency on task " + id);
                }
                if (!dependencies.contains(dep.trim())) {
                    dependencies.add(dep.trim());
                }
            }
            return this;
        }

        public Builder dependsOnFile(Path path) {
            return dependsOn(FILE_PREFIX + path);
        }

        public Builder output(Path path) {
            outputs.add(Objects.requireNonNull(path, "path"));
            return this;
        }

        public Builder resource(Path path) {
            resources.add(Objects.requireNonNull(path, "path"));
            return this;
        }

        public Builder backend(String backend) {
            this.backend = backend == null || backend.isBlank() ? DEFAULT_BACKEND : backend;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder group(String group) {
            this.group = group;
            return this;
        }

        public Builder runner(TaskRunner runner) {
            this.runner = runner;
            return this;
        }

        public Builder upToDateWhen(UpToDateCheck check) {
            this.upToDateCheck = check;
            return this;
        }

        public Task build() {
            Objects.requireNonNull(runner, "runner for task " + id);
            return new Task(this);
        }
    }
}
