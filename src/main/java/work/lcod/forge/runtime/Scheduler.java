package work.lcod.forge.runtime;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.exec.BackendExecutor;
import work.lcod.forge.exec.ProcessBackendExecutor;
import work.lcod.forge.graph.Task;
import work.lcod.forge.graph.TaskGraph;
import work.lcod.forge.graph.TaskStatus;
import work.lcod.forge.inject.CredentialInjector;
import work.lcod.forge.inject.CredentialRestoreException;

/**
 * Runs the tasks of a validated graph with bounded parallelism.
 *
 * <p>The calling thread coordinates: it performs every status transition, dispatches eligible
 * tasks in graph order to a fixed worker pool, serializes tasks sharing an exclusive resource
 * and cascades failures to dependents. Workers only run task bodies.
 */
public final class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);
    private static final long POLL_MILLIS = 50;

    private final int parallelism;
    private final BackendExecutor executor;
    private final CredentialInjector injector;
    private final CancellationToken cancellationToken;
    private final Duration timeout;

    private Scheduler(Builder builder) {
        this.parallelism = builder.parallelism;
        this.executor = builder.executor;
        this.injector = builder.injector;
        this.cancellationToken = builder.cancellationToken;
        this.timeout = builder.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public RunReport run(TaskGraph graph) {
        return run(graph, List.of());
    }

    /**
     * Runs {@code goals} and their transitive dependencies (every task when empty).
     *
     * @throws RunAbortedException when a credential file could not be restored
     */
    public RunReport run(TaskGraph graph, Collection<String> goals) {
        Objects.requireNonNull(graph, "graph");
        graph.validate();
        graph.settings().freeze();
        var selected = graph.select(goals);
        for (var id : selected) {
            var status = graph.task(id).status();
            if (status != TaskStatus.PENDING) {
                throw new IllegalStateException("Task " + id + " already ran (" + status + ")");
            }
        }
        var injector = this.injector != null ? this.injector : new CredentialInjector(graph.settings());
        return new Run(graph, selected, injector).execute();
    }

    private record Completion(String taskId, Map<String, Object> result, Throwable failure, Duration duration) {}

    /**
     * State of one invocation of {@link #run(TaskGraph, Collection)}; confined to the coordinator.
     */
    private final class Run {
        private final TaskGraph graph;
        private final List<Task> ordered = new ArrayList<>();
        private final Set<String> selected;
        private final CredentialInjector injector;
        private final Map<String, Map<String, Object>> results = new ConcurrentHashMap<>();
        private final Map<String, TaskReport> reports = new HashMap<>();
        private final Map<String, TaskContext> contexts = new HashMap<>();
        private final Map<String, Set<Path>> running = new LinkedHashMap<>();
        private final Set<Path> heldResources = new HashSet<>();
        private final Instant startedAt = Instant.now();
        private final Instant deadline;
        private RunReport.Outcome stopOutcome;
        private String stopReason;
        private CredentialRestoreException fatal;

        Run(TaskGraph graph, Set<String> selected, CredentialInjector injector) {
            this.graph = graph;
            this.selected = selected;
            this.injector = injector;
            this.deadline = timeout == null ? null : startedAt.plus(timeout);
            for (var task : graph.tasks()) {
                if (selected.contains(task.id())) {
                    ordered.add(task);
                }
            }
        }

        RunReport execute() {
            log.info("Running {} task(s) with parallelism {}", ordered.size(), parallelism);
            ExecutorService pool = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
            CompletionService<Completion> completions = new ExecutorCompletionService<>(pool);
            boolean interrupted = false;
            try {
                while (true) {
                    checkStopConditions();
                    cascade();
                    if (stopOutcome == null) {
                        dispatch(completions);
                    }
                    if (running.isEmpty()) {
                        break;
                    }
                    Future<Completion> done;
                    try {
                        done = completions.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                    } catch (InterruptedException ex) {
                        interrupted = true;
                        cancellationToken.cancel("interrupted");
                        continue;
                    }
                    if (done != null) {
                        complete(done);
                    }
                }
            } finally {
                pool.shutdown();
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
            cancelRemaining();
            var report = buildReport();
            report.summaryLines().forEach(line -> log.info("{}", line));
            if (fatal != null) {
                throw new RunAbortedException(report, fatal);
            }
            return report;
        }

        private void checkStopConditions() {
            if (stopOutcome != null) {
                return;
            }
            if (deadline != null && Instant.now().isAfter(deadline)) {
                cancellationToken.cancel("timed out after " + timeout);
            }
            if (cancellationToken.isCancelled()) {
                stop(RunReport.Outcome.CANCELLED, cancellationToken.reason());
            }
        }

        private void stop(RunReport.Outcome outcome, String reason) {
            if (stopOutcome == null) {
                stopOutcome = outcome;
                stopReason = reason;
                log.warn("Stopping dispatch: {}", reason);
            }
        }

        /**
         * Pending tasks with a failed, skipped or cancelled dependency will never run. Graph order
         * visits dependencies first, so one pass settles the whole chain.
         */
        private void cascade() {
            for (var id : graph.topologicalOrder()) {
                if (!selected.contains(id)) {
                    continue;
                }
                var task = graph.task(id);
                if (task.status() != TaskStatus.PENDING) {
                    continue;
                }
                for (var dep : graph.dependenciesOf(id)) {
                    var depStatus = graph.task(dep).status();
                    if (depStatus == TaskStatus.FAILED || depStatus == TaskStatus.SKIPPED) {
                        finish(task, TaskStatus.PENDING, TaskStatus.SKIPPED,
                            TaskReport.notRun(id, TaskStatus.SKIPPED, "dependency " + dep + " " + depStatus.name().toLowerCase()));
                        break;
                    }
                    if (depStatus == TaskStatus.CANCELLED) {
                        finish(task, TaskStatus.PENDING, TaskStatus.CANCELLED,
                            TaskReport.notRun(id, TaskStatus.CANCELLED, "dependency " + dep + " cancelled"));
                        break;
                    }
                }
            }
        }

        /**
         * Up-to-date tasks complete inline and may unblock tasks earlier in graph order, hence the
         * repeated passes.
         */
        private void dispatch(CompletionService<Completion> completions) {
            boolean progressed = true;
            while (progressed) {
                progressed = false;
                for (var task : ordered) {
                    if (running.size() >= parallelism) {
                        return;
                    }
                    if (dispatchOne(task, completions)) {
                        progressed = true;
                    }
                }
            }
        }

        /**
         * Returns true when the task completed inline as up-to-date.
         */
        private boolean dispatchOne(Task task, CompletionService<Completion> completions) {
            if (task.status() != TaskStatus.PENDING || !dependenciesSucceeded(task)) {
                return false;
            }
            var resources = resourcesOf(task);
            if (resources.stream().anyMatch(heldResources::contains)) {
                log.debug("Task {} waits for an exclusive resource", task.id());
                return false;
            }
            var context = new TaskContext(task, graph.settings(), graph.projectDirectory(), executor, injector, cancellationToken, results);
            if (isUpToDate(task, context)) {
                results.put(task.id(), Map.of());
                finish(task, TaskStatus.PENDING, TaskStatus.SUCCEEDED,
                    new TaskReport(task.id(), TaskStatus.SUCCEEDED, Duration.ZERO, true, context.output(), null, Map.of()));
                return true;
            }
            task.transition(TaskStatus.PENDING, TaskStatus.RUNNING);
            heldResources.addAll(resources);
            running.put(task.id(), resources);
            contexts.put(task.id(), context);
            log.info("Task {} started", task.id());
            completions.submit(() -> runBody(task, context));
            return false;
        }

        private boolean dependenciesSucceeded(Task task) {
            for (var dep : graph.dependenciesOf(task.id())) {
                if (graph.task(dep).status() != TaskStatus.SUCCEEDED) {
                    return false;
                }
            }
            return true;
        }

        private Set<Path> resourcesOf(Task task) {
            var resources = new HashSet<Path>();
            for (var resource : task.resources()) {
                resources.add(graph.resolvePath(resource));
            }
            return resources;
        }

        private boolean isUpToDate(Task task, TaskContext context) {
            var check = task.upToDateCheck();
            if (check.isEmpty()) {
                return false;
            }
            try {
                return check.get().isUpToDate(context);
            } catch (Exception ex) {
                log.warn("Up-to-date check of task {} failed, running it: {}", task.id(), ex.getMessage());
                return false;
            }
        }

        private void complete(Future<Completion> done) {
            Completion completion;
            try {
                completion = done.get();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while reading a completed task", ex);
            } catch (ExecutionException ex) {
                // runBody captures every throwable, so a failed future is a bug in the scheduler itself
                throw new IllegalStateException("Worker failed", ex.getCause());
            }
            var task = graph.task(completion.taskId());
            var context = contexts.remove(task.id());
            heldResources.removeAll(running.remove(task.id()));

            var failure = completion.failure();
            if (failure == null) {
                results.put(task.id(), completion.result());
                finish(task, TaskStatus.RUNNING, TaskStatus.SUCCEEDED,
                    new TaskReport(task.id(), TaskStatus.SUCCEEDED, completion.duration(), false, context.output(), null, completion.result()));
                return;
            }
            var restoreFailure = findRestoreFailure(failure);
            if (restoreFailure != null && fatal == null) {
                fatal = restoreFailure;
                stop(RunReport.Outcome.ABORTED, restoreFailure.getMessage());
            }
            var status = failure instanceof TaskCancelledException || failure instanceof InterruptedException
                ? TaskStatus.CANCELLED
                : TaskStatus.FAILED;
            finish(task, TaskStatus.RUNNING, status,
                new TaskReport(task.id(), status, completion.duration(), false, context.output(), describe(failure), Map.of()));
        }

        private void cancelRemaining() {
            for (var task : ordered) {
                if (task.status() == TaskStatus.PENDING) {
                    var reason = stopReason != null ? stopReason : "not reached";
                    finish(task, TaskStatus.PENDING, TaskStatus.CANCELLED, TaskReport.notRun(task.id(), TaskStatus.CANCELLED, reason));
                }
            }
        }

        private void finish(Task task, TaskStatus from, TaskStatus to, TaskReport report) {
            task.transition(from, to);
            reports.put(task.id(), report);
            switch (to) {
                case FAILED -> log.error("Task {} failed: {}", task.id(), report.error());
                case SKIPPED, CANCELLED -> log.info("Task {} {}: {}", task.id(), to.name().toLowerCase(), report.error());
                default -> log.info("Task {} succeeded{}", task.id(), report.upToDate() ? " (up-to-date)" : "");
            }
        }

        private RunReport buildReport() {
            var taskReports = new ArrayList<TaskReport>(ordered.size());
            boolean failed = false;
            boolean cancelled = false;
            for (var task : ordered) {
                var report = reports.get(task.id());
                taskReports.add(report);
                failed |= report.status() == TaskStatus.FAILED;
                cancelled |= report.status() == TaskStatus.CANCELLED;
            }
            // a cancel that arrives after the last task finished leaves nothing cancelled
            if (stopOutcome == RunReport.Outcome.ABORTED
                || (stopOutcome == RunReport.Outcome.CANCELLED && cancelled)) {
                return new RunReport(taskReports, stopOutcome, stopReason, startedAt, Instant.now());
            }
            var outcome = failed ? RunReport.Outcome.FAILURE : RunReport.Outcome.SUCCESS;
            return new RunReport(taskReports, outcome, null, startedAt, Instant.now());
        }
    }

    private Completion runBody(Task task, TaskContext context) {
        long start = System.nanoTime();
        try {
            context.ensureNotCancelled();
            var result = task.runner().run(context);
            return new Completion(task.id(), result == null ? Map.of() : result, null, Duration.ofNanos(System.nanoTime() - start));
        } catch (Exception ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return new Completion(task.id(), null, ex, Duration.ofNanos(System.nanoTime() - start));
        } catch (Error error) {
            // an Error fails only this task
            log.error("Task {} raised {}", task.id(), error.getClass().getName(), error);
            return new Completion(task.id(), null, error, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private static CredentialRestoreException findRestoreFailure(Throwable failure) {
        for (var current = failure; current != null; current = current.getCause()) {
            if (current instanceof CredentialRestoreException restore) {
                return restore;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return null;
    }

    private static String describe(Throwable failure) {
        var message = failure.getMessage();
        if (failure instanceof Error) {
            return message == null || message.isBlank()
                ? failure.getClass().getSimpleName()
                : failure.getClass().getSimpleName() + ": " + message;
        }
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            var thread = new Thread(runnable, "forge-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    public static final class Builder {
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private BackendExecutor executor = new ProcessBackendExecutor();
        private CredentialInjector injector;
        private CancellationToken cancellationToken = new CancellationToken();
        private Duration timeout;

        private Builder() {}

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder executor(BackendExecutor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        /**
         * Injector shared by every task; defaults to one bound to the graph's settings.
         */
        public Builder injector(CredentialInjector injector) {
            this.injector = injector;
            return this;
        }

        public Builder cancellationToken(CancellationToken token) {
            this.cancellationToken = Objects.requireNonNull(token, "token");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? null : timeout;
            return this;
        }

        public Scheduler build() {
            return new Scheduler(this);
        }
    }
}
