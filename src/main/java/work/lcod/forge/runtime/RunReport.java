package work.lcod.forge.runtime;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import work.lcod.forge.graph.TaskStatus;

/**
 * Outcome of a scheduler run: one {@link TaskReport} per selected task, in graph order.
 */
public final class RunReport {
    private final List<TaskReport> tasks;
    private final Outcome outcome;
    private final String abortReason;
    private final Instant startedAt;
    private final Instant finishedAt;

    RunReport(List<TaskReport> tasks, Outcome outcome, String abortReason, Instant startedAt, Instant finishedAt) {
        this.tasks = List.copyOf(tasks);
        this.outcome = outcome;
        this.abortReason = abortReason;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public List<TaskReport> tasks() {
        return tasks;
    }

    public Optional<TaskReport> task(String id) {
        return tasks.stream().filter(report -> report.taskId().equals(id)).findFirst();
    }

    public TaskStatus statusOf(String id) {
        return task(id).map(TaskReport::status)
            .orElseThrow(() -> new IllegalArgumentException("Task " + id + " was not part of this run"));
    }

    public List<TaskReport> failures() {
        return tasks.stream().filter(report -> report.status() == TaskStatus.FAILED).collect(Collectors.toList());
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean succeeded() {
        return outcome == Outcome.SUCCESS;
    }

    public Optional<String> abortReason() {
        return Optional.ofNullable(abortReason);
    }

    public int exitCode() {
        return outcome.exitCode();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public List<String> summaryLines() {
        var lines = new ArrayList<String>();
        for (var report : tasks) {
            lines.add(report.summaryLine());
        }
        var failures = failures();
        if (!failures.isEmpty()) {
            lines.add("Failed tasks: " + failures.stream().map(TaskReport::taskId).collect(Collectors.joining(", ")));
        }
        if (abortReason != null) {
            lines.add(outcome == Outcome.ABORTED ? "Run aborted: " + abortReason : "Run cancelled: " + abortReason);
        }
        return lines;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("outcome", outcome.name().toLowerCase());
        map.put("exitCode", exitCode());
        map.put("startedAt", startedAt.toString());
        map.put("finishedAt", finishedAt.toString());
        map.put("tasks", tasks.stream().map(TaskReport::toSerializableMap).collect(Collectors.toList()));
        map.put("failures", failures().stream().map(TaskReport::taskId).collect(Collectors.toList()));
        if (abortReason != null) {
            map.put("abortReason", abortReason);
        }
        return map;
    }

    public enum Outcome {
        SUCCESS(0),
        FAILURE(1),
        ABORTED(2),
        CANCELLED(3);

        private final int exitCode;

        Outcome(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
