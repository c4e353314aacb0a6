package work.lcod.forge.runtime;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.forge.graph.TaskStatus;
import work.lcod.forge.shared.DurationParser;

/**
 * Final state of one task in a run.
 */
public record TaskReport(
    String taskId,
    TaskStatus status,
    Duration duration,
    boolean upToDate,
    String output,
    String error,
    Map<String, Object> result
) {
    public TaskReport {
        duration = duration == null ? Duration.ZERO : duration;
        output = output == null ? "" : output;
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
    }

    static TaskReport notRun(String taskId, TaskStatus status, String reason) {
        return new TaskReport(taskId, status, Duration.ZERO, false, "", reason, Map.of());
    }

    public String summaryLine() {
        var line = new StringBuilder()
            .append(String.format("%-9s %s", status, taskId));
        if (upToDate) {
            line.append(" (up-to-date)");
        } else if (status == TaskStatus.SUCCEEDED || status == TaskStatus.FAILED) {
            line.append(" [").append(DurationParser.format(duration)).append(']');
        }
        if (error != null && !error.isBlank()) {
            line.append(": ").append(error);
        }
        return line.toString();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", taskId);
        map.put("status", status.name().toLowerCase());
        map.put("durationMs", duration.toMillis());
        map.put("upToDate", upToDate);
        if (error != null) {
            map.put("error", error);
        }
        if (!result.isEmpty()) {
            map.put("result", result);
        }
        return map;
    }
}
