package work.lcod.forge.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lcod.forge.runtime.RunReport;

/**
 * Outcome of a {@link BuildRunner} execution (usable by the CLI and embedding apps).
 */
public record RunResult(Status status, Optional<RunReport> report, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult of(RunReport report, Map<String, Object> metadata, Instant startedAt) {
        var status = switch (report.outcome()) {
            case SUCCESS -> Status.SUCCESS;
            case FAILURE -> Status.FAILURE;
            case ABORTED -> Status.ABORTED;
            case CANCELLED -> Status.CANCELLED;
        };
        return new RunResult(status, Optional.of(report), metadata, startedAt, Instant.now());
    }

    public static RunResult aborted(RunReport report, String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new RunResult(Status.ABORTED, Optional.of(report), meta, startedAt, Instant.now());
    }

    /**
     * The build could not start: invalid build file, unknown goal, cycle...
     */
    public static RunResult invalid(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new RunResult(Status.INVALID, Optional.empty(), meta, startedAt, Instant.now());
    }

    public int exitCode() {
        return status.exitCode();
    }

    public List<String> summaryLines() {
        return report.map(RunReport::summaryLines).orElseGet(() -> List.of(String.valueOf(metadata.get("error"))));
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("exitCode", exitCode());
        serializable.put("metadata", metadata);
        report.ifPresent(value -> serializable.put("report", value.toSerializableMap()));
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1),
        ABORTED(2),
        CANCELLED(3),
        INVALID(4);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
