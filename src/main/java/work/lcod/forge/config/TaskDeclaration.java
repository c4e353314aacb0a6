package work.lcod.forge.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.forge.graph.Task;

/**
 * A task as written in the build file: identity, wiring and the type-specific {@code with} block.
 */
public record TaskDeclaration(
    String id,
    String type,
    List<String> dependsOn,
    List<Path> outputs,
    String description,
    String group,
    Map<String, Object> with
) {
    public TaskDeclaration {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        with = with == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(with));
    }

    public static TaskDeclaration of(String id, String type, Map<String, Object> with, String... dependsOn) {
        return new TaskDeclaration(id, type, List.of(dependsOn), List.of(), null, null, with);
    }

    public TaskOptions options() {
        return new TaskOptions(id, with);
    }

    /**
     * Builder pre-filled with everything except the runner.
     */
    public Task.Builder taskBuilder() {
        var builder = Task.builder(id)
            .dependsOn(dependsOn)
            .description(description)
            .group(group);
        outputs.forEach(builder::output);
        return builder;
    }
}
