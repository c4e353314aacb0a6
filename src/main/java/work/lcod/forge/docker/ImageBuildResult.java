package work.lcod.forge.docker;

import java.util.List;
import java.util.Optional;

/**
 * @param imageRef first tag of the image, absent for an untagged build
 * @param logs     combined output of every command the backend ran, secrets masked
 */
public record ImageBuildResult(Optional<String> imageRef, List<String> tags, boolean pushed, String logs) {
    public ImageBuildResult {
        tags = List.copyOf(tags);
        logs = logs == null ? "" : logs;
    }
}
