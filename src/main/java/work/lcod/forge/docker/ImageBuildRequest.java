package work.lcod.forge.docker;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.forge.settings.Registry;
import work.lcod.forge.settings.Secret;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Backend-neutral description of an image build. {@code registries} are the registries the build
 * pulls from or pushes to and must authenticate against.
 */
public record ImageBuildRequest(
    Path context,
    Optional<Path> dockerfile,
    List<String> tags,
    Map<String, String> buildArgs,
    Map<String, Secret> secrets,
    List<String> platforms,
    List<Registry> registries,
    boolean push,
    boolean load,
    boolean cache,
    Optional<String> cacheRepo,
    boolean squash,
    Optional<String> target,
    Optional<Path> imageOutputFile
) {
    // secret ids become file names under the backend's private secrets directory
    private static final Pattern SECRET_ID = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_.-]*");

    public ImageBuildRequest {
        Objects.requireNonNull(context, "context");
        for (var id : secrets.keySet()) {
            if (id == null || !SECRET_ID.matcher(id).matches()) {
                throw new ConfigurationException("Invalid secret id '" + id + "': use letters, digits, '_', '.' or '-'");
            }
        }
        tags = List.copyOf(tags);
        buildArgs = Collections.unmodifiableMap(new LinkedHashMap<>(buildArgs));
        secrets = Collections.unmodifiableMap(new LinkedHashMap<>(secrets));
        platforms = List.copyOf(platforms);
        registries = List.copyOf(registries);
    }

    public static Builder builder(Path context) {
        return new Builder(context);
    }

    public Optional<String> platform() {
        return platforms.isEmpty() ? Optional.empty() : Optional.of(String.join(",", platforms));
    }

    public static final class Builder {
        private final Path context;
        private Path dockerfile;
        private final List<String> tags = new ArrayList<>();
        private final Map<String, String> buildArgs = new LinkedHashMap<>();
        private final Map<String, Secret> secrets = new LinkedHashMap<>();
        private final List<String> platforms = new ArrayList<>();
        private final List<Registry> registries = new ArrayList<>();
        private boolean push;
        private boolean load;
        private boolean cache = true;
        private String cacheRepo;
        private boolean squash;
        private String target;
        private Path imageOutputFile;

        private Builder(Path context) {
            this.context = context;
        }

        public Builder dockerfile(Path dockerfile) {
            this.dockerfile = dockerfile;
            return this;
        }

        public Builder tag(String tag) {
            tags.add(tag);
            return this;
        }

        public Builder tags(List<String> values) {
            tags.addAll(values);
            return this;
        }

        public Builder buildArg(String key, String value) {
            buildArgs.put(key, value);
            return this;
        }

        public Builder secret(String id, Secret secret) {
            secrets.put(id, secret);
            return this;
        }

        public Builder platform(String platform) {
            platforms.add(platform);
            return this;
        }

        public Builder registry(Registry registry) {
            registries.add(registry);
            return this;
        }

        public Builder push(boolean push) {
            this.push = push;
            return this;
        }

        public Builder load(boolean load) {
            this.load = load;
            return this;
        }

        public Builder cache(boolean cache) {
            this.cache = cache;
            return this;
        }

        public Builder cacheRepo(String cacheRepo) {
            this.cacheRepo = cacheRepo;
            return this;
        }

        public Builder squash(boolean squash) {
            this.squash = squash;
            return this;
        }

        public Builder target(String target) {
            this.target = target;
            return this;
        }

        public Builder imageOutputFile(Path imageOutputFile) {
            this.imageOutputFile = imageOutputFile;
            return this;
        }

        public ImageBuildRequest build() {
            return new ImageBuildRequest(
                context,
                Optional.ofNullable(dockerfile),
                tags,
                buildArgs,
                secrets,
                platforms,
                registries,
                push,
                load,
                cache,
                Optional.ofNullable(cacheRepo).filter(value -> !value.isBlank()),
                squash,
                Optional.ofNullable(target).filter(value -> !value.isBlank()),
                Optional.ofNullable(imageOutputFile)
            );
        }
    }
}
