package work.lcod.forge.docker;

import java.util.Locale;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Closed set of image build strategies.
 */
public enum BuildBackend {
    NATIVE("native"),
    BUILDX("buildx"),
    KANIKO("kaniko");

    private final String id;

    BuildBackend(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public ImageBuilder create(ImageBuildEnvironment environment) {
        return switch (this) {
            case NATIVE -> new NativeImageBuilder(environment);
            case BUILDX -> new BuildxImageBuilder(environment);
            case KANIKO -> new KanikoImageBuilder(environment);
        };
    }

    public static BuildBackend from(String value) {
        if (value == null || value.isBlank()) {
            return NATIVE;
        }
        for (var backend : values()) {
            if (backend.id.equals(value.trim().toLowerCase(Locale.ROOT))) {
                return backend;
            }
        }
        throw new ConfigurationException("Unknown docker backend '" + value + "' (expected native, buildx or kaniko)");
    }
}
