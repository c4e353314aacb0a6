package work.lcod.forge.docker;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import work.lcod.forge.exec.BackendExecutor;
import work.lcod.forge.inject.CredentialInjector;
import work.lcod.forge.settings.SettingsStore;

/**
 * Collaborators shared by the image builders.
 *
 * @param dockerConfigDirectory directory holding the {@code config.json} the docker CLI reads;
 *                              exported as {@code DOCKER_CONFIG} to every command
 */
public record ImageBuildEnvironment(
    BackendExecutor executor,
    CredentialInjector injector,
    SettingsStore settings,
    Path workingDirectory,
    Path dockerConfigDirectory
) {
    public static final String CONFIG_FILE = "config.json";

    public ImageBuildEnvironment {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(injector, "injector");
        Objects.requireNonNull(settings, "settings");
        workingDirectory = workingDirectory.toAbsolutePath().normalize();
        dockerConfigDirectory = dockerConfigDirectory.toAbsolutePath().normalize();
    }

    /**
     * {@code $DOCKER_CONFIG}, falling back to {@code ~/.docker}.
     */
    public static Path defaultDockerConfigDirectory(Map<String, String> env) {
        var configured = env.get("DOCKER_CONFIG");
        if (configured != null && !configured.isBlank()) {
            return Path.of(configured);
        }
        return Path.of(System.getProperty("user.home"), ".docker");
    }

    public Path configFile() {
        return dockerConfigDirectory.resolve(CONFIG_FILE);
    }

    public Map<String, String> baseEnv() {
        return Map.of("DOCKER_CONFIG", dockerConfigDirectory.toString());
    }
}
