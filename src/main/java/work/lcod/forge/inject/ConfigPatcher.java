package work.lcod.forge.inject;

import work.lcod.forge.settings.Ecosystem;

/**
 * Merges one registry's auth block into the text of an ecosystem-native configuration file.
 * Implementations must leave every unrelated section untouched.
 */
@FunctionalInterface
public interface ConfigPatcher {
    /**
     * @param existing current file content, empty when the file does not exist
     * @return the patched content
     */
    String patch(String existing, RegistryAuth auth);

    static ConfigPatcher forEcosystem(Ecosystem ecosystem) {
        return switch (ecosystem) {
            case CARGO -> new CargoConfigPatcher();
            case PYTHON -> new PoetryConfigPatcher();
            case DOCKER, HELM -> new DockerAuthConfigPatcher();
        };
    }
}
