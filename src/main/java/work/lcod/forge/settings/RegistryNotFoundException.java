package work.lcod.forge.settings;

import work.lcod.forge.shared.ForgeException;

public final class RegistryNotFoundException extends ForgeException {
    private final String registryName;

    public RegistryNotFoundException(String registryName) {
        super("registry_not_found", "Registry not found: " + registryName);
        this.registryName = registryName;
    }

    public String registryName() {
        return registryName;
    }
}
