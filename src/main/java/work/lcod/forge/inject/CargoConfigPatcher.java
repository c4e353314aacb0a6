package work.lcod.forge.inject;

import java.util.List;

/**
 * Writes {@code [registries.<name>]} with the index URL and, when the registry has one, the
 * publish token into {@code .cargo/config.toml}.
 */
public final class CargoConfigPatcher implements ConfigPatcher {
    @Override
    public String patch(String existing, RegistryAuth auth) {
        var registry = auth.registry();
        var table = List.of("registries", registry.name());
        var document = TomlDocument.parse(existing).setString(table, "index", registry.url());
        if (registry.publishToken().isPresent()) {
            document.setString(table, "token", registry.publishToken().get().reveal());
        }
        return document.render();
    }
}
