package work.lcod.forge.inject;

import java.util.List;

/**
 * Writes {@code [http-basic.<name>]} (and {@code [pypi-token]} when a publish token exists)
 * into a project-local {@code poetry.toml}.
 */
public final class PoetryConfigPatcher implements ConfigPatcher {
    @Override
    public String patch(String existing, RegistryAuth auth) {
        var registry = auth.registry();
        var document = TomlDocument.parse(existing);
        if (auth.credentials().isPresent() || registry.publishToken().isEmpty()) {
            var credentials = auth.requireCredentials();
            var table = List.of("http-basic", registry.name());
            document.setString(table, "username", credentials.principal());
            document.setString(table, "password", credentials.secret().reveal());
        }
        if (registry.publishToken().isPresent()) {
            document.setString(List.of("pypi-token"), registry.name(), registry.publishToken().get().reveal());
        }
        return document.render();
    }
}
