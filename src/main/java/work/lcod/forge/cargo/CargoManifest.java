package work.lcod.forge.cargo;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.lcod.forge.inject.TomlDocument;
import work.lcod.forge.shared.ConfigurationException;

/**
 * The parts of {@code Cargo.toml} the cargo tasks read: package name and version and the
 * binary targets.
 */
public record CargoManifest(Optional<String> name, Optional<String> version, List<String> binaries) {
    public CargoManifest {
        binaries = List.copyOf(binaries);
    }

    public static CargoManifest read(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static CargoManifest parse(String text) {
        TomlParseResult toml = Toml.parse(text);
        if (toml.hasErrors()) {
            throw new ConfigurationException("Invalid Cargo.toml: " + toml.errors().get(0).toString());
        }
        var name = Optional.ofNullable(toml.getString("package.name"));
        var binaries = new ArrayList<String>();
        var bins = toml.getArray("bin");
        if (bins != null) {
            for (int i = 0; i < bins.size(); i++) {
                var bin = bins.getTable(i).getString("name");
                if (bin != null) {
                    binaries.add(bin);
                }
            }
        }
        return new CargoManifest(name, Optional.ofNullable(toml.getString("package.version")), binaries);
    }

    /**
     * Returns {@code text} with {@code package.version} set, everything else untouched.
     */
    public static String withVersion(String text, String version) {
        if (Toml.parse(text).getTable("package") == null) {
            throw new ConfigurationException("Cargo.toml has no [package] table");
        }
        return TomlDocument.parse(text).setString(List.of("package"), "version", version).render();
    }
}
