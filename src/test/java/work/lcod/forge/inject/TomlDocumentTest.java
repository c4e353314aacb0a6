package work.lcod.forge.inject;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.forge.shared.ConfigurationException;

class TomlDocumentTest {
    @Test
    void appendsMissingTable() {
        var text = TomlDocument.parse("").setString(List.of("registries", "private-repo"), "index", "https://x/index").render();
        assertEquals("[registries.private-repo]\nindex = \"https://x/index\"\n", text);
    }

    @Test
    void replacesValueInPlaceAndKeepsComments() {
        var source = "# managed by hand\n"
            + "[build]\n"
            + "jobs = 4\n"
            + "\n"
            + "[registries.private-repo]\n"
            + "index = \"old\" # trailing\n"
            + "\n"
            + "[net]\n"
            + "retry = 2\n";
        var text = TomlDocument.parse(source).setString(List.of("registries", "private-repo"), "index", "new").render();

        assertEquals(source.replace("index = \"old\" # trailing", "index = \"new\""), text);
    }

    @Test
    void insertsNewKeyAtEndOfExistingSection() {
        var source = "[registries.private-repo]\nindex = \"i\"\n\n[net]\nretry = 2\n";
        var document = TomlDocument.parse(source).setString(List.of("registries", "private-repo"), "token", "t");

        assertEquals("[registries.private-repo]\nindex = \"i\"\ntoken = \"t\"\n\n[net]\nretry = 2\n", document.render());
        assertEquals("t", document.toToml().getString(List.of("registries", "private-repo", "token")));
        assertEquals(2L, document.toToml().getLong("net.retry"));
    }

    @Test
    void escapesValues() {
        var document = TomlDocument.parse("").setString(List.of("pypi-token"), "repo", "a\"b\\c");
        assertEquals("a\"b\\c", document.toToml().getString(List.of("pypi-token", "repo")));
    }

    @Test
    void rejectsInvalidInput() {
        assertThrows(ConfigurationException.class, () -> TomlDocument.parse("[broken"));
    }

    @Test
    void editsRootDottedKeysInPlace() {
        var source = "registries.private-repo.index = \"i\"\n";
        var document = TomlDocument.parse(source).setString(List.of("registries", "private-repo"), "index", "j");

        assertEquals("registries.private-repo.index = \"j\"\n", document.render());
    }

    @Test
    void extendsDottedKeysUnderParentSection() {
        var source = "[registries]\nprivate-repo.index = \"old\"\nother.index = \"o\"\n";
        var document = TomlDocument.parse(source)
            .setString(List.of("registries", "private-repo"), "index", "new")
            .setString(List.of("registries", "private-repo"), "token", "t");

        assertEquals("[registries]\nprivate-repo.index = \"new\"\nother.index = \"o\"\nprivate-repo.token = \"t\"\n",
            document.render());
        assertEquals("o", document.toToml().getString(List.of("registries", "other", "index")));
    }

    @Test
    void mergesIntoInlineTables() {
        var source = "[registries]\nprivate-repo = { index = \"old\" } # keep\n\n[net]\nretry = 2\n";
        var document = TomlDocument.parse(source)
            .setString(List.of("registries", "private-repo"), "index", "new")
            .setString(List.of("registries", "private-repo"), "token", "t");

        assertEquals("[registries]\nprivate-repo = { index = \"new\", token = \"t\" } # keep\n\n[net]\nretry = 2\n",
            document.render());
        assertEquals(2L, document.toToml().getLong("net.retry"));
    }

    @Test
    void inlineTableEditSkipsNestedValuesAndQuotedBraces() {
        var source = "[registries]\nprivate-repo = { index = \"a}b\", tags = [\"x\", \"y\"], meta = { level = 1 } }\n";
        var document = TomlDocument.parse(source).setString(List.of("registries", "private-repo"), "token", "t");

        var toml = document.toToml();
        assertEquals("a}b", toml.getString(List.of("registries", "private-repo", "index")));
        assertEquals("t", toml.getString(List.of("registries", "private-repo", "token")));
        assertEquals(1L, toml.getLong(List.of("registries", "private-repo", "meta", "level")));
        assertEquals(2, toml.getArray(List.of("registries", "private-repo", "tags")).size());
    }

    @Test
    void fillsEmptyInlineTable() {
        var document = TomlDocument.parse("[registries]\nprivate-repo = {}\n")
            .setString(List.of("registries", "private-repo"), "index", "i");

        assertEquals("[registries]\nprivate-repo = { index = \"i\" }\n", document.render());
    }
}
