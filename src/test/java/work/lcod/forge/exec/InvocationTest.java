package work.lcod.forge.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.forge.settings.Secret;

class InvocationTest {
    @Test
    void secretsAreMaskedWhenPrinted() {
        var invocation = Invocation.builder("twine")
            .arg("upload")
            .option("--password", null)
            .arg("--token")
            .secret(Secret.of("pypi-abc"))
            .build();

        assertEquals(List.of("twine", "upload", "--token", "pypi-abc"), invocation.command());
        assertEquals("twine upload --token [MASKED]", invocation.toString());
        assertFalse(invocation.toString().contains("pypi-abc"));
        assertTrue(invocation.hasSecrets());
    }

    @Test
    void conditionalArguments() {
        var invocation = Invocation.builder("cargo")
            .arg("build")
            .argIf(true, "--release")
            .argIf(false, "--offline")
            .args(List.of("--locked"))
            .build();

        assertEquals(Invocation.of("cargo", "build", "--release", "--locked"), invocation);
        assertFalse(invocation.hasSecrets());
    }
}
