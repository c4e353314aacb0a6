package work.lcod.forge.inject;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tomlj.Toml;
import work.lcod.forge.settings.Ecosystem;
import work.lcod.forge.settings.Registry;
import work.lcod.forge.settings.RegistryOptions;
import work.lcod.forge.settings.Secret;
import work.lcod.forge.settings.SettingsStore;

class CredentialInjectorTest {
    @TempDir
    Path tempDir;

    private SettingsStore settings;
    private Registry registry;
    private CredentialInjector injector;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        settings = new SettingsStore();
        settings.addAuth("example.jfrog.io", "ci", Secret.of("pw"));
        registry = settings.addRegistry("private-repo", "https://example.jfrog.io/artifactory/api/cargo/private/index",
            RegistryOptions.of(Ecosystem.CARGO).withPublishToken(Secret.of("publish-token")));
        injector = new CredentialInjector(settings);
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void absentFileExistsOnlyInsideTheScope() throws Exception {
        var config = tempDir.resolve("project/.cargo/config.toml");

        String seen = injector.withInjectedAuth(config, registry, () -> Files.readString(config));

        var toml = Toml.parse(seen);
        assertEquals("publish-token", toml.getString(List.of("registries", "private-repo", "token")));
        assertFalse(Files.exists(config));
        assertFalse(Files.exists(tempDir.resolve("project")), "directories created for the patch are removed");
    }

    @Test
    void presentFileIsRestoredByteForByte() throws Exception {
        var config = tempDir.resolve("config.toml");
        var original = "# keep me\r\n[net]\r\nretry = 3\r\n".getBytes(StandardCharsets.UTF_8);
        Files.write(config, original);

        var result = injector.withInjectedAuth(config, registry, () -> {
            var text = Files.readString(config);
            assertTrue(text.contains("[registries.private-repo]"));
            assertTrue(text.startsWith("# keep me\r\n"));
            return "done";
        });

        assertEquals("done", result);
        assertArrayEquals(original, Files.readAllBytes(config));
    }

    @Test
    void throwingBodyStillRestores() throws Exception {
        var config = tempDir.resolve("config.toml");
        Files.writeString(config, "[net]\nretry = 3\n");
        var failure = new IllegalStateException("boom");

        var thrown = assertThrows(IllegalStateException.class,
            () -> injector.withInjectedAuth(config, registry, () -> {
                throw failure;
            }));

        assertSame(failure, thrown);
        assertEquals("[net]\nretry = 3\n", Files.readString(config));
    }

    @Test
    void interruptedBodyStillRestoresAndKeepsInterruptFlag() throws Exception {
        var config = tempDir.resolve("config.toml");
        var inside = new CountDownLatch(1);
        var flagAfter = new AtomicReference<Boolean>();

        Future<?> future = pool.submit(() -> {
            try {
                injector.withInjectedAuth(config, registry, () -> {
                    inside.countDown();
                    Thread.sleep(TimeUnit.SECONDS.toMillis(30));
                    return null;
                });
            } catch (InterruptedException ex) {
                flagAfter.set(Thread.currentThread().isInterrupted());
                return;
            } catch (Exception ex) {
                throw new AssertionError(ex);
            }
            throw new AssertionError("body was not interrupted");
        });
        assertTrue(inside.await(10, TimeUnit.SECONDS));
        assertTrue(Files.exists(config));
        future.cancel(true);

        waitUntil(() -> flagAfter.get() != null);
        assertFalse(Files.exists(config));
    }

    @Test
    void bodyThatSetsInterruptFlagDoesNotBreakRestore() throws Exception {
        var config = tempDir.resolve("config.toml");
        Files.writeString(config, "[net]\nretry = 1\n");

        Future<Boolean> future = pool.submit(() -> {
            injector.withInjectedAuth(config, registry, () -> {
                Thread.currentThread().interrupt();
                return null;
            });
            return Thread.interrupted();
        });

        assertTrue(future.get(10, TimeUnit.SECONDS));
        assertEquals("[net]\nretry = 1\n", Files.readString(config));
    }

    @Test
    void restoreFailureIsReportedWithBodyFailureSuppressed() throws Exception {
        var config = tempDir.resolve("config.toml");
        Files.writeString(config, "[net]\nretry = 1\n");

        var error = assertThrows(CredentialRestoreException.class, () -> injector.withInjectedAuth(config, registry, () -> {
            replaceWithNonEmptyDirectory(config);
            throw new IOException("body failed");
        }));

        assertEquals("credential_restore_failed", error.code());
        assertEquals(config.toAbsolutePath().normalize(), error.file());
        assertEquals(1, error.getSuppressed().length);
        assertEquals("body failed", error.getSuppressed()[0].getMessage());
    }

    @Test
    void restoreFailureAfterSuccessfulBody() throws Exception {
        var config = tempDir.resolve("absent.toml");

        var error = assertThrows(CredentialRestoreException.class, () -> injector.withInjectedAuth(config, registry, () -> {
            replaceWithNonEmptyDirectory(config);
            return null;
        }));

        assertInstanceOf(IOException.class, error.getCause());
    }

    @Test
    void scopesOnTheSameFileNeverOverlap() throws Exception {
        var config = tempDir.resolve("shared.toml");
        var active = new AtomicInteger();
        var maxActive = new AtomicInteger();
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<?>>();
        for (int i = 0; i < 6; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return injector.withInjectedAuth(config, registry, () -> {
                    maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                    Thread.sleep(20);
                    active.decrementAndGet();
                    return null;
                });
            }));
        }
        start.countDown();
        for (var future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        assertEquals(1, maxActive.get());
        assertFalse(Files.exists(config));
    }

    @Test
    void differentFilesCanBePatchedConcurrently() throws Exception {
        var both = new CountDownLatch(2);
        var futures = new ArrayList<Future<Boolean>>();
        for (var name : List.of("a.toml", "b.toml")) {
            var config = tempDir.resolve(name);
            futures.add(pool.submit(() -> injector.withInjectedAuth(config, registry, () -> {
                both.countDown();
                return both.await(10, TimeUnit.SECONDS);
            })));
        }
        for (var future : futures) {
            assertTrue(future.get(30, TimeUnit.SECONDS));
        }
    }

    @Test
    void emptyRegistryListLeavesFileAlone() throws Exception {
        var config = tempDir.resolve("config.toml");
        var seen = injector.withInjectedAuth(config, List.<Registry>of(), () -> Files.exists(config));
        assertFalse(seen);
    }

    @Test
    void severalRegistriesShareOneScope() throws Exception {
        var other = settings.addRegistry("mirror", "https://mirror.example.com/index", RegistryOptions.of(Ecosystem.CARGO));
        var config = tempDir.resolve("config.toml");

        String text = injector.withInjectedAuth(config, List.of(registry, other), () -> Files.readString(config));

        var toml = Toml.parse(text);
        assertEquals(other.url(), toml.getString(List.of("registries", "mirror", "index")));
        assertEquals(registry.url(), toml.getString(List.of("registries", "private-repo", "index")));
        assertFalse(Files.exists(config));
    }

    private static void replaceWithNonEmptyDirectory(Path path) throws IOException {
        Files.deleteIfExists(path);
        Files.createDirectory(path);
        Files.writeString(path.resolve("blocker"), "x");
    }

    private static void waitUntil(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met in time");
            }
            Thread.sleep(10);
        }
    }
}
