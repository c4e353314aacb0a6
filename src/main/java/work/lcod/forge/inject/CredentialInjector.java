package work.lcod.forge.inject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.settings.Registry;
import work.lcod.forge.settings.SettingsStore;

/**
 * Makes a configuration file carry a registry's credentials for exactly the span of one body
 * invocation and puts the previous bytes back (or removes the file again) on every exit path.
 *
 * <p>Each target file has a single writer at a time: scopes on the same path are serialized
 * by a per-path lock, and nested scopes from the same thread unwind in reverse order. Scopes
 * still open when the JVM shuts down are restored by a shutdown hook.
 */
public final class CredentialInjector {
    private static final Logger log = LoggerFactory.getLogger(CredentialInjector.class);
    private static final Map<CredentialPatch, Boolean> OPEN_PATCHES = new ConcurrentHashMap<>();

    static {
        Runtime.getRuntime().addShutdownHook(new Thread(CredentialInjector::restoreOpenPatches, "forge-credential-restore"));
    }

    private final SettingsStore settings;
    private final FileLocks locks = new FileLocks();

    public CredentialInjector(SettingsStore settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public <T> T withInjectedAuth(Path filePath, Registry registry, ScopedBody<T> body) throws Exception {
        return withInjectedAuth(filePath, registry, ConfigPatcher.forEcosystem(registry.ecosystem()), body);
    }

    public <T> T withInjectedAuth(Path filePath, Registry registry, ConfigPatcher patcher, ScopedBody<T> body) throws Exception {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(patcher, "patcher");
        var auth = new RegistryAuth(registry, settings.credentialsFor(registry));
        log.info("Injecting credentials of registry {} into {}", registry.name(), filePath);
        return withPatchedFile(filePath, existing -> patcher.patch(existing, auth), body);
    }

    /**
     * Injects several registries into one file within a single scope. Registries are merged in
     * iteration order; with none the body runs without touching the file.
     */
    public <T> T withInjectedAuth(Path filePath, Collection<Registry> registries, ScopedBody<T> body) throws Exception {
        if (registries.isEmpty()) {
            return body.run();
        }
        var auths = new ArrayList<RegistryAuth>();
        for (var registry : registries) {
            auths.add(new RegistryAuth(registry, settings.credentialsFor(registry)));
        }
        log.info("Injecting credentials of {} registries into {}", auths.size(), filePath);
        return withPatchedFile(filePath, existing -> {
            var text = existing;
            for (var auth : auths) {
                text = ConfigPatcher.forEcosystem(auth.registry().ecosystem()).patch(text, auth);
            }
            return text;
        }, body);
    }

    /**
     * Applies {@code transform} to the file content (empty when absent) for the duration of
     * {@code body}. A failed restore raises {@link CredentialRestoreException} with the body's
     * own failure, if any, attached as suppressed.
     */
    public <T> T withPatchedFile(Path filePath, UnaryOperator<String> transform, ScopedBody<T> body) throws Exception {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(body, "body");
        var target = FileLocks.normalize(filePath);
        var lock = locks.lockFor(target);
        lock.lockInterruptibly();
        try {
            var patch = CredentialPatch.capture(target);
            OPEN_PATCHES.put(patch, Boolean.TRUE);
            try {
                T result;
                try {
                    var existing = patch.original().map(bytes -> new String(bytes, StandardCharsets.UTF_8)).orElse("");
                    patch.write(transform.apply(existing).getBytes(StandardCharsets.UTF_8));
                    log.debug("Patched {} (existed: {})", target, patch.existed());
                    result = body.run();
                } catch (Throwable failure) {
                    restore(patch, failure);
                    throw failure;
                }
                restore(patch, null);
                return result;
            } finally {
                OPEN_PATCHES.remove(patch);
            }
        } finally {
            lock.unlock();
        }
    }

    private static void restore(CredentialPatch patch, Throwable bodyFailure) {
        // NIO channels close on interrupt; keep the flag away from the restore writes.
        boolean interrupted = Thread.interrupted();
        try {
            patch.restore();
            log.debug("Restored {}", patch.file());
        } catch (IOException | RuntimeException ex) {
            var error = new CredentialRestoreException(patch.file(), ex);
            if (bodyFailure != null) {
                error.addSuppressed(bodyFailure);
            }
            log.error("Credential restore failed for {}", patch.file(), ex);
            throw error;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void restoreOpenPatches() {
        for (var patch : OPEN_PATCHES.keySet()) {
            try {
                patch.restore();
                log.warn("Restored {} during shutdown", patch.file());
            } catch (IOException | RuntimeException ex) {
                log.error("Unable to restore {} during shutdown", patch.file(), ex);
            }
        }
    }
}
