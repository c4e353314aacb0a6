package work.lcod.forge.inject;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recorded state of a configuration file taken right before a scoped write: its bytes (or
 * absence), its POSIX permissions and the directories created to hold the patched file.
 * Owned by the single injector scope that captured it.
 */
public final class CredentialPatch {
    private final Path file;
    private final byte[] original;
    private final Set<PosixFilePermission> permissions;
    private final List<Path> createdDirectories = new ArrayList<>();
    private boolean written;

    private CredentialPatch(Path file, byte[] original, Set<PosixFilePermission> permissions) {
        this.file = file;
        this.original = original;
        this.permissions = permissions;
    }

    static CredentialPatch capture(Path file) throws IOException {
        if (!Files.exists(file)) {
            return new CredentialPatch(file, null, null);
        }
        if (!Files.isRegularFile(file)) {
            throw new IOException("Not a regular file: " + file);
        }
        var view = Files.getFileAttributeView(file, PosixFileAttributeView.class);
        Set<PosixFilePermission> permissions = view == null ? null : view.readAttributes().permissions();
        return new CredentialPatch(file, Files.readAllBytes(file), permissions);
    }

    public Path file() {
        return file;
    }

    public boolean existed() {
        return original != null;
    }

    public Optional<byte[]> original() {
        return original == null ? Optional.empty() : Optional.of(original.clone());
    }

    void write(byte[] content) throws IOException {
        var parent = file.getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            var missing = new ArrayList<Path>();
            for (var dir = parent; dir != null && !Files.exists(dir); dir = dir.getParent()) {
                missing.add(0, dir);
            }
            for (var dir : missing) {
                Files.createDirectory(dir);
                createdDirectories.add(dir);
            }
        }
        written = true;
        replaceContent(content);
    }

    void restore() throws IOException {
        if (!written) {
            return;
        }
        if (original == null) {
            Files.deleteIfExists(file);
            for (int i = createdDirectories.size() - 1; i >= 0; i--) {
                var dir = createdDirectories.get(i);
                try (var entries = Files.list(dir)) {
                    if (entries.findAny().isPresent()) {
                        break;
                    }
                }
                Files.delete(dir);
            }
            return;
        }
        replaceContent(original);
        if (permissions != null) {
            Files.setPosixFilePermissions(file, permissions);
        }
    }

    /**
     * Temp file in the same directory (owner-only on POSIX), then an atomic rename over the target.
     */
    private void replaceContent(byte[] content) throws IOException {
        var directory = file.toAbsolutePath().getParent();
        var temp = Files.createTempFile(directory, "." + file.getFileName() + ".", ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public String toString() {
        return "CredentialPatch[" + file + (original == null ? ", absent" : ", " + original.length + " bytes") + "]";
    }
}
