package work.lcod.forge.inject;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per normalized absolute path; the single-writer guard of the injector.
 */
final class FileLocks {
    private final Map<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    ReentrantLock lockFor(Path file) {
        return locks.computeIfAbsent(normalize(file), key -> new ReentrantLock());
    }

    static Path normalize(Path file) {
        return file.toAbsolutePath().normalize();
    }
}
