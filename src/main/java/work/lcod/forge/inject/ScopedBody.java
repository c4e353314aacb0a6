package work.lcod.forge.inject;

/**
 * Work executed while a configuration file is patched.
 */
@FunctionalInterface
public interface ScopedBody<T> {
    T run() throws Exception;
}
