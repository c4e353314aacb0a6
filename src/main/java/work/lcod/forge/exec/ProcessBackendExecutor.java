package work.lcod.forge.exec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BackendExecutor} spawning operating-system processes. Each output stream is drained by
 * its own daemon thread so a full pipe never blocks the child; an interrupted caller destroys
 * the process.
 */
public final class ProcessBackendExecutor implements BackendExecutor {
    private static final Logger log = LoggerFactory.getLogger(ProcessBackendExecutor.class);
    private static final AtomicInteger DRAINER_IDS = new AtomicInteger();

    @Override
    public ProcessResult execute(Invocation command, Map<String, String> env, Path workingDir, String stdin)
        throws IOException, InterruptedException {
        var builder = new ProcessBuilder(command.command());
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        if (env != null && !env.isEmpty()) {
            builder.environment().putAll(env);
        }
        log.debug("$ {} (cwd: {})", command, workingDir);
        var process = builder.start();
        var stdout = new StreamDrainer(process.getInputStream(), "stdout");
        var stderr = new StreamDrainer(process.getErrorStream(), "stderr");
        try {
            try (var input = process.getOutputStream()) {
                if (stdin != null) {
                    input.write(stdin.getBytes(StandardCharsets.UTF_8));
                }
            }
            int exitCode = process.waitFor();
            return new ProcessResult(exitCode, stdout.await(command), stderr.await(command));
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            throw ex;
        }
    }

    private static final class StreamDrainer {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Thread thread;
        private volatile IOException failure;

        StreamDrainer(InputStream stream, String name) {
            thread = new Thread(() -> {
                try (stream) {
                    stream.transferTo(buffer);
                } catch (IOException ex) {
                    failure = ex;
                }
            }, "forge-drain-" + name + "-" + DRAINER_IDS.incrementAndGet());
            thread.setDaemon(true);
            thread.start();
        }

        String await(Invocation command) throws InterruptedException, IOException {
            thread.join();
            if (failure != null) {
                throw new IOException("Unable to read " + thread.getName() + " of " + command.program(), failure);
            }
            return buffer.toString(StandardCharsets.UTF_8);
        }
    }
}
