package work.lcod.forge.docker;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.exec.Invocation;
import work.lcod.forge.exec.ProcessResult;
import work.lcod.forge.settings.Registry;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Shared plumbing of the builders that drive the docker CLI.
 */
abstract class CommandImageBuilder implements ImageBuilder {
    private static final Logger log = LoggerFactory.getLogger(CommandImageBuilder.class);

    protected final ImageBuildEnvironment environment;

    CommandImageBuilder(ImageBuildEnvironment environment) {
        this.environment = environment;
    }

    /**
     * Runs one command, appending its output to {@code logs}; a nonzero exit becomes a {@link BuildException}.
     */
    protected ProcessResult run(Invocation command, Map<String, String> env, StringBuilder logs) throws Exception {
        log.info("[{}] $ {}", backend().id(), command);
        logs.append("$ ").append(command).append('\n');
        var result = environment.executor().execute(command, env, environment.workingDirectory());
        logs.append(result.stdout());
        logs.append(result.stderr());
        if (!result.succeeded()) {
            var stderr = result.stderr().strip();
            throw new BuildException(backend(), describe(command) + " exited with code " + result.exitCode()
                + (stderr.isEmpty() ? "" : ": " + stderr), result.exitCode());
        }
        return result;
    }

    /**
     * Registries of the request that have credentials; others are used anonymously.
     */
    protected List<Registry> authenticatedRegistries(ImageBuildRequest request) {
        var registries = new ArrayList<Registry>();
        for (var registry : request.registries()) {
            if (environment.settings().credentialsFor(registry).isPresent()) {
                registries.add(registry);
            } else {
                log.debug("No credentials for registry {}, using it anonymously", registry.name());
            }
        }
        return registries;
    }

    protected void requireSinglePlatform(ImageBuildRequest request) {
        if (request.platforms().size() > 1) {
            throw new ConfigurationException(backend().id() + " backend builds a single platform, got " + request.platforms());
        }
    }

    protected void requireTagsForPush(ImageBuildRequest request) {
        if (request.push() && request.tags().isEmpty()) {
            throw new ConfigurationException("at least one tag is required to push an image");
        }
    }

    protected static String absolute(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    protected static ImageBuildResult result(ImageBuildRequest request, boolean pushed, StringBuilder logs) {
        var imageRef = request.tags().stream().findFirst();
        return new ImageBuildResult(imageRef, request.tags(), pushed, logs.toString());
    }

    private static String describe(Invocation command) {
        var masked = command.masked();
        return masked.size() > 1 ? masked.get(0) + " " + masked.get(1) : masked.get(0);
    }
}
