package work.lcod.forge.docker;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.HashMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.exec.Invocation;

/**
 * {@code docker build} followed by {@code docker push}. Build secrets are handed over as files in
 * a private temporary directory; registry credentials are injected into the docker config.
 */
final class NativeImageBuilder extends CommandImageBuilder {
    private static final Logger log = LoggerFactory.getLogger(NativeImageBuilder.class);

    NativeImageBuilder(ImageBuildEnvironment environment) {
        super(environment);
    }

    @Override
    public BuildBackend backend() {
        return BuildBackend.NATIVE;
    }

    @Override
    public ImageBuildResult build(ImageBuildRequest request) throws Exception {
        requireSinglePlatform(request);
        requireTagsForPush(request);
        if (request.squash()) {
            log.warn("squash is not supported by the native backend and is ignored");
        }
        var logs = new StringBuilder();
        var env = new HashMap<>(environment.baseEnv());
        env.put("DOCKER_BUILDKIT", "1");
        return environment.injector().withInjectedAuth(environment.configFile(), authenticatedRegistries(request), () -> {
            var secretsDir = request.secrets().isEmpty() ? null : createSecretsDirectory();
            try {
                run(buildCommand(request, secretsDir), env, logs);
            } finally {
                deleteRecursively(secretsDir);
            }
            if (request.push()) {
                for (var tag : request.tags()) {
                    run(Invocation.of("docker", "push", tag), env, logs);
                }
            }
            return result(request, request.push(), logs);
        });
    }

    Invocation buildCommand(ImageBuildRequest request, Path secretsDir) throws IOException {
        var command = Invocation.builder("docker").args("build", absolute(request.context()));
        request.dockerfile().ifPresent(dockerfile -> command.args("-f", absolute(dockerfile)));
        request.platform().ifPresent(platform -> command.args("--platform", platform));
        request.buildArgs().forEach((key, value) -> command.args("--build-arg", key + "=" + value));
        request.cacheRepo().ifPresent(repo -> command.args("--cache-from", "type=registry,ref=" + repo));
        command.argIf(!request.cache(), "--no-cache");
        request.tags().forEach(tag -> command.args("--tag", tag));
        request.target().ifPresent(target -> command.args("--target", target));
        request.imageOutputFile().ifPresent(file -> command.args("--output", "type=tar,dest=" + absolute(file)));
        for (var secret : request.secrets().entrySet()) {
            var file = secretsDir.resolve(secret.getKey());
            Files.write(file, secret.getValue().reveal().getBytes(StandardCharsets.UTF_8));
            command.args("--secret", "id=" + secret.getKey() + ",src=" + file);
        }
        return command.build();
    }

    private static Path createSecretsDirectory() throws IOException {
        try {
            return Files.createTempDirectory("forge-secrets", PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rwx------")));
        } catch (UnsupportedOperationException ex) {
            return Files.createTempDirectory("forge-secrets");
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            for (var path : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.deleteIfExists(path);
            }
        }
    }
}
