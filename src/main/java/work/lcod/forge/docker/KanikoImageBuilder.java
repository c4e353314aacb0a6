package work.lcod.forge.docker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.exec.Invocation;
import work.lcod.forge.inject.DockerAuthConfigPatcher;
import work.lcod.forge.inject.RegistryAuth;
import work.lcod.forge.settings.Secret;
import work.lcod.forge.shared.ConfigurationException;

/**
 * Runs the Kaniko executor in a throwaway container. Registry auth and build secrets are written
 * inside the container by its entry script, so no host file is patched. The script travels as a
 * masked argument.
 */
final class KanikoImageBuilder extends CommandImageBuilder {
    private static final Logger log = LoggerFactory.getLogger(KanikoImageBuilder.class);
    private static final Pattern SHELL_SAFE = Pattern.compile("[\\w@%+=:,./-]+");

    static final String IMAGE = "gcr.io/kaniko-project/executor:debug";
    static final String CONTEXT = "/workspace";
    static final String SECRETS_DIR = "/run/secrets";
    static final String SNAPSHOT_MODE = "redo";

    KanikoImageBuilder(ImageBuildEnvironment environment) {
        super(environment);
    }

    @Override
    public BuildBackend backend() {
        return BuildBackend.KANIKO;
    }

    @Override
    public ImageBuildResult build(ImageBuildRequest request) throws Exception {
        requireSinglePlatform(request);
        var cacheRepo = request.cacheRepo();
        if (cacheRepo.isPresent() && cacheRepo.get().contains(":")) {
            throw new ConfigurationException("Kaniko --cache-repo cannot contain ':' (got " + cacheRepo.get() + ")");
        }
        boolean cache = request.cache();
        if (cache && !request.push() && cacheRepo.isEmpty()) {
            log.warn("Disabling the Kaniko cache: it needs push or a cache repository");
            cache = false;
        }
        var logs = new StringBuilder();
        var volumes = new ArrayList<String>();
        volumes.add(absolute(request.context()) + ":" + CONTEXT);

        String dockerfile = null;
        if (request.dockerfile().isPresent()) {
            var file = request.dockerfile().get().toAbsolutePath().normalize();
            var context = request.context().toAbsolutePath().normalize();
            if (file.startsWith(context)) {
                dockerfile = context.relativize(file).toString();
            } else {
                dockerfile = "/kaniko/Dockerfile";
                volumes.add(file + ":" + dockerfile);
            }
        }

        Path tempDir = null;
        var outputFile = request.imageOutputFile().orElse(null);
        if (request.load() && outputFile == null) {
            tempDir = Files.createTempDirectory("forge-kaniko");
            outputFile = tempDir.resolve("image.tgz");
        }
        String tarPath = null;
        if (outputFile != null) {
            if (request.tags().isEmpty()) {
                throw new ConfigurationException("at least one tag is required to export a Kaniko image tarball");
            }
            var absoluteOutput = outputFile.toAbsolutePath().normalize();
            volumes.add(absoluteOutput.getParent() + ":/kaniko/out");
            tarPath = "/kaniko/out/" + absoluteOutput.getFileName();
        }

        try {
            var script = renderScript(request, executorCommand(request, cache, dockerfile, tarPath));
            var dockerRun = Invocation.builder("docker").args("run", "--rm", "--entrypoint", "");
            volumes.forEach(volume -> dockerRun.args("-v", volume));
            dockerRun.args("-w", CONTEXT);
            request.platform().ifPresent(platform -> dockerRun.args("--platform", platform));
            dockerRun.args(IMAGE, "sh", "-c").secret(Secret.of(script));
            run(dockerRun.build(), environment.baseEnv(), logs);
            if (request.load()) {
                run(Invocation.of("docker", "load", "-i", outputFile.toAbsolutePath().toString()), environment.baseEnv(), logs);
            }
        } finally {
            deleteTemp(tempDir);
        }
        return result(request, request.push(), logs);
    }

    List<String> executorCommand(ImageBuildRequest request, boolean cache, String dockerfile, String tarPath) {
        var command = new ArrayList<String>();
        command.add("/kaniko/executor");
        request.buildArgs().forEach((key, value) -> {
            command.add("--build-arg");
            command.add(key + "=" + value);
        });
        request.cacheRepo().ifPresent(repo -> {
            command.add("--cache-repo");
            command.add(repo);
        });
        if (cache) {
            command.add("--cache=true");
        }
        for (var tag : request.tags()) {
            command.add("--destination");
            command.add(tag);
        }
        if (dockerfile != null) {
            command.add("--dockerfile");
            command.add(dockerfile);
        }
        if (!request.push()) {
            command.add("--no-push");
        }
        command.add("--snapshotMode");
        command.add(SNAPSHOT_MODE);
        if (request.squash()) {
            command.add("--single-snapshot");
        }
        command.add("--cache-copy-layers");
        request.target().ifPresent(target -> {
            command.add("--target");
            command.add(target);
        });
        if (tarPath != null) {
            command.add("--tarPath");
            command.add(tarPath);
        }
        command.add("--context");
        command.add(CONTEXT);
        return command;
    }

    /**
     * Entry script of the container: auth config, secret files, then the executor.
     */
    String renderScript(ImageBuildRequest request, List<String> executorCommand) {
        var patcher = new DockerAuthConfigPatcher();
        var config = "";
        for (var registry : authenticatedRegistries(request)) {
            config = patcher.patch(config, new RegistryAuth(registry, environment.settings().credentialsFor(registry)));
        }
        if (config.isEmpty()) {
            config = "{\n  \"auths\" : { }\n}\n";
        }
        var lines = new ArrayList<String>();
        lines.add("mkdir -p /kaniko/.docker");
        lines.add("cat << EOF > /kaniko/.docker/config.json");
        lines.add(config.strip());
        lines.add("EOF");
        if (!request.secrets().isEmpty()) {
            lines.add("mkdir -p " + quote(SECRETS_DIR));
            request.secrets().forEach((id, secret) ->
                lines.add("echo " + quote(secret.reveal()) + " > " + quote(SECRETS_DIR + "/" + id)));
        }
        lines.add(executorCommand.stream().map(KanikoImageBuilder::quote).collect(Collectors.joining(" ")));
        return String.join("\n", lines);
    }

    static String quote(String value) {
        if (!value.isEmpty() && SHELL_SAFE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    private static void deleteTemp(Path tempDir) throws IOException {
        if (tempDir == null) {
            return;
        }
        Files.deleteIfExists(tempDir.resolve("image.tgz"));
        Files.deleteIfExists(tempDir);
    }
}
