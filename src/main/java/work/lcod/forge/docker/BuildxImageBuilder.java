package work.lcod.forge.docker;

import java.util.HashMap;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.forge.exec.Invocation;

/**
 * {@code docker buildx build}: multi-platform output, registry cache export and secrets passed
 * through the environment ({@code --secret id=<name>} reads the variable of the same name).
 */
final class BuildxImageBuilder extends CommandImageBuilder {
    private static final Logger log = LoggerFactory.getLogger(BuildxImageBuilder.class);
    private static final Pattern DOCKER_DRIVER = Pattern.compile("Driver:\\s*docker\\R");

    BuildxImageBuilder(ImageBuildEnvironment environment) {
        super(environment);
    }

    @Override
    public BuildBackend backend() {
        return BuildBackend.BUILDX;
    }

    @Override
    public ImageBuildResult build(ImageBuildRequest request) throws Exception {
        requireTagsForPush(request);
        var logs = new StringBuilder();
        var env = new HashMap<>(environment.baseEnv());
        return environment.injector().withInjectedAuth(environment.configFile(), authenticatedRegistries(request), () -> {
            if (request.cacheRepo().isPresent()) {
                var inspect = run(Invocation.of("docker", "buildx", "inspect"), env, logs);
                if (DOCKER_DRIVER.matcher(inspect.stdout()).find()) {
                    log.info("Creating a buildx builder: the docker driver cannot export a registry cache");
                    run(Invocation.of("docker", "buildx", "create", "--use"), env, logs);
                }
            }
            var buildEnv = new HashMap<>(env);
            request.secrets().forEach((id, secret) -> buildEnv.put(id, secret.reveal()));
            run(buildCommand(request), buildEnv, logs);
            return result(request, request.push(), logs);
        });
    }

    Invocation buildCommand(ImageBuildRequest request) {
        // buildx keeps the result in its cache unless told to push or load it
        boolean load = request.load() || !request.push();
        var command = Invocation.builder("docker").args("buildx", "build", absolute(request.context()));
        request.dockerfile().ifPresent(dockerfile -> command.args("-f", absolute(dockerfile)));
        request.platform().ifPresent(platform -> command.args("--platform", platform));
        request.buildArgs().forEach((key, value) -> command.args("--build-arg", key + "=" + value));
        request.secrets().keySet().forEach(id -> command.args("--secret", "id=" + id));
        request.cacheRepo().ifPresent(repo -> command.args("--cache-to", "type=registry,ref=" + repo));
        command.argIf(!request.cache(), "--no-cache");
        request.tags().forEach(tag -> command.args("--tag", tag));
        command.argIf(request.push(), "--push");
        command.argIf(request.squash(), "--squash");
        request.target().ifPresent(target -> command.args("--target", target));
        request.imageOutputFile().ifPresent(file -> command.args("--output", "type=tar,dest=" + absolute(file)));
        command.argIf(load, "--load");
        return command.build();
    }
}
