package work.lcod.forge.docker;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.forge.config.TaskDeclaration;
import work.lcod.forge.config.TaskTypeRegistry;
import work.lcod.forge.graph.Task;
import work.lcod.forge.runtime.TaskContext;
import work.lcod.forge.settings.SettingsStore;

/**
 * {@code docker.build}: builds an image with the configured {@link BuildBackend}.
 */
public final class DockerTasks {
    public static final String BUILD = "docker.build";

    private DockerTasks() {}

    public static TaskTypeRegistry register(TaskTypeRegistry registry) {
        return registry.register(BUILD, DockerTasks::build);
    }

    static Task build(TaskDeclaration declaration, SettingsStore settings) {
        var options = declaration.options();
        var backend = BuildBackend.from(options.string("backend", null));
        var context = options.path("context").orElse(Path.of("."));
        var request = ImageBuildRequest.builder(context)
            .tags(options.stringList("tags"))
            .push(options.bool("push", false))
            .load(options.bool("load", false))
            .cache(options.bool("cache", true))
            .cacheRepo(options.string("cacheRepo", null))
            .squash(options.bool("squash", false))
            .target(options.string("target", null));
        options.path("dockerfile").ifPresent(request::dockerfile);
        options.path("imageOutputFile").ifPresent(request::imageOutputFile);
        options.stringMap("buildArgs").forEach(request::buildArg);
        options.secretMap("secrets").forEach(request::secret);
        options.stringList("platforms").forEach(request::platform);
        options.stringList("registries").forEach(name -> request.registry(settings.resolve(name)));

        var configDirectory = options.path("dockerConfig")
            .orElseGet(() -> ImageBuildEnvironment.defaultDockerConfigDirectory(System.getenv()));
        var builder = declaration.taskBuilder().backend(backend.id());
        if (backend != BuildBackend.KANIKO) {
            builder.resource(configDirectory.resolve(ImageBuildEnvironment.CONFIG_FILE));
        }
        options.path("imageOutputFile").ifPresent(builder::output);
        return builder.runner(ctx -> runBuild(ctx, backend, configDirectory, resolve(ctx, request.build()))).build();
    }

    static Map<String, Object> runBuild(TaskContext context, BuildBackend backend, Path configDirectory, ImageBuildRequest request)
        throws Exception {
        var environment = new ImageBuildEnvironment(
            context.executor(),
            context.injector(),
            context.settings(),
            context.projectDirectory(),
            context.resolve(configDirectory)
        );
        context.ensureNotCancelled();
        var result = backend.create(environment).build(request);
        context.println(result.logs());
        Map<String, Object> output = new LinkedHashMap<>();
        result.imageRef().ifPresent(ref -> output.put("imageRef", ref));
        output.put("tags", result.tags());
        output.put("pushed", result.pushed());
        return output;
    }

    private static ImageBuildRequest resolve(TaskContext context, ImageBuildRequest request) {
        return new ImageBuildRequest(
            context.resolve(request.context()),
            request.dockerfile().map(context::resolve),
            request.tags(),
            request.buildArgs(),
            request.secrets(),
            request.platforms(),
            request.registries(),
            request.push(),
            request.load(),
            request.cache(),
            request.cacheRepo(),
            request.squash(),
            request.target(),
            request.imageOutputFile().map(context::resolve)
        );
    }
}
