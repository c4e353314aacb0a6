package work.lcod.forge.docker;

/**
 * Builds (and optionally pushes or loads) one container image. Every variant accepts the same
 * {@link ImageBuildRequest}; they differ in how secrets and registry credentials reach the build.
 */
public interface ImageBuilder {
    BuildBackend backend();

    /**
     * @throws BuildException when a backend command fails
     * @throws work.lcod.forge.shared.ConfigurationException when the request asks for something
     *     this backend cannot do
     */
    ImageBuildResult build(ImageBuildRequest request) throws Exception;
}
