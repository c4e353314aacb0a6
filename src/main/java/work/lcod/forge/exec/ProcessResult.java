package work.lcod.forge.exec;

/**
 * Exit code and captured streams of one backend invocation.
 */
public record ProcessResult(int exitCode, String stdout, String stderr) {
    public ProcessResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public static ProcessResult ok(String stdout) {
        return new ProcessResult(0, stdout, "");
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
