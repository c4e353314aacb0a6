package work.lcod.forge.python;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.forge.config.TaskDeclaration;
import work.lcod.forge.exec.ProcessResult;
import work.lcod.forge.graph.TaskStatus;
import work.lcod.forge.settings.SettingsStore;
import work.lcod.forge.support.RecordingExecutor;
import work.lcod.forge.support.TaskHarness;

class PythonLintTasksTest {
    @TempDir
    Path project;

    private RecordingExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new RecordingExecutor();
    }

    @Test
    void blackCheckCoversSourcesTestsAndExtraFiles() throws Exception {
        Files.createDirectories(project.resolve("tests"));

        var report = harness().run(TaskDeclaration.of("blackCheck", PythonLintTasks.BLACK,
            Map.of("check", true, "config", "pyproject.toml", "additionalFiles", List.of("setup.py"), "args", List.of("-q"))));

        assertEquals(TaskStatus.SUCCEEDED, report.statusOf("blackCheck"), String.join("\n", report.summaryLines()));
        assertEquals(List.of("black", "src", "tests", "setup.py", "--check", "--config", "pyproject.toml", "-q"),
            executor.only().args());
    }

    @Test
    void blackFormatsWithoutTestsDirectory() {
        harness().run(TaskDeclaration.of("blackFormat", PythonLintTasks.BLACK, Map.of("sources", List.of("pkg"))));

        assertEquals(List.of("black", "pkg"), executor.only().args());
    }

    @Test
    void isortUsesCheckOnlyAndSettingsFile() throws Exception {
        Files.createDirectories(project.resolve("test"));

        harness().run(TaskDeclaration.of("isortCheck", PythonLintTasks.ISORT,
            Map.of("check", true, "config", ".isort.cfg")));

        assertEquals(List.of("isort", "src", "test", "--check-only", "--settings-file", ".isort.cfg"), executor.only().args());
    }

    @Test
    void flake8FailsTheTaskOnFindings() {
        executor.respond(call -> new ProcessResult(1, "src/app.py:1:1: F401 unused import", ""));

        var report = harness().run(TaskDeclaration.of("flake8", PythonLintTasks.FLAKE8,
            Map.of("testsDir", "checks", "additionalFiles", List.of("ignored.py"), "config", ".flake8")));

        assertEquals(TaskStatus.FAILED, report.statusOf("flake8"));
        assertEquals(List.of("flake8", "src", "checks", "--config", ".flake8"), executor.only().args());
    }

    @Test
    void checkAndFormatVariantsLandInDifferentGroups() {
        var settings = new SettingsStore();
        var check = PythonLintTasks.black(TaskDeclaration.of("blackCheck", PythonLintTasks.BLACK, Map.of("check", true)), settings);
        var format = PythonLintTasks.isort(TaskDeclaration.of("isortFormat", PythonLintTasks.ISORT, Map.of()), settings);
        var lint = PythonLintTasks.flake8(TaskDeclaration.of("flake8", PythonLintTasks.FLAKE8, Map.of()), settings);

        assertEquals(Optional.of("check"), check.group());
        assertEquals(Optional.of("fmt"), format.group());
        assertEquals(Optional.of("check"), lint.group());
    }

    private TaskHarness harness() {
        return new TaskHarness(project, new SettingsStore(), executor);
    }
}
