package work.lcod.forge.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.forge.graph.Task;
import work.lcod.forge.graph.TaskGraph;
import work.lcod.forge.graph.TaskStatus;
import work.lcod.forge.settings.Ecosystem;
import work.lcod.forge.settings.RegistryOptions;
import work.lcod.forge.settings.Secret;
import work.lcod.forge.settings.SettingsStore;
import work.lcod.forge.shared.ConfigurationException;

class SchedulerTest {
    private static final TaskRunner NOOP = context -> Map.of();

    @TempDir
    Path tempDir;

    @Test
    void randomGraphsRunDependenciesFirst() {
        var random = new Random(1234);
        for (int round = 0; round < 20; round++) {
            int size = 3 + random.nextInt(15);
            var graph = new TaskGraph(new SettingsStore(), tempDir);
            var sequence = new AtomicInteger();
            var started = new ConcurrentHashMap<String, Integer>();
            var finished = new ConcurrentHashMap<String, Integer>();
            var deps = new ArrayList<List<String>>();
            for (int i = 0; i < size; i++) {
                var list = new ArrayList<String>();
                for (int j = 0; j < i; j++) {
                    if (random.nextInt(3) == 0) {
                        list.add("t" + j);
                    }
                }
                deps.add(list);
                var id = "t" + i;
                int sleep = random.nextInt(5);
                graph.addTask(id, list, context -> {
                    started.put(id, sequence.incrementAndGet());
                    Thread.sleep(sleep);
                    finished.put(id, sequence.incrementAndGet());
                    return Map.of();
                });
            }

            var report = Scheduler.builder().parallelism(4).build().run(graph);

            assertTrue(report.succeeded());
            assertEquals(size, finished.size());
            for (int i = 0; i < size; i++) {
                for (var dep : deps.get(i)) {
                    assertTrue(finished.get(dep) < started.get("t" + i), dep + " finishes before t" + i + " starts");
                }
            }
        }
    }

    @Test
    void failureSkipsDependentsButNotIndependentTasks() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        graph.addTask("build", List.of(), context -> {
            throw new IllegalStateException("compile error");
        });
        graph.addTask("test", List.of("build"), NOOP);
        graph.addTask("publish", List.of("test"), NOOP);
        graph.addTask("docs", List.of(), NOOP);

        var report = Scheduler.builder().parallelism(2).build().run(graph);

        assertEquals(TaskStatus.FAILED, report.statusOf("build"));
        assertEquals(TaskStatus.SKIPPED, report.statusOf("test"));
        assertEquals(TaskStatus.SKIPPED, report.statusOf("publish"));
        assertEquals(TaskStatus.SUCCEEDED, report.statusOf("docs"));
        assertEquals(RunReport.Outcome.FAILURE, report.outcome());
        assertEquals(1, report.exitCode());
        assertEquals("compile error", report.failures().get(0).error());
        assertTrue(report.summaryLines().contains("Failed tasks: build"));
    }

    @Test
    void errorFromRunnerFailsOnlyThatTask() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        graph.addTask("boom", List.of(), context -> {
            throw new AssertionError("broken invariant");
        });
        graph.addTask("after", List.of("boom"), NOOP);
        graph.addTask("slow", List.of(), context -> {
            Thread.sleep(200);
            return Map.of();
        });
        graph.addTask("docs", List.of("slow"), NOOP);

        var report = Scheduler.builder().parallelism(2).build().run(graph);

        assertEquals(TaskStatus.FAILED, report.statusOf("boom"));
        assertEquals(TaskStatus.SKIPPED, report.statusOf("after"));
        assertEquals(TaskStatus.SUCCEEDED, report.statusOf("slow"));
        assertEquals(TaskStatus.SUCCEEDED, report.statusOf("docs"));
        assertEquals(RunReport.Outcome.FAILURE, report.outcome());
        assertEquals("AssertionError: broken invariant", report.task("boom").orElseThrow().error());
    }

    @Test
    void independentTasksRunConcurrently() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        var bothRunning = new CountDownLatch(2);
        TaskRunner rendezvous = context -> {
            bothRunning.countDown();
            if (!bothRunning.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("other task never started");
            }
            return Map.of();
        };
        graph.addTask("lint", List.of(), rendezvous);
        graph.addTask("test", List.of(), rendezvous);

        var report = Scheduler.builder().parallelism(2).build().run(graph);

        assertTrue(report.succeeded(), String.join("\n", report.summaryLines()));
    }

    @Test
    void tasksSharingAResourceNeverOverlap() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        var active = new AtomicInteger();
        var maxActive = new AtomicInteger();
        for (int i = 0; i < 5; i++) {
            graph.addTask(Task.builder("publish-" + i)
                .resource(Path.of(".cargo/config.toml"))
                .runner(context -> {
                    maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                    Thread.sleep(15);
                    active.decrementAndGet();
                    return Map.of();
                })
                .build());
        }
        graph.addTask(Task.builder("other").resource(Path.of("./.cargo/../.cargo/config.toml")).runner(context -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            Thread.sleep(15);
            active.decrementAndGet();
            return Map.of();
        }).build());

        var report = Scheduler.builder().parallelism(4).build().run(graph);

        assertTrue(report.succeeded());
        assertEquals(1, maxActive.get());
    }

    @Test
    void resultsFlowToDependents() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        graph.addTask("package", List.of(), context -> Map.of("chartFile", "build/helm/app-1.0.0.tgz"));
        var seen = new AtomicInteger();
        graph.addTask("push", List.of("package"), context -> {
            assertEquals("build/helm/app-1.0.0.tgz", context.resultOf("package").get("chartFile"));
            seen.incrementAndGet();
            return Map.of();
        });

        var report = Scheduler.builder().parallelism(1).build().run(graph);

        assertTrue(report.succeeded());
        assertEquals(1, seen.get());
        assertEquals("build/helm/app-1.0.0.tgz", report.task("package").orElseThrow().result().get("chartFile"));
    }

    @Test
    void goalsLimitTheRun() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        var ran = Collections.synchronizedList(new ArrayList<String>());
        for (var id : List.of("build", "test", "docs")) {
            graph.addTask(id, "test".equals(id) ? List.of("build") : List.of(), context -> {
                ran.add(id);
                return Map.of();
            });
        }

        var report = Scheduler.builder().build().run(graph, List.of("test"));

        assertEquals(List.of("build", "test"), ran);
        assertEquals(2, report.tasks().size());
        assertEquals(TaskStatus.PENDING, graph.task("docs").status());
    }

    @Test
    void upToDateTaskNeverRunsNorPatches() throws Exception {
        var settings = new SettingsStore();
        var registry = settings.addRegistry("private-repo", "https://example.jfrog.io/cargo/index",
            RegistryOptions.of(Ecosystem.CARGO).withPublishToken(Secret.of("tok")));
        var graph = new TaskGraph(settings, tempDir);
        var config = tempDir.resolve(".cargo/config.toml");
        var bodyRan = new AtomicBoolean();
        graph.addTask(Task.builder("sync")
            .resource(Path.of(".cargo/config.toml"))
            .upToDateWhen(context -> true)
            .runner(context -> context.injector().withInjectedAuth(config, registry, () -> {
                bodyRan.set(true);
                return Map.of();
            }))
            .build());
        graph.addTask("build", List.of("sync"), NOOP);

        var report = Scheduler.builder().parallelism(2).build().run(graph);

        assertTrue(report.succeeded());
        assertTrue(report.task("sync").orElseThrow().upToDate());
        assertEquals(TaskStatus.SUCCEEDED, report.statusOf("build"));
        assertFalse(bodyRan.get());
        assertFalse(Files.exists(config));
    }

    @Test
    void failingUpToDateCheckRunsTheTask() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        var ran = new AtomicBoolean();
        graph.addTask(Task.builder("build")
            .upToDateWhen(context -> {
                throw new IllegalStateException("cannot stat outputs");
            })
            .runner(context -> {
                ran.set(true);
                return Map.of();
            })
            .build());

        var report = Scheduler.builder().build().run(graph);

        assertTrue(ran.get());
        assertFalse(report.task("build").orElseThrow().upToDate());
    }

    @Test
    void cancellationStopsDispatchAndCancelsTheRest() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        var token = new CancellationToken();
        graph.addTask("first", List.of(), context -> {
            token.cancel("user requested");
            return Map.of();
        });
        graph.addTask("second", List.of("first"), NOOP);
        graph.addTask("third", List.of(), NOOP);

        var report = Scheduler.builder().parallelism(1).cancellationToken(token).build().run(graph);

        assertEquals(TaskStatus.SUCCEEDED, report.statusOf("first"));
        assertEquals(TaskStatus.CANCELLED, report.statusOf("second"));
        assertEquals(TaskStatus.CANCELLED, report.statusOf("third"));
        assertEquals(RunReport.Outcome.CANCELLED, report.outcome());
        assertEquals(3, report.exitCode());
        assertEquals("user requested", report.abortReason().orElseThrow());
    }

    @Test
    void taskObservingCancellationEndsCancelled() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        var token = new CancellationToken();
        graph.addTask("watch", List.of(), context -> {
            token.cancel();
            context.ensureNotCancelled();
            return Map.of();
        });

        var report = Scheduler.builder().cancellationToken(token).build().run(graph);

        assertEquals(TaskStatus.CANCELLED, report.statusOf("watch"));
        assertEquals(RunReport.Outcome.CANCELLED, report.outcome());
    }

    @Test
    void cancelAfterEveryTaskFinishedStillSucceeds() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        var token = new CancellationToken();
        graph.addTask("only", List.of(), context -> {
            token.cancel("too late");
            return Map.of();
        });

        var report = Scheduler.builder().cancellationToken(token).build().run(graph);

        assertEquals(TaskStatus.SUCCEEDED, report.statusOf("only"));
        assertEquals(RunReport.Outcome.SUCCESS, report.outcome());
        assertEquals(0, report.exitCode());
        assertTrue(report.abortReason().isEmpty());
    }

    @Test
    void timeoutLetsRunningTasksFinish() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        graph.addTask("slow", List.of(), context -> {
            Thread.sleep(300);
            return Map.of();
        });
        graph.addTask("after", List.of("slow"), NOOP);

        var report = Scheduler.builder().parallelism(1).timeout(Duration.ofMillis(50)).build().run(graph);

        assertEquals(TaskStatus.SUCCEEDED, report.statusOf("slow"));
        assertEquals(TaskStatus.CANCELLED, report.statusOf("after"));
        assertEquals(RunReport.Outcome.CANCELLED, report.outcome());
        assertTrue(report.abortReason().orElseThrow().startsWith("timed out"));
    }

    @Test
    void restoreFailureAbortsTheRun() throws Exception {
        var settings = new SettingsStore();
        var registry = settings.addRegistry("private-repo", "https://example.jfrog.io/cargo/index",
            RegistryOptions.of(Ecosystem.CARGO));
        var graph = new TaskGraph(settings, tempDir);
        var config = tempDir.resolve("config.toml");
        Files.writeString(config, "[net]\nretry = 1\n");
        graph.addTask(Task.builder("publish")
            .resource(config)
            .runner(context -> context.injector().withInjectedAuth(config, registry, () -> {
                Files.delete(config);
                Files.createDirectory(config);
                Files.writeString(config.resolve("blocker"), "x");
                return Map.<String, Object>of();
            }))
            .build());
        graph.addTask("notify", List.of("publish"), NOOP);
        graph.addTask("docs", List.of(), NOOP);

        var error = assertThrows(RunAbortedException.class, () -> Scheduler.builder().parallelism(1).build().run(graph));

        assertEquals("run_aborted", error.code());
        var report = error.report();
        assertEquals(RunReport.Outcome.ABORTED, report.outcome());
        assertEquals(2, report.exitCode());
        assertEquals(TaskStatus.FAILED, report.statusOf("publish"));
        assertEquals(TaskStatus.SKIPPED, report.statusOf("notify"));
        assertEquals(TaskStatus.CANCELLED, report.statusOf("docs"));
    }

    @Test
    void settingsAreFrozenOnceTheRunStarts() {
        var settings = new SettingsStore();
        var graph = new TaskGraph(settings, tempDir);
        graph.addTask("a", List.of(), context -> {
            context.settings().addAuth("late.example.com", "u", Secret.of("p"));
            return Map.of();
        });

        var report = Scheduler.builder().build().run(graph);

        assertTrue(settings.isFrozen());
        assertEquals(TaskStatus.FAILED, report.statusOf("a"));
        assertThrows(ConfigurationException.class, () -> settings.addAuth("x.example.com", "u", Secret.of("p")));
    }

    @Test
    void aGraphRunsOnlyOnce() {
        var graph = new TaskGraph(new SettingsStore(), tempDir);
        graph.addTask("a", List.of(), NOOP);
        Scheduler.builder().build().run(graph);
        assertThrows(IllegalStateException.class, () -> Scheduler.builder().build().run(graph));
    }
}
