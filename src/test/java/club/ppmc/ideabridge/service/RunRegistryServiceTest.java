package club.ppmc.ideabridge.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.ideabridge.core.CompletionBridge;
import club.ppmc.ideabridge.host.local.ExecutorApplicationDispatcher;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import club.ppmc.ideabridge.model.RunCategory;
import club.ppmc.ideabridge.model.RunOutputResult;
import club.ppmc.ideabridge.model.RunStartResult;
import club.ppmc.ideabridge.model.RunStopResult;
import club.ppmc.ideabridge.model.RunSummary;
import club.ppmc.ideabridge.support.FakeExecutionHost;
import club.ppmc.ideabridge.support.FakeProcess;
import club.ppmc.ideabridge.support.FakeProjectLocator;
import club.ppmc.ideabridge.support.TestProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RunRegistryServiceTest {

    private final ExecutorApplicationDispatcher dispatcher = new ExecutorApplicationDispatcher();
    private final FakeExecutionHost executionHost = new FakeExecutionHost()
            .withConfiguration("App", "java", "-jar", "app.jar")
            .withConfiguration("Worker", "java", "-cp", "classes", "Worker");

    private RunRegistryService registry(FakeProjectLocator locator) {
        return new RunRegistryService(
                executionHost, locator, dispatcher, new CompletionBridge(dispatcher), TestProperties.fast());
    }

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    void startRegistersRunningProcessWithOpaqueId() {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));

        RunStartResult result = registry.start("App", null);

        assertThat(result.success()).isTrue();
        assertThat(result.runId()).isEqualTo("run-1");
        assertThat(result.projectName()).isEqualTo("demo");
        assertThat(registry.list().runs()).singleElement().satisfies(run -> {
            assertThat(run.running()).isTrue();
            assertThat(run.category()).isEqualTo(RunCategory.APPLICATION);
        });
    }

    @Test
    void unknownConfigurationListsAvailableNames() {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));

        RunStartResult result = registry.start("Missing", null);

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.CONFIGURATION_NOT_FOUND);
        assertThat(result.error().message()).contains("App").contains("Worker");
    }

    @Test
    void startWithoutProjectFails() {
        RunRegistryService registry = registry(FakeProjectLocator.empty());

        RunStartResult result = registry.start("App", null);

        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.NO_PROJECT_OPEN);
    }

    @Test
    void unknownProjectReferenceDoesNotFallBackToAnotherProject() {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));

        RunStartResult result = registry.start("App", "other");

        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.NO_PROJECT_OPEN);
        assertThat(executionHost.processes()).isEmpty();
    }

    @Test
    void launchFailureIsKeptAsTerminatedRun() {
        executionHost.failLaunchesWith("java: not found");
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));

        RunStartResult result = registry.start("App", null);

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.LAUNCH_FAILED);
        RunOutputResult output = registry.getOutput(result.runId(), false);
        assertThat(output.running()).isFalse();
        assertThat(output.output()).contains("java: not found");
        assertThat(registry.list().runs()).singleElement().extracting(RunSummary::failedToStart).isEqualTo(true);
    }

    @Test
    void unexpectedLaunchErrorIsKeptAsTerminatedRun() {
        executionHost.rejectLaunchesWith(new RejectedExecutionException("output readers shut down"));
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));

        RunStartResult result = registry.start("App", null);

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.LAUNCH_FAILED);
        assertThat(registry.hasActive(RunCategory.APPLICATION)).isFalse();
        assertThat(registry.getOutput(result.runId(), false).running()).isFalse();
    }

    @Test
    void concurrentStartsGetUniqueIncreasingIds() throws Exception {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));
        Set<String> ids = ConcurrentHashMap.newKeySet();
        var start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            threads.add(new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                ids.add(registry.start("Worker", null).runId());
            }));
        }
        threads.forEach(Thread::start);
        start.countDown();
        for (Thread thread : threads) {
            thread.join(5000);
        }

        assertThat(ids).hasSize(10);
        List<Long> sequences = registry.list().runs().stream()
                .map(run -> Long.parseLong(run.runId().substring("run-".length())))
                .toList();
        assertThat(sequences).isSorted().doesNotHaveDuplicates();
    }

    @Test
    void outputAndExitCodeComeFromProcessListener() {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));
        String runId = registry.start("App", null).runId();
        FakeProcess process = executionHost.lastProcess();

        process.emit("line 1\n").emit("line 2\n");
        process.exit(0);

        RunOutputResult output = registry.getOutput(runId, false);
        assertThat(output.output()).isEqualTo("line 1\nline 2\n");
        assertThat(output.running()).isFalse();
        assertThat(output.exitCode()).isZero();
    }

    @Test
    void clearingReadsNeverReturnTheSameOutputTwice() {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));
        String runId = registry.start("App", null).runId();
        FakeProcess process = executionHost.lastProcess();

        process.emit("first\n");
        String first = registry.getOutput(runId, true).output();
        process.emit("second\n");
        String second = registry.getOutput(runId, true).output();
        String third = registry.getOutput(runId, true).output();

        assertThat(first).isEqualTo("first\n");
        assertThat(second).isEqualTo("second\n");
        assertThat(third).isEmpty();
    }

    @Test
    void stopSendsSignalAndTerminationListenerSetsState() throws InterruptedException {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));
        String runId = registry.start("App", null).runId();
        FakeProcess process = executionHost.lastProcess();

        RunStopResult stopped = registry.stop(runId);
        waitUntil(() -> !registry.getOutput(runId, false).running());

        assertThat(stopped.success()).isTrue();
        assertThat(process.destroyRequested()).isTrue();
        assertThat(registry.getOutput(runId, false).exitCode()).isEqualTo(FakeProcess.DESTROYED_EXIT_CODE);
        assertThat(registry.stop(runId).message()).isEqualTo("运行已经结束。");
    }

    @Test
    void unknownRunIdIsNotFound() {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));

        assertThat(registry.getOutput("run-404", false).error().kind()).isEqualTo(BridgeErrorKind.RUN_NOT_FOUND);
        assertThat(registry.stop("run-404").error().kind()).isEqualTo(BridgeErrorKind.RUN_NOT_FOUND);
    }

    @Test
    void pruneRemovesOnlyTerminatedRuns() throws InterruptedException {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));
        String finished = registry.start("App", null).runId();
        executionHost.lastProcess().exit(0);
        String running = registry.start("Worker", null).runId();
        TimeUnit.MILLISECONDS.sleep(10);

        int removed = registry.prune(Duration.ZERO);

        assertThat(removed).isEqualTo(1);
        assertThat(registry.find(finished)).isEmpty();
        assertThat(registry.find(running)).isPresent();
    }

    @Test
    void pruneKeepsRecentTerminatedRuns() {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));
        registry.start("App", null);
        executionHost.lastProcess().exit(1);

        assertThat(registry.pruneExpired()).isZero();
        assertThat(registry.list().runs()).hasSize(1);
    }

    @Test
    void pruneWithHugeMaxAgeRemovesNothing() {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));
        registry.start("App", null);
        executionHost.lastProcess().exit(0);

        assertThat(registry.prune(Duration.ofSeconds(Long.MAX_VALUE))).isZero();
        assertThat(registry.list().runs()).hasSize(1);
    }

    @Test
    void hasActiveTracksCategory() {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));
        registry.start("App", null);

        assertThat(registry.hasActive(RunCategory.APPLICATION)).isTrue();
        assertThat(registry.hasActive(RunCategory.TEST)).isFalse();

        executionHost.lastProcess().exit(0);
        assertThat(registry.hasActive(RunCategory.APPLICATION)).isFalse();
    }

    @Test
    void resetDestroysLiveProcessesAndClearsRegistry() {
        RunRegistryService registry = registry(FakeProjectLocator.single("demo"));
        registry.start("App", null);
        FakeProcess process = executionHost.lastProcess();

        registry.reset();

        assertThat(process.destroyRequested()).isTrue();
        assertThat(registry.list().runs()).isEmpty();
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            TimeUnit.MILLISECONDS.sleep(5);
        }
    }
}
