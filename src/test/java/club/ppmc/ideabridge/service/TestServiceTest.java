package club.ppmc.ideabridge.service;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.ideabridge.config.BridgeProperties;
import club.ppmc.ideabridge.core.CompletionBridge;
import club.ppmc.ideabridge.core.OperationClass;
import club.ppmc.ideabridge.core.OperationLockRegistry;
import club.ppmc.ideabridge.core.ResultCache;
import club.ppmc.ideabridge.core.TestResultExtractor;
import club.ppmc.ideabridge.host.TestNode;
import club.ppmc.ideabridge.host.TestNode.State;
import club.ppmc.ideabridge.host.TestResultTreeSource;
import club.ppmc.ideabridge.host.local.ExecutorApplicationDispatcher;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import club.ppmc.ideabridge.model.RunCategory;
import club.ppmc.ideabridge.model.TestRequest;
import club.ppmc.ideabridge.model.TestRunResult;
import club.ppmc.ideabridge.model.TestStatus;
import club.ppmc.ideabridge.support.FakeExecutionHost;
import club.ppmc.ideabridge.support.FakeProjectLocator;
import club.ppmc.ideabridge.support.TestProperties;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TestServiceTest {

    private static final TestNode PASSING_TREE = TestNode.suite("demo", List.of(
            TestNode.suite("com.example.CalcTest", List.of(
                    TestNode.testCase("adds", State.PASSED, null, null, 2),
                    TestNode.testCase("subtracts", State.PASSED, null, null, 1)))));

    private final ExecutorApplicationDispatcher dispatcher = new ExecutorApplicationDispatcher();
    private final CompletionBridge bridge = new CompletionBridge(dispatcher);
    private final BridgeProperties properties = TestProperties.fast();
    private final FakeExecutionHost executionHost = new FakeExecutionHost();
    private final FakeProjectLocator projectLocator = FakeProjectLocator.single("demo");
    private final AtomicBoolean compiling = new AtomicBoolean();
    private final ResultCache resultCache = new ResultCache();
    private final RunRegistryService runRegistry =
            new RunRegistryService(executionHost, projectLocator, dispatcher, bridge, properties);
    private final OperationLockRegistry lockRegistry = new OperationLockRegistry(Map.of(
            OperationClass.BUILD, compiling::get,
            OperationClass.TEST, () -> runRegistry.hasActive(RunCategory.TEST)));
    private volatile Optional<TestNode> tree = Optional.empty();
    private final TestResultTreeSource treeSource = (project, since) -> tree;
    private final TestService testService = new TestService(
            executionHost,
            treeSource,
            projectLocator,
            runRegistry,
            lockRegistry,
            bridge,
            new TestResultExtractor(properties.extractionRetry()),
            resultCache,
            properties);

    @AfterEach
    void tearDown() {
        testService.shutdown();
        runRegistry.reset();
        dispatcher.shutdown();
    }

    @Test
    void returnsStructuredResultsAndCachesThem() {
        tree = Optional.of(PASSING_TREE);
        executionHost.onLaunch(process -> process.emit("Tests run: 2\n").exit(0));

        TestRunResult result = testService.runTests(new TestRequest("com.example.CalcTest", null, null));

        assertThat(result.success()).isTrue();
        assertThat(result.passed()).isEqualTo(2);
        assertThat(result.runId()).isEqualTo("run-1");
        assertThat(result.tests()).extracting(test -> test.className()).containsOnly("com.example.CalcTest");
        assertThat(testService.lastResult()).contains(result);
        assertThat(runRegistry.find(result.runId())).isPresent();
    }

    @Test
    void nonZeroExitWithoutReportsYieldsSyntheticError() {
        executionHost.onLaunch(process -> process.exit(1));

        TestRunResult result = testService.runTests(new TestRequest("com.example.*", null, null));

        assertThat(result.success()).isFalse();
        assertThat(result.tests()).singleElement().satisfies(test -> {
            assertThat(test.status()).isEqualTo(TestStatus.ERROR);
            assertThat(test.message()).contains("code 1");
        });
    }

    @Test
    void zeroExitWithoutReportsYieldsNoMatchingTests() {
        executionHost.onLaunch(process -> process.exit(0));

        TestRunResult result = testService.runTests(new TestRequest("NoSuchTest", null, null));

        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.NO_MATCHING_TESTS);
    }

    @Test
    void neverTerminatingProcessTimesOutWithinBudget() {
        long start = System.nanoTime();

        TestRunResult result = testService.runTests(new TestRequest("com.example.SlowTest", 1, null));

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.OPERATION_TIMEOUT);
        assertThat(result.runId()).isNotNull();
        assertThat(elapsed).isLessThan(Duration.ofMillis(1800));
        assertThat(testService.lastResult()).contains(result);
    }

    @Test
    void lingeringTimedOutRunBlocksNextTestRunAsExternalActivity() {
        testService.runTests(new TestRequest("com.example.SlowTest", 1, null));

        TestRunResult second = testService.runTests(new TestRequest("com.example.SlowTest", 1, null));

        assertThat(second.error().kind()).isEqualTo(BridgeErrorKind.UPSTREAM_ACTIVITY_TIMEOUT);
        assertThat(executionHost.processes()).hasSize(1);
    }

    @Test
    void concurrentCallerFailsFastWhileTestLockIsHeld() throws Exception {
        CompletableFuture<TestRunResult> first = CompletableFuture.supplyAsync(
                () -> testService.runTests(new TestRequest("com.example.SlowTest", 2, null)));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!lockRegistry.lock(OperationClass.TEST).isLocked() && System.nanoTime() < deadline) {
            TimeUnit.MILLISECONDS.sleep(5);
        }

        TestRunResult second = testService.runTests(new TestRequest("com.example.OtherTest", 1, null));

        assertThat(second.error().kind()).isEqualTo(BridgeErrorKind.LOCK_ACQUISITION_TIMEOUT);
        executionHost.lastProcess().exit(0);
        assertThat(first.get(5, TimeUnit.SECONDS).error().kind()).isEqualTo(BridgeErrorKind.NO_MATCHING_TESTS);
    }

    @Test
    void rejectedCallerLeavesCacheEmptyWhileTestsRun() throws Exception {
        CompletableFuture<TestRunResult> first = CompletableFuture.supplyAsync(
                () -> testService.runTests(new TestRequest("com.example.SlowTest", 2, null)));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!lockRegistry.lock(OperationClass.TEST).isLocked() && System.nanoTime() < deadline) {
            TimeUnit.MILLISECONDS.sleep(5);
        }

        testService.runTests(new TestRequest("com.example.OtherTest", 1, null));
        assertThat(testService.lastResult()).isEmpty();

        executionHost.lastProcess().exit(0);
        TestRunResult completed = first.get(5, TimeUnit.SECONDS);
        assertThat(testService.lastResult()).contains(completed);
    }

    @Test
    void waitsForCompilationToFinishFirst() {
        compiling.set(true);

        TestRunResult result = testService.runTests(new TestRequest("com.example.CalcTest", null, null));

        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.UPSTREAM_ACTIVITY_TIMEOUT);
        assertThat(executionHost.processes()).isEmpty();
    }

    @Test
    void launchFailureIsReported() {
        executionHost.failLaunchesWith("mvn: not found");

        TestRunResult result = testService.runTests(new TestRequest("com.example.CalcTest", null, null));

        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.LAUNCH_FAILED);
        assertThat(result.error().message()).contains("mvn: not found");
    }

    @Test
    void missingProjectIsReported() {
        TestRunResult result = new TestService(executionHost, treeSource, FakeProjectLocator.empty(), runRegistry,
                lockRegistry, bridge, new TestResultExtractor(properties.extractionRetry()), resultCache, properties)
                .runTests(new TestRequest("com.example.CalcTest", null, null));

        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.NO_PROJECT_OPEN);
    }
}
