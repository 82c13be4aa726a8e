/**
 * TestService.java
 *
 * 测试操作。同一时刻最多只有一个测试越过测试锁；获取锁之后先等待仍在运行的测试进程（例如上一次超时的测试）
 * 和正在进行的编译结束。测试进程登记为 TEST 类别的运行，调用方可以在超时后继续通过 runId 读取其输出。
 * 进程退出后，测试结果在独立线程上按重试策略提取，不占用应用上下文。
 */
package club.ppmc.ideabridge.service;

import club.ppmc.ideabridge.config.BridgeProperties;
import club.ppmc.ideabridge.core.BridgeOutcome;
import club.ppmc.ideabridge.core.Completion;
import club.ppmc.ideabridge.core.CompletionBridge;
import club.ppmc.ideabridge.core.LockAcquisition;
import club.ppmc.ideabridge.core.OperationClass;
import club.ppmc.ideabridge.core.OperationLock;
import club.ppmc.ideabridge.core.OperationLockRegistry;
import club.ppmc.ideabridge.core.ResultCache;
import club.ppmc.ideabridge.core.TestResultExtractor;
import club.ppmc.ideabridge.core.TimeoutPolicy;
import club.ppmc.ideabridge.exception.EnvironmentConfigurationException;
import club.ppmc.ideabridge.host.ExecutionHost;
import club.ppmc.ideabridge.host.ExecutionRequest;
import club.ppmc.ideabridge.host.ProjectHandle;
import club.ppmc.ideabridge.host.ProjectLocator;
import club.ppmc.ideabridge.host.TestResultTreeSource;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import club.ppmc.ideabridge.model.RunCategory;
import club.ppmc.ideabridge.model.RunSession;
import club.ppmc.ideabridge.model.TestRequest;
import club.ppmc.ideabridge.model.TestRunResult;
import jakarta.annotation.PreDestroy;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class TestService {

    private final ExecutionHost executionHost;
    private final TestResultTreeSource treeSource;
    private final ProjectLocator projectLocator;
    private final RunRegistryService runRegistry;
    private final OperationLockRegistry lockRegistry;
    private final CompletionBridge bridge;
    private final TestResultExtractor extractor;
    private final ResultCache resultCache;
    private final BridgeProperties properties;
    private final ExecutorService extractionExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "test-result-extractor");
        thread.setDaemon(true);
        return thread;
    });

    public TestService(
            ExecutionHost executionHost,
            TestResultTreeSource treeSource,
            ProjectLocator projectLocator,
            RunRegistryService runRegistry,
            OperationLockRegistry lockRegistry,
            CompletionBridge bridge,
            TestResultExtractor extractor,
            ResultCache resultCache,
            BridgeProperties properties) {
        this.executionHost = executionHost;
        this.treeSource = treeSource;
        this.projectLocator = projectLocator;
        this.runRegistry = runRegistry;
        this.lockRegistry = lockRegistry;
        this.bridge = bridge;
        this.extractor = extractor;
        this.resultCache = resultCache;
        this.properties = properties;
    }

    public TestRunResult runTests(TestRequest request) {
        long start = System.currentTimeMillis();
        TestRunResult result = doRunTests(request, start);
        log.info("测试 '{}' 结束: success={}, passed={}, failed={}, skipped={}, 耗时 {} 毫秒",
                request.pattern(), result.success(), result.passed(), result.failed(), result.skipped(), result.timeMs());
        return result;
    }

    private TestRunResult doRunTests(TestRequest request, long start) {
        Optional<ProjectHandle> project = projectLocator.resolve(request.projectRef());
        if (project.isEmpty()) {
            return TestRunResult.failed(RunRegistryService.noProjectError(request.projectRef()), elapsedSince(start), null);
        }

        OperationLock lock = lockRegistry.lock(OperationClass.TEST);
        try (LockAcquisition acquisition = lock.acquire(properties.lockAcquireTimeout())) {
            if (!acquisition.acquired()) {
                return TestRunResult.failed(acquisition.error(), elapsedSince(start), null);
            }
            resultCache.clear(OperationClass.TEST);
            TestRunResult result = testHoldingLock(lock, project.get(), request, start);
            resultCache.put(OperationClass.TEST, result);
            return result;
        }
    }

    private TestRunResult testHoldingLock(OperationLock lock, ProjectHandle handle, TestRequest request, long start) {
        for (OperationLock upstream : List.of(lock, lockRegistry.lock(OperationClass.BUILD))) {
            BridgeOutcome<Duration> waited = upstream.waitForExternalActivity(
                    properties.upstreamMaxWait(), properties.upstreamPollInterval());
            if (!waited.isSuccess()) {
                return TestRunResult.failed(waited.error(), elapsedSince(start), null);
            }
        }
        Duration timeout = request.timeoutSeconds() != null
                ? Duration.ofSeconds(request.timeoutSeconds())
                : properties.testTimeout();
        // 报告文件的修改时间可能只精确到秒
        Instant since = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        AtomicReference<String> runId = new AtomicReference<>();

        BridgeOutcome<TestRunResult> outcome = bridge.await(
                TimeoutPolicy.of("测试 '" + request.pattern() + "'", timeout),
                completion -> launchTests(handle, request.pattern(), since, runId, completion));
        long elapsed = elapsedSince(start);
        return outcome.fold(
                result -> result.withTiming(elapsed, result.runId()),
                error -> TestRunResult.failed(error, elapsed, runId.get()));
    }

    private void launchTests(
            ProjectHandle project,
            String pattern,
            Instant since,
            AtomicReference<String> runId,
            Completion<TestRunResult> completion) {
        ExecutionRequest request;
        try {
            request = executionHost.testRequest(project, pattern);
        } catch (EnvironmentConfigurationException e) {
            completion.fail(e.toBridgeError());
            return;
        } catch (UncheckedIOException e) {
            completion.fail(BridgeErrorKind.LAUNCH_FAILED, e.getMessage());
            return;
        }
        RunSession session = runRegistry.launch(project, "Test: " + pattern, request, RunCategory.TEST,
                terminated -> extractionExecutor.execute(() -> completion.complete(
                        extractor.extract(() -> treeSource.readTree(project, since), terminated.getExitCode())
                                .withTiming(0, terminated.getId()))));
        runId.set(session.getId());
        if (session.isFailedToStart()) {
            completion.fail(BridgeErrorKind.LAUNCH_FAILED, "测试进程启动失败: " + session.getFailureReason());
        }
    }

    public Optional<TestRunResult> lastResult() {
        return resultCache.get(OperationClass.TEST, TestRunResult.class);
    }

    private static long elapsedSince(long start) {
        return System.currentTimeMillis() - start;
    }

    @PreDestroy
    public void shutdown() {
        extractionExecutor.shutdownNow();
    }
}
