/**
 * CompileService.java
 *
 * 构建操作。同一时刻最多只有一个构建越过构建锁；获取锁之后、发起编译之前，先等待外部触发的编译结束。
 * 编译结果（包括失败与超时）缓存为最近一次构建结果。
 */
package club.ppmc.ideabridge.service;

import club.ppmc.ideabridge.config.BridgeProperties;
import club.ppmc.ideabridge.core.BridgeOutcome;
import club.ppmc.ideabridge.core.CompletionBridge;
import club.ppmc.ideabridge.core.LockAcquisition;
import club.ppmc.ideabridge.core.OperationClass;
import club.ppmc.ideabridge.core.OperationLock;
import club.ppmc.ideabridge.core.OperationLockRegistry;
import club.ppmc.ideabridge.core.ResultCache;
import club.ppmc.ideabridge.core.TimeoutPolicy;
import club.ppmc.ideabridge.host.CompilerHost;
import club.ppmc.ideabridge.host.ProjectHandle;
import club.ppmc.ideabridge.host.ProjectLocator;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import club.ppmc.ideabridge.model.BuildRequest;
import club.ppmc.ideabridge.model.CompileMessage;
import club.ppmc.ideabridge.model.CompileResult;
import club.ppmc.ideabridge.model.DiagnosticsResult;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class CompileService {

    private final CompilerHost compilerHost;
    private final ProjectLocator projectLocator;
    private final OperationLockRegistry lockRegistry;
    private final CompletionBridge bridge;
    private final ResultCache resultCache;
    private final BridgeProperties properties;

    public CompileService(
            CompilerHost compilerHost,
            ProjectLocator projectLocator,
            OperationLockRegistry lockRegistry,
            CompletionBridge bridge,
            ResultCache resultCache,
            BridgeProperties properties) {
        this.compilerHost = compilerHost;
        this.projectLocator = projectLocator;
        this.lockRegistry = lockRegistry;
        this.bridge = bridge;
        this.resultCache = resultCache;
        this.properties = properties;
    }

    public CompileResult compile(BuildRequest request) {
        long start = System.currentTimeMillis();
        CompileResult result = doCompile(request, start);
        log.info("构建结束: success={}, errors={}, warnings={}, aborted={}, 耗时 {} 毫秒",
                result.success(), result.errors().size(), result.warnings().size(), result.aborted(), result.timeMs());
        return result;
    }

    private CompileResult doCompile(BuildRequest request, long start) {
        Optional<ProjectHandle> project = projectLocator.resolve(request.projectRef());
        if (project.isEmpty()) {
            return CompileResult.failed(RunRegistryService.noProjectError(request.projectRef()), elapsedSince(start), false);
        }

        OperationLock lock = lockRegistry.lock(OperationClass.BUILD);
        try (LockAcquisition acquisition = lock.acquire(properties.lockAcquireTimeout())) {
            if (!acquisition.acquired()) {
                return CompileResult.failed(acquisition.error(), elapsedSince(start), false);
            }
            // 只有拿到锁的调用才算一次新的构建，被拒绝的调用不影响缓存
            resultCache.clear(OperationClass.BUILD);
            CompileResult result = compileHoldingLock(lock, project.get(), request, start);
            resultCache.put(OperationClass.BUILD, result);
            return result;
        }
    }

    private CompileResult compileHoldingLock(OperationLock lock, ProjectHandle handle, BuildRequest request, long start) {
        // 持有锁之后仍在进行的编译只可能是外部触发的
        BridgeOutcome<Duration> upstream =
                lock.waitForExternalActivity(properties.upstreamMaxWait(), properties.upstreamPollInterval());
        if (!upstream.isSuccess()) {
            return CompileResult.failed(upstream.error(), elapsedSince(start), false);
        }
        Duration timeout = request.timeoutSeconds() != null
                ? Duration.ofSeconds(request.timeoutSeconds())
                : properties.buildTimeout();
        BridgeOutcome<CompileResult> outcome = bridge.await(
                TimeoutPolicy.of("构建项目 '" + handle.name() + "'", timeout),
                completion -> compilerHost.compile(handle, request.isIncremental(),
                        (aborted, messages) -> completion.complete(CompileResult.completed(aborted, messages, 0))));
        long elapsed = elapsedSince(start);
        return outcome.fold(
                result -> result.withTimeMs(elapsed),
                error -> error.kind() == BridgeErrorKind.OPERATION_TIMEOUT
                        ? CompileResult.failed(error, timeout.toMillis(), true)
                        : CompileResult.failed(error, elapsed, false));
    }

    public Optional<CompileResult> lastResult() {
        return resultCache.get(OperationClass.BUILD, CompileResult.class);
    }

    /**
     * 项目最近一次编译留下的诊断信息，不触发新的编译。
     */
    public DiagnosticsResult diagnostics(String projectRef) {
        Optional<ProjectHandle> project = projectLocator.resolve(projectRef);
        if (project.isEmpty()) {
            return DiagnosticsResult.failed(RunRegistryService.noProjectError(projectRef));
        }
        List<CompileMessage> messages = compilerHost.lastMessages(project.get());
        return new DiagnosticsResult(
                project.get().name(),
                messages.stream().filter(CompileMessage::isError).toList(),
                messages.stream().filter(message -> !message.isError()).toList(),
                null);
    }

    private static long elapsedSince(long start) {
        return System.currentTimeMillis() - start;
    }
}
