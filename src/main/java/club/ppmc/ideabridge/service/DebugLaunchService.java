/**
 * DebugLaunchService.java
 *
 * 调试启动：以 JDWP 监听模式启动指定主类（启动时挂起），登记为 DEBUG 类别的运行，
 * 等待进程输出 JDWP 监听日志后附加调试会话。附加成功后该会话成为当前会话。
 *
 * 新的启动会先断开当前会话并停止仍在运行的调试进程。
 */
package club.ppmc.ideabridge.service;

import club.ppmc.ideabridge.config.BridgeProperties;
import club.ppmc.ideabridge.core.BridgeOutcome;
import club.ppmc.ideabridge.core.CompletionBridge;
import club.ppmc.ideabridge.core.TimeoutPolicy;
import club.ppmc.ideabridge.exception.EnvironmentConfigurationException;
import club.ppmc.ideabridge.host.ExecutionHost;
import club.ppmc.ideabridge.host.ExecutionRequest;
import club.ppmc.ideabridge.host.ProjectHandle;
import club.ppmc.ideabridge.host.ProjectLocator;
import club.ppmc.ideabridge.host.debug.DebugSessionManager;
import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import club.ppmc.ideabridge.model.RunCategory;
import club.ppmc.ideabridge.model.RunSession;
import club.ppmc.ideabridge.model.RunStartResult;
import club.ppmc.ideabridge.model.RunSummary;
import club.ppmc.ideabridge.model.debug.DebugStepResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DebugLaunchService {

    static final String JDWP_READY_MARKER = "Listening for transport dt_socket";
    private static final long READY_POLL_MS = 100;

    private final ExecutionHost executionHost;
    private final ProjectLocator projectLocator;
    private final DebugSessionManager sessionManager;
    private final RunRegistryService runRegistry;
    private final CompletionBridge bridge;
    private final BridgeProperties properties;

    public DebugLaunchService(
            ExecutionHost executionHost,
            ProjectLocator projectLocator,
            DebugSessionManager sessionManager,
            RunRegistryService runRegistry,
            CompletionBridge bridge,
            BridgeProperties properties) {
        this.executionHost = executionHost;
        this.projectLocator = projectLocator;
        this.sessionManager = sessionManager;
        this.runRegistry = runRegistry;
        this.bridge = bridge;
        this.properties = properties;
    }

    public synchronized RunStartResult start(String mainClass, String projectRef) {
        String configName = "Debug: " + mainClass;
        Optional<ProjectHandle> project = projectLocator.resolve(projectRef);
        if (project.isEmpty()) {
            return RunStartResult.failed(null, configName, RunRegistryService.noProjectError(projectRef));
        }
        ProjectHandle handle = project.get();
        log.info("请求启动调试会话，项目: {}, 主类: {}", handle.name(), mainClass);

        if (sessionManager.currentSession().isPresent() || runRegistry.hasActive(RunCategory.DEBUG)) {
            log.warn("检测到活动的调试会话，将先进行清理...");
            stop();
        }

        int port;
        try {
            port = findFreePort();
        } catch (IOException e) {
            log.error("无法分配 JDWP 端口", e);
            return RunStartResult.failed(null, configName,
                    BridgeError.of(BridgeErrorKind.LAUNCH_FAILED, "无法分配调试端口: " + e.getMessage()));
        }

        BridgeOutcome<RunSession> launched = bridge.await(
                TimeoutPolicy.of("启动调试进程 '" + mainClass + "'", properties.runStartTimeout()),
                completion -> {
                    ExecutionRequest request;
                    try {
                        request = executionHost.debugRequest(handle, mainClass, port);
                    } catch (EnvironmentConfigurationException e) {
                        completion.fail(e.toBridgeError());
                        return;
                    } catch (UncheckedIOException e) {
                        completion.fail(BridgeErrorKind.LAUNCH_FAILED, e.getMessage());
                        return;
                    }
                    completion.complete(runRegistry.launch(handle, configName, request, RunCategory.DEBUG, null));
                });
        if (!launched.isSuccess()) {
            return RunStartResult.failed(null, configName, launched.error());
        }
        RunSession session = launched.value();
        if (session.isFailedToStart()) {
            return RunRegistryService.toStartResult(session);
        }

        BridgeOutcome<Boolean> ready = awaitJdwpReady(session);
        if (!ready.isSuccess()) {
            runRegistry.stop(session.getId());
            return RunStartResult.failed(session.getId(), configName, ready.error());
        }

        String sessionName = session.getId() + ":" + mainClass;
        BridgeOutcome<String> attached = bridge.await(
                TimeoutPolicy.of("附加调试器 '" + mainClass + "'", properties.runStartTimeout()),
                completion -> {
                    try {
                        completion.complete(sessionManager.attach(sessionName, port).name());
                    } catch (IOException e) {
                        log.error("附加到调试进程 {} 失败", session.getId(), e);
                        completion.fail(BridgeErrorKind.LAUNCH_FAILED, "附加调试器失败: " + e.getMessage());
                    }
                });
        if (!attached.isSuccess()) {
            runRegistry.stop(session.getId());
            return RunStartResult.failed(session.getId(), configName, attached.error());
        }
        log.info("调试会话 '{}' 已建立，JDWP 端口: {}", attached.value(), port);
        return RunStartResult.started(session.getId(), configName, handle.name());
    }

    /**
     * 断开当前调试会话，并停止所有仍在运行的调试进程。
     */
    public synchronized DebugStepResult stop() {
        log.info("收到停止调试请求...");
        BridgeOutcome<Boolean> detached = bridge.await(
                TimeoutPolicy.of("断开调试会话", properties.debugCallTimeout()),
                completion -> {
                    sessionManager.detachCurrent();
                    completion.complete(true);
                });
        List<String> debugRuns = runRegistry.list().runs().stream()
                .filter(run -> run.category() == RunCategory.DEBUG && run.running())
                .map(RunSummary::runId)
                .toList();
        debugRuns.forEach(runRegistry::stop);
        if (!detached.isSuccess()) {
            return DebugStepResult.failed("stop", detached.error());
        }
        return DebugStepResult.done("stop", String.format("调试会话已断开，已停止 %d 个调试进程。", debugRuns.size()));
    }

    /**
     * 等待进程输出 JDWP 监听日志。进程提前结束或超时都视为启动失败。
     */
    private BridgeOutcome<Boolean> awaitJdwpReady(RunSession session) {
        long deadline = System.nanoTime() + properties.runStartTimeout().toNanos();
        while (true) {
            if (session.getOutput().read().contains(JDWP_READY_MARKER)) {
                log.info("检测到JDWP监听日志，准备附加调试器...");
                return BridgeOutcome.success(true);
            }
            if (!session.isRunning()) {
                return BridgeOutcome.failure(BridgeErrorKind.LAUNCH_FAILED,
                        "进程意外终止，未能启动调试模式。退出码: " + session.getExitCode());
            }
            if (System.nanoTime() >= deadline) {
                return BridgeOutcome.failure(BridgeErrorKind.OPERATION_TIMEOUT, String.format(
                        "调试进程在 %d 毫秒内没有开始监听 JDWP 端口。", properties.runStartTimeout().toMillis()));
            }
            try {
                TimeUnit.MILLISECONDS.sleep(READY_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return BridgeOutcome.failure(new BridgeError(BridgeErrorKind.INTERNAL_ERROR,
                        "等待调试进程就绪时线程被中断。", InterruptedException.class.getSimpleName()));
            }
        }
    }

    private static int findFreePort() throws IOException {
        try (var socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        }
    }
}
