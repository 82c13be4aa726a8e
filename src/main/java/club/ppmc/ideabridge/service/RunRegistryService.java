/**
 * RunRegistryService.java
 *
 * 运行注册表：管理由桥接层启动的所有进程。每个运行有唯一且递增的 id（run-1、run-2 ...），
 * 拥有一个有界输出缓冲区和一个进程句柄。多个运行可以同时存在。
 *
 * 输出与退出码只由进程监听器写入；stop 只发送终止信号，运行的最终状态仍由终止监听器给出，
 * 所以无论是自然退出还是被停止，都以同样的方式结束。
 * 已结束的运行不会自动消失，由定时的 prune 按保留时间清理。
 */
package club.ppmc.ideabridge.service;

import club.ppmc.ideabridge.config.BridgeProperties;
import club.ppmc.ideabridge.core.BridgeOutcome;
import club.ppmc.ideabridge.core.CompletionBridge;
import club.ppmc.ideabridge.core.TimeoutPolicy;
import club.ppmc.ideabridge.host.ApplicationDispatcher;
import club.ppmc.ideabridge.host.ExecutionHost;
import club.ppmc.ideabridge.host.ExecutionRequest;
import club.ppmc.ideabridge.host.ProcessControl;
import club.ppmc.ideabridge.host.ProcessListener;
import club.ppmc.ideabridge.host.ProjectHandle;
import club.ppmc.ideabridge.host.ProjectLocator;
import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import club.ppmc.ideabridge.model.ProjectInfo;
import club.ppmc.ideabridge.model.ProjectListResult;
import club.ppmc.ideabridge.model.RunCategory;
import club.ppmc.ideabridge.model.RunListResult;
import club.ppmc.ideabridge.model.RunOutputResult;
import club.ppmc.ideabridge.model.RunSession;
import club.ppmc.ideabridge.model.RunStartResult;
import club.ppmc.ideabridge.model.RunStopResult;
import club.ppmc.ideabridge.model.RunSummary;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class RunRegistryService {

    private final ExecutionHost executionHost;
    private final ProjectLocator projectLocator;
    private final ApplicationDispatcher dispatcher;
    private final CompletionBridge bridge;
    private final BridgeProperties properties;

    private final Map<String, RunSession> runs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public RunRegistryService(
            ExecutionHost executionHost,
            ProjectLocator projectLocator,
            ApplicationDispatcher dispatcher,
            CompletionBridge bridge,
            BridgeProperties properties) {
        this.executionHost = executionHost;
        this.projectLocator = projectLocator;
        this.dispatcher = dispatcher;
        this.bridge = bridge;
        this.properties = properties;
    }

    /**
     * 按名称启动一个运行配置。进程启动后立即返回，不等待进程结束。
     */
    public RunStartResult start(String configName, String projectRef) {
        Optional<ProjectHandle> project = projectLocator.resolve(projectRef);
        if (project.isEmpty()) {
            return RunStartResult.failed(null, configName, noProjectError(projectRef));
        }
        ProjectHandle handle = project.get();
        log.info("请求启动运行配置 '{}'，项目: {}", configName, handle.name());

        BridgeOutcome<RunStartResult> outcome = bridge.await(
                TimeoutPolicy.of("启动运行 '" + configName + "'", properties.runStartTimeout()),
                completion -> {
                    Optional<ExecutionRequest> request = executionHost.configurationRequest(handle, configName);
                    if (request.isEmpty()) {
                        completion.fail(BridgeErrorKind.CONFIGURATION_NOT_FOUND, String.format(
                                "找不到运行配置 '%s'。可用的配置: %s",
                                configName, executionHost.configurationNames(handle)));
                        return;
                    }
                    RunSession session = launch(handle, configName, request.get(), RunCategory.APPLICATION, null);
                    completion.complete(toStartResult(session));
                });
        return outcome.fold(result -> result, error -> RunStartResult.failed(null, configName, error));
    }

    static RunStartResult toStartResult(RunSession session) {
        if (session.isFailedToStart()) {
            return RunStartResult.failed(session.getId(), session.getConfigName(), BridgeError.of(
                    BridgeErrorKind.LAUNCH_FAILED, "进程启动失败: " + session.getFailureReason()));
        }
        return RunStartResult.started(session.getId(), session.getConfigName(), session.getProjectName());
    }

    /**
     * 注册并启动一个进程，不经过应用上下文派发。供已经在应用上下文中执行的工作调用（测试、调试启动）。
     * 监听器在进程启动之前挂上；启动失败的运行保留在注册表中，失败原因写入其输出。
     *
     * @param onTerminated 进程结束后的额外回调，参数是已记录退出码的运行，可以为 null。
     */
    public RunSession launch(
            ProjectHandle project,
            String configName,
            ExecutionRequest request,
            RunCategory category,
            Consumer<RunSession> onTerminated) {
        long seq = sequence.incrementAndGet();
        var session = new RunSession(
                "run-" + seq, seq, configName, project.name(), category, Instant.now(), properties.outputCapacity());
        runs.put(session.getId(), session);

        ProcessListener listener = new ProcessListener() {
            @Override
            public void onOutput(String text) {
                session.getOutput().append(text);
            }

            @Override
            public void onTerminated(int exitCode) {
                session.markTerminated(exitCode);
                log.info("运行 {} ('{}') 已结束，退出码: {}", session.getId(), configName, exitCode);
                if (onTerminated != null) {
                    onTerminated.accept(session);
                }
            }
        };

        try {
            ProcessControl control = executionHost.execute(request, listener);
            session.attach(control);
            log.info("运行 {} 已启动，PID: {}", session.getId(), control.pid());
        } catch (IOException | RuntimeException e) {
            log.error("运行 {} ('{}') 启动失败", session.getId(), configName, e);
            session.markFailedToStart(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        return session;
    }

    /**
     * 读取运行的输出。clear=true 时原子地取走并清空缓冲区，因此连续两次读取的内容不会重叠。
     */
    public RunOutputResult getOutput(String runId, boolean clear) {
        RunSession session = runs.get(runId);
        if (session == null) {
            return RunOutputResult.notFound(runId);
        }
        // 先读状态再读输出：读到已结束时，输出一定已经完整
        boolean running = session.isRunning();
        Integer exitCode = session.getExitCode();
        String output = clear ? session.getOutput().drain() : session.getOutput().read();
        return new RunOutputResult(true, runId, output, running, exitCode, null);
    }

    /**
     * 发送停止信号。对已结束的运行重复调用是安全的。
     */
    public RunStopResult stop(String runId) {
        RunSession session = runs.get(runId);
        if (session == null) {
            return new RunStopResult(false, runId, null,
                    BridgeError.of(BridgeErrorKind.RUN_NOT_FOUND, "找不到运行: " + runId));
        }
        ProcessControl control = session.getProcessControl();
        if (!session.isRunning() || control == null) {
            return new RunStopResult(true, runId, "运行已经结束。", null);
        }
        dispatcher.invokeLater(control::destroy);
        log.info("已向运行 {} 发送停止信号。", runId);
        return new RunStopResult(true, runId, "已发送停止信号。", null);
    }

    public RunListResult list() {
        List<RunSummary> summaries = runs.values().stream()
                .sorted(Comparator.comparingLong(RunSession::getSequence))
                .map(RunSession::toSummary)
                .toList();
        return new RunListResult(summaries);
    }

    public Optional<RunSession> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    /**
     * 清理已结束且启动时间早于 maxAge 之前的运行。正在运行的条目永远不会被清理。
     *
     * @return 被清理的条目数。
     */
    public int prune(Duration maxAge) {
        Instant now = Instant.now();
        int removed = 0;
        for (RunSession session : runs.values()) {
            // 按条目计算存活时间，极大的 maxAge 不会让截止时间溢出
            if (!session.isRunning()
                    && Duration.between(session.getStartTime(), now).compareTo(maxAge) > 0
                    && runs.remove(session.getId(), session)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("已清理 {} 个已结束的运行。", removed);
        }
        return removed;
    }

    @Scheduled(
            fixedDelayString = "${bridge.runs.prune-interval-ms:300000}",
            initialDelayString = "${bridge.runs.prune-interval-ms:300000}")
    public void scheduledPrune() {
        pruneExpired();
    }

    /**
     * 按配置的保留时间清理。
     */
    public int pruneExpired() {
        return prune(properties.runRetention());
    }

    public boolean hasActive(RunCategory category) {
        return runs.values().stream().anyMatch(session -> session.getCategory() == category && session.isRunning());
    }

    public ProjectListResult projects() {
        return new ProjectListResult(projectLocator.openProjects().stream()
                .map(project -> new ProjectInfo(project.name(), project.basePath().toString()))
                .toList());
    }

    /**
     * 终止所有存活的进程并清空注册表。
     */
    public void reset() {
        runs.values().forEach(session -> {
            ProcessControl control = session.getProcessControl();
            if (session.isRunning() && control != null) {
                control.destroy();
            }
        });
        runs.clear();
        log.info("运行注册表已重置。");
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 RunRegistryService...");
        reset();
    }

    static BridgeError noProjectError(String projectRef) {
        return BridgeError.of(BridgeErrorKind.NO_PROJECT_OPEN, projectRef == null || projectRef.isBlank()
                ? "当前没有打开的项目。"
                : "找不到项目: " + projectRef);
    }
}
