/**
 * LocalExecutionHost.java
 *
 * 以本机进程实现的执行宿主。
 * 运行配置来自 Settings.runConfigurations；测试通过 Maven surefire 执行；调试进程以 JDWP 监听方式启动。
 * 进程的标准错误合并到标准输出；只有在进程退出且输出流被完全读取之后才报告终止，保证不丢失最后的输出。
 */
package club.ppmc.ideabridge.host.local;

import club.ppmc.ideabridge.host.ExecutionHost;
import club.ppmc.ideabridge.host.ExecutionRequest;
import club.ppmc.ideabridge.host.ProcessControl;
import club.ppmc.ideabridge.host.ProcessListener;
import club.ppmc.ideabridge.host.ProjectHandle;
import club.ppmc.ideabridge.model.RunConfiguration;
import club.ppmc.ideabridge.model.Settings;
import club.ppmc.ideabridge.service.SettingsService;
import club.ppmc.ideabridge.util.MavenProjectHelper;
import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class LocalExecutionHost implements ExecutionHost {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalExecutionHost.class);

    private final SettingsService settingsService;
    private final MavenProjectHelper mavenHelper;
    private final ExecutorService outputReaders = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "process-output");
        thread.setDaemon(true);
        return thread;
    });

    public LocalExecutionHost(SettingsService settingsService, MavenProjectHelper mavenHelper) {
        this.settingsService = settingsService;
        this.mavenHelper = mavenHelper;
    }

    @Override
    public List<String> configurationNames(ProjectHandle project) {
        return List.copyOf(settingsService.getSettings().getRunConfigurations().keySet());
    }

    @Override
    public Optional<ExecutionRequest> configurationRequest(ProjectHandle project, String configName) {
        RunConfiguration configuration = settingsService.getSettings().getRunConfigurations().get(configName);
        if (configuration == null || configuration.getCommand().isEmpty()) {
            return Optional.empty();
        }
        Path workingDirectory = StringUtils.hasText(configuration.getWorkingDirectory())
                ? project.basePath().resolve(configuration.getWorkingDirectory()).normalize()
                : project.basePath();
        return Optional.of(new ExecutionRequest(
                configName, configuration.getCommand(), workingDirectory, configuration.getEnvironment()));
    }

    @Override
    public ExecutionRequest testRequest(ProjectHandle project, String pattern) {
        List<String> goals = List.of(
                "-B",
                "test",
                "-Dtest=" + toSurefirePattern(pattern),
                "-Dsurefire.failIfNoSpecifiedTests=false");
        try {
            List<String> command = mavenHelper.buildMavenCommand(project.basePath(), goals, LOGGER::info);
            return new ExecutionRequest("Test: " + pattern, command, project.basePath(), null);
        } catch (IOException e) {
            throw new UncheckedIOException("无法构造测试命令: " + e.getMessage(), e);
        }
    }

    /**
     * 包通配 {@code com.example.*} 在 surefire 中需要写成 {@code com.example.**} 才能匹配子包。
     */
    static String toSurefirePattern(String pattern) {
        String trimmed = pattern.trim();
        if (trimmed.endsWith(".*")) {
            return trimmed.substring(0, trimmed.length() - 1) + "**";
        }
        return trimmed;
    }

    @Override
    public ExecutionRequest debugRequest(ProjectHandle project, String mainClass, int port) {
        Settings settings = settingsService.getSettings();
        String jdkVersion = mavenHelper.getJavaVersionFromPom(project.basePath().toFile(), LOGGER::info);
        String javaExecutable = mavenHelper.selectJdkExecutable(settings, jdkVersion, LOGGER::info);
        try {
            List<String> command = new ArrayList<>();
            command.add(javaExecutable);
            command.add(String.format("-agentlib:jdwp=transport=dt_socket,server=y,suspend=y,address=%d", port));
            command.add("-Dfile.encoding=UTF-8");
            command.add("-cp");
            command.add(mavenHelper.buildClasspath(project.basePath()));
            command.add(mainClass);
            return new ExecutionRequest("Debug: " + mainClass, command, project.basePath(), null);
        } catch (IOException e) {
            throw new UncheckedIOException(e.getMessage(), e);
        }
    }

    @Override
    public ProcessControl execute(ExecutionRequest request, ProcessListener listener) throws IOException {
        var processBuilder = new ProcessBuilder(request.command())
                .directory(request.workingDirectory().toFile())
                .redirectErrorStream(true);
        processBuilder.environment().putAll(request.environment());

        Process process = processBuilder.start();
        LOGGER.info("已启动进程 '{}'，PID: {}", request.displayName(), process.pid());

        CompletableFuture<Void> outputFuture = startOutputReader(process, listener);
        process.onExit()
                .thenCombine(outputFuture, (p, v) -> p)
                .whenComplete((p, error) -> {
                    int exitCode = process.exitValue();
                    if (error != null) {
                        LOGGER.warn("进程 PID {} 的输出读取异常结束: {}", process.pid(), error.getMessage());
                    }
                    LOGGER.info("进程 PID {} 已退出，退出码: {}", process.pid(), exitCode);
                    listener.onTerminated(exitCode);
                });
        return new LocalProcessControl(process);
    }

    private CompletableFuture<Void> startOutputReader(Process process, ProcessListener listener) {
        return CompletableFuture.runAsync(() -> {
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                // 读取直到流结束，而不是直到进程结束，保证缓冲中的输出被完全读取
                while ((line = reader.readLine()) != null) {
                    listener.onOutput(line + "\n");
                }
            } catch (IOException e) {
                // 进程被强行杀死时流会被关闭，属于正常现象
                LOGGER.debug("从进程 PID {} 的输出流读取时出错: {}", process.pid(), e.getMessage());
            }
        }, outputReaders);
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }

    private record LocalProcessControl(Process process) implements ProcessControl {

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void destroy() {
            LOGGER.info("正在停止进程，PID: {}", process.pid());
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }
}
