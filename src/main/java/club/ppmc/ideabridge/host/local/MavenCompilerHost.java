/**
 * MavenCompilerHost.java
 *
 * 以 Maven 实现的编译宿主。增量编译执行 test-compile，完整重新构建执行 clean test-compile。
 * 编译在独立的工作线程上进行，结束后把回调投递回应用上下文。
 * 编译器输出中形如 "[ERROR] /path/Foo.java:[12,5] message" 的行被解析为诊断信息。
 */
package club.ppmc.ideabridge.host.local;

import club.ppmc.ideabridge.exception.EnvironmentConfigurationException;
import club.ppmc.ideabridge.host.ApplicationDispatcher;
import club.ppmc.ideabridge.host.CompileStatusNotification;
import club.ppmc.ideabridge.host.CompilerHost;
import club.ppmc.ideabridge.host.ProjectHandle;
import club.ppmc.ideabridge.model.CompileMessage;
import club.ppmc.ideabridge.util.MavenProjectHelper;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MavenCompilerHost implements CompilerHost {

    private static final Logger LOGGER = LoggerFactory.getLogger(MavenCompilerHost.class);
    private static final Pattern DIAGNOSTIC_LINE =
            Pattern.compile("^\\[(ERROR|WARNING)\\] (.+?\\.java):\\[(\\d+),(\\d+)\\] (.*)$");

    private final MavenProjectHelper mavenHelper;
    private final ApplicationDispatcher dispatcher;
    private final ExecutorService compileExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "maven-compile");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicInteger activeCompilations = new AtomicInteger();
    private final Map<Path, List<CompileMessage>> lastMessages = new ConcurrentHashMap<>();

    public MavenCompilerHost(MavenProjectHelper mavenHelper, ApplicationDispatcher dispatcher) {
        this.mavenHelper = mavenHelper;
        this.dispatcher = dispatcher;
    }

    @Override
    public void compile(ProjectHandle project, boolean incremental, CompileStatusNotification callback) {
        List<String> goals = incremental ? List.of("-B", "test-compile") : List.of("-B", "clean", "test-compile");
        activeCompilations.incrementAndGet();
        LOGGER.info("开始{}项目 '{}'。", incremental ? "增量编译" : "重新构建", project.name());
        try {
            compileExecutor.execute(() -> runCompilation(project, goals, callback));
        } catch (RejectedExecutionException e) {
            LOGGER.error("无法提交项目 '{}' 的编译任务", project.name(), e);
            finish(project, true, List.of(new CompileMessage(
                    CompileMessage.ERROR, "无法提交编译任务: " + e.getMessage(), null, null, null)), callback);
        }
    }

    private void runCompilation(ProjectHandle project, List<String> goals, CompileStatusNotification callback) {
        boolean aborted = true;
        List<CompileMessage> messages = new ArrayList<>();
        try {
            var lines = new ArrayList<String>();
            int exitCode = mavenHelper.executeMavenBuild(project.basePath(), goals, lines::add);
            messages = parseDiagnostics(lines);
            // 退出码非 0 却没有解析出任何错误，说明构建在编译之前就失败了
            aborted = exitCode != 0 && messages.stream().noneMatch(CompileMessage::isError);
            if (aborted) {
                messages.add(new CompileMessage(CompileMessage.ERROR,
                        "Maven 构建失败，退出码 " + exitCode + "：" + lastLines(lines, 5), null, null, null));
            }
        } catch (EnvironmentConfigurationException e) {
            LOGGER.warn("项目 '{}' 的编译环境未正确配置: {}", project.name(), e.toErrorData());
            messages.add(new CompileMessage(CompileMessage.ERROR, e.getMessage(), null, null, null));
        } catch (IOException e) {
            LOGGER.error("启动项目 '{}' 的 Maven 构建失败", project.name(), e);
            messages.add(new CompileMessage(CompileMessage.ERROR, "无法启动 Maven: " + e.getMessage(), null, null, null));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            LOGGER.error("项目 '{}' 的编译过程中发生意外错误", project.name(), e);
            messages.add(new CompileMessage(CompileMessage.ERROR, "编译意外中止: " + e, null, null, null));
        } finally {
            finish(project, aborted, messages, callback);
        }
    }

    /**
     * 记录诊断、释放活动计数并把结果投递回应用上下文。每次 compile 恰好调用一次。
     */
    private void finish(
            ProjectHandle project, boolean aborted, List<CompileMessage> messages, CompileStatusNotification callback) {
        List<CompileMessage> result = List.copyOf(messages);
        lastMessages.put(project.basePath(), result);
        activeCompilations.decrementAndGet();
        dispatcher.invokeLater(() -> callback.finished(aborted, result));
    }

    @Override
    public boolean isCompilationActive() {
        return activeCompilations.get() > 0;
    }

    @Override
    public List<CompileMessage> lastMessages(ProjectHandle project) {
        return lastMessages.getOrDefault(project.basePath(), List.of());
    }

    /**
     * 解析编译器输出。同一条诊断在 Maven 的输出中可能出现两次（编译阶段与失败汇总），只保留一次。
     */
    static List<CompileMessage> parseDiagnostics(List<String> lines) {
        Set<CompileMessage> messages = new LinkedHashSet<>();
        for (String line : lines) {
            Matcher matcher = DIAGNOSTIC_LINE.matcher(line.trim());
            if (matcher.matches()) {
                messages.add(new CompileMessage(
                        matcher.group(1),
                        matcher.group(5).trim(),
                        matcher.group(2),
                        Integer.valueOf(matcher.group(3)),
                        Integer.valueOf(matcher.group(4))));
            }
        }
        return new ArrayList<>(messages);
    }

    private static String lastLines(List<String> lines, int count) {
        return String.join("\n", lines.subList(Math.max(0, lines.size() - count), lines.size()));
    }

    @PreDestroy
    public void shutdown() {
        compileExecutor.shutdownNow();
    }
}
