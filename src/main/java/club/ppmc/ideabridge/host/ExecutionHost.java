/**
 * ExecutionHost.java
 *
 * 宿主的进程执行入口：运行配置的查找、测试与调试命令的构造，以及带监听器的进程启动。
 */
package club.ppmc.ideabridge.host;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ExecutionHost {

    List<String> configurationNames(ProjectHandle project);

    Optional<ExecutionRequest> configurationRequest(ProjectHandle project, String configName);

    /**
     * @param pattern 测试类或方法的模式，例如 {@code com.example.FooTest}、{@code FooTest#bar}、{@code com.example.*}。
     */
    ExecutionRequest testRequest(ProjectHandle project, String pattern);

    /**
     * 构造一个以 JDWP 监听指定端口、启动时挂起的调试进程命令。
     */
    ExecutionRequest debugRequest(ProjectHandle project, String mainClass, int port);

    /**
     * 启动进程并挂上监听器。
     *
     * @throws IOException 进程无法启动时抛出。
     */
    ProcessControl execute(ExecutionRequest request, ProcessListener listener) throws IOException;
}
