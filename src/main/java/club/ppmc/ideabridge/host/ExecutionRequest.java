/**
 * ExecutionRequest.java
 *
 * 一次进程执行的完整描述，由 ExecutionHost 根据运行配置或测试模式生成。
 */
package club.ppmc.ideabridge.host;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * @param displayName 运行配置名称或测试描述。
 * @param command 命令及其参数。
 * @param workingDirectory 工作目录。
 * @param environment 追加的环境变量。
 */
public record ExecutionRequest(
        String displayName, List<String> command, Path workingDirectory, Map<String, String> environment) {

    public ExecutionRequest {
        command = List.copyOf(command);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
