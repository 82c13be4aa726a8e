/**
 * RunOutputResult.java
 */
package club.ppmc.ideabridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param output 缓冲区内容；clear=true 时为本次取走的内容。
 * @param running 进程是否仍在运行。
 * @param exitCode 进程退出码，仍在运行或启动失败时为 null。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunOutputResult(
        boolean success, String runId, String output, boolean running, Integer exitCode, BridgeError error) {

    public static RunOutputResult notFound(String runId) {
        return new RunOutputResult(false, runId, null, false, null,
                BridgeError.of(BridgeErrorKind.RUN_NOT_FOUND, "找不到运行: " + runId));
    }
}
