/**
 * RunStartResult.java
 *
 * 启动一个运行（普通运行或调试运行）的结果。
 */
package club.ppmc.ideabridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunStartResult(boolean success, String runId, String configName, String projectName, BridgeError error) {

    public static RunStartResult started(String runId, String configName, String projectName) {
        return new RunStartResult(true, runId, configName, projectName, null);
    }

    public static RunStartResult failed(String runId, String configName, BridgeError error) {
        return new RunStartResult(false, runId, configName, null, error);
    }
}
