/**
 * DebugStepResult.java
 *
 * pause / resume / step 等控制类调试操作的结果。
 */
package club.ppmc.ideabridge.model.debug;

import club.ppmc.ideabridge.model.BridgeError;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DebugStepResult(boolean success, String action, String message, BridgeError error) {

    public static DebugStepResult done(String action, String message) {
        return new DebugStepResult(true, action, message, null);
    }

    public static DebugStepResult failed(String action, BridgeError error) {
        return new DebugStepResult(false, action, null, error);
    }
}
