/**
 * DebugVariablesResult.java
 */
package club.ppmc.ideabridge.model.debug;

import club.ppmc.ideabridge.model.BridgeError;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DebugVariablesResult(boolean success, int frameIndex, List<VariableInfo> variables, BridgeError error) {

    public static DebugVariablesResult failed(int frameIndex, BridgeError error) {
        return new DebugVariablesResult(false, frameIndex, List.of(), error);
    }
}
