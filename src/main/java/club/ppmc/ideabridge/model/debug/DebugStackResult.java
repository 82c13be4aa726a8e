/**
 * DebugStackResult.java
 */
package club.ppmc.ideabridge.model.debug;

import club.ppmc.ideabridge.model.BridgeError;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DebugStackResult(boolean success, String sessionName, List<StackFrameInfo> frames, BridgeError error) {

    public static DebugStackResult failed(BridgeError error) {
        return new DebugStackResult(false, null, List.of(), error);
    }
}
