/**
 * DiagnosticsResult.java
 */
package club.ppmc.ideabridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagnosticsResult(
        String projectName, List<CompileMessage> errors, List<CompileMessage> warnings, BridgeError error) {

    public static DiagnosticsResult failed(BridgeError error) {
        return new DiagnosticsResult(null, List.of(), List.of(), error);
    }
}
