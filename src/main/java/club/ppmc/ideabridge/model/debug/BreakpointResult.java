/**
 * BreakpointResult.java
 */
package club.ppmc.ideabridge.model.debug;

import club.ppmc.ideabridge.model.BridgeError;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BreakpointResult(boolean success, String file, int line, String message, BridgeError error) {}
