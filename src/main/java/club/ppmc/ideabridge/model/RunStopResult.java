/**
 * RunStopResult.java
 */
package club.ppmc.ideabridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunStopResult(boolean success, String runId, String message, BridgeError error) {}
