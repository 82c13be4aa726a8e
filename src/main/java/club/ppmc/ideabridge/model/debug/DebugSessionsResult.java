/**
 * DebugSessionsResult.java
 */
package club.ppmc.ideabridge.model.debug;

import java.util.List;

public record DebugSessionsResult(List<DebugSessionInfo> sessions) {}
