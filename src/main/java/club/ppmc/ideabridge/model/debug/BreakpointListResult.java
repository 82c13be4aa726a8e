/**
 * BreakpointListResult.java
 */
package club.ppmc.ideabridge.model.debug;

import java.util.List;

public record BreakpointListResult(List<BreakpointInfo> breakpoints) {}
