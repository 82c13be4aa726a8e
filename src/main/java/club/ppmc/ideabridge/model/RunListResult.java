/**
 * RunListResult.java
 */
package club.ppmc.ideabridge.model;

import java.util.List;

public record RunListResult(List<RunSummary> runs) {}
