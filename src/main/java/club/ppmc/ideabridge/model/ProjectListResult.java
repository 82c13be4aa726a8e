/**
 * ProjectListResult.java
 */
package club.ppmc.ideabridge.model;

import java.util.List;

public record ProjectListResult(List<ProjectInfo> projects) {}
