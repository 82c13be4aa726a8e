/**
 * DebugSessionInfo.java
 */
package club.ppmc.ideabridge.model.debug;

public record DebugSessionInfo(String name, boolean suspended, boolean current) {}
