/**
 * BreakpointInfo.java
 */
package club.ppmc.ideabridge.model.debug;

/**
 * @param file 源文件相对于项目根目录的路径，例如 src/main/java/com/example/Main.java。
 * @param line 行号 (从1开始)。
 * @param className 由文件路径推断出的类名。
 */
public record BreakpointInfo(String file, int line, String className) {}
