/**
 * ProjectInfo.java
 */
package club.ppmc.ideabridge.model;

/**
 * @param name 项目名称。
 * @param basePath 项目根目录的绝对路径。
 */
public record ProjectInfo(String name, String basePath) {}
