/**
 * ProjectHandle.java
 *
 * 宿主中一个已打开项目的不可变句柄。
 */
package club.ppmc.ideabridge.host;

import java.nio.file.Path;

/**
 * @param name 项目名称（工作区中的目录名）。
 * @param basePath 项目根目录的绝对路径。
 */
public record ProjectHandle(String name, Path basePath) {}
