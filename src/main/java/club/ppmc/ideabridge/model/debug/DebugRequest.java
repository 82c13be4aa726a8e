/**
 * DebugRequest.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于封装启动一个新调试会话的请求。
 * 它由 DebugController 接收，并传递给 DebugLaunchService 来启动调试进程。
 */
package club.ppmc.ideabridge.model.debug;

import jakarta.validation.constraints.NotBlank;

/**
 * @param mainClass 要执行的完全限定主类名 (例如, "com.example.Main")。
 * @param projectRef 要调试的项目名称或路径。
 */
public record DebugRequest(@NotBlank String mainClass, String projectRef) {}
