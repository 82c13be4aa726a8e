/**
 * BreakpointRequest.java
 *
 * 该文件定义了一个数据传输对象 (DTO)，用于封装设置或移除断点的请求。
 * 它由 BreakpointController 接收，并传递给 DebugFacadeService。
 */
package club.ppmc.ideabridge.model.debug;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * @param file 要设置断点的文件的相对路径。
 * @param line 断点所在的行号 (从1开始)。
 */
public record BreakpointRequest(@NotBlank String file, @Positive int line) {}
