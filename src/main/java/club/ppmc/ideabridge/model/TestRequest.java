/**
 * TestRequest.java
 *
 * 该文件定义了运行测试请求的数据传输对象，由 TestController 接收。
 */
package club.ppmc.ideabridge.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * @param pattern 测试模式，例如完全限定的测试类名、{@code Class#method} 或 {@code com.example.*}。
 * @param timeoutSeconds 覆盖默认的测试超时，秒。
 * @param projectRef 项目名称或路径。
 */
public record TestRequest(@NotBlank String pattern, @Positive Integer timeoutSeconds, String projectRef) {}
