/**
 * TestCaseResult.java
 *
 * 该文件定义了单个测试用例的执行结果，由 TestResultExtractor 遍历结果树时生成。
 */
package club.ppmc.ideabridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * @param className 测试类名。
 * @param methodName 测试方法名。
 * @param status 结果状态。
 * @param durationMs 耗时，毫秒。
 * @param message 失败信息，通过时为 null。
 * @param stacktrace 失败堆栈，通过时为 null。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestCaseResult(
        String className, String methodName, TestStatus status, long durationMs, String message, String stacktrace) {}
