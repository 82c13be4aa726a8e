/**
 * BridgeError.java
 *
 * 该文件定义了一个不可变的错误描述记录，是所有操作结果中 error 字段的统一载体。
 * 它包含错误类型、面向人的说明，以及（仅对内部故障）触发故障的异常类型名。
 */
package club.ppmc.ideabridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 一个结构化的错误。
 *
 * @param kind 错误类型。
 * @param message 面向人的错误说明。
 * @param faultType 内部故障的异常简单类名，其余情况为 null。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BridgeError(BridgeErrorKind kind, String message, String faultType) {

    public static BridgeError of(BridgeErrorKind kind, String message) {
        return new BridgeError(kind, message, null);
    }

    public static BridgeError fault(Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new BridgeError(BridgeErrorKind.INTERNAL_ERROR, message, cause.getClass().getSimpleName());
    }

    @JsonProperty("category")
    public ErrorCategory category() {
        return kind.category();
    }

    @JsonProperty("remedy")
    public Remedy remedy() {
        return kind.remedy();
    }
}
