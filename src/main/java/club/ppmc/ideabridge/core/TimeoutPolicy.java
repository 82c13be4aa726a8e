/**
 * TimeoutPolicy.java
 *
 * 某一类桥接调用的超时策略。超时后调用方立即得到 OPERATION_TIMEOUT，宿主端已派发的任务不会被取消。
 */
package club.ppmc.ideabridge.core;

import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import java.time.Duration;
import java.util.Objects;

/**
 * @param operation 操作的可读名称，用于日志和错误信息。
 * @param timeout 调用方最长阻塞时间。
 */
public record TimeoutPolicy(String operation, Duration timeout) {

    public TimeoutPolicy {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("超时时间必须为正数: " + timeout);
        }
    }

    public static TimeoutPolicy of(String operation, Duration timeout) {
        return new TimeoutPolicy(operation, timeout);
    }

    BridgeError timeoutError() {
        return BridgeError.of(
                BridgeErrorKind.OPERATION_TIMEOUT,
                String.format("%s 在 %d 毫秒后超时，宿主端的任务可能仍在运行。", operation, timeout.toMillis()));
    }
}
