/**
 * RetryPolicy.java
 *
 * 有界重试策略：最多尝试 maxAttempts 次，两次尝试之间固定等待 delay。
 */
package club.ppmc.ideabridge.core;

import java.time.Duration;
import java.util.Objects;

public record RetryPolicy(int maxAttempts, Duration delay) {

    public RetryPolicy {
        Objects.requireNonNull(delay, "delay");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("重试次数至少为 1: " + maxAttempts);
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("重试间隔不能为负数: " + delay);
        }
    }

    public static RetryPolicy of(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay);
    }
}
