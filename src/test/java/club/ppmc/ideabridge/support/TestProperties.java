package club.ppmc.ideabridge.support;

import club.ppmc.ideabridge.config.BridgeProperties;
import club.ppmc.ideabridge.core.RetryPolicy;
import java.time.Duration;

/**
 * 超时都缩短到毫秒级的配置，避免测试在失败路径上长时间阻塞。
 */
public final class TestProperties {

    private TestProperties() {}

    public static BridgeProperties fast() {
        return new BridgeProperties(
                Duration.ofMillis(300),
                Duration.ofMillis(500),
                Duration.ofMillis(20),
                Duration.ofSeconds(2),
                Duration.ofSeconds(2),
                Duration.ofSeconds(2),
                Duration.ofSeconds(1),
                Duration.ofSeconds(1),
                4096,
                Duration.ofHours(1),
                RetryPolicy.of(3, Duration.ofMillis(10)));
    }
}
