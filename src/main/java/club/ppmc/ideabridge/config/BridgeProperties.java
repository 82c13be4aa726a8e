/**
 * BridgeProperties.java
 *
 * 桥接层的可调参数：锁等待、各类操作超时、输出容量、运行保留时间和结果提取重试。
 * 由 BridgeConfig 从 application.properties 的 bridge.* 前缀装配。
 */
package club.ppmc.ideabridge.config;

import club.ppmc.ideabridge.core.RetryPolicy;
import java.time.Duration;

/**
 * @param lockAcquireTimeout 获取操作锁的最长等待时间。
 * @param upstreamMaxWait 等待外部同类活动结束的最长时间。
 * @param upstreamPollInterval 探测外部活动的轮询间隔。
 * @param buildTimeout 构建的默认超时。
 * @param testTimeout 测试的默认超时。
 * @param runStartTimeout 启动一个运行的超时。
 * @param debugCallTimeout 调试控制类调用的超时。
 * @param debugEvaluateTimeout 调试求值、栈和变量查询的超时。
 * @param outputCapacity 每个运行的输出缓冲区容量（字符数）。
 * @param runRetention 已结束运行在注册表中保留的时间。
 * @param extractionRetry 测试结果提取的重试策略。
 */
public record BridgeProperties(
        Duration lockAcquireTimeout,
        Duration upstreamMaxWait,
        Duration upstreamPollInterval,
        Duration buildTimeout,
        Duration testTimeout,
        Duration runStartTimeout,
        Duration debugCallTimeout,
        Duration debugEvaluateTimeout,
        int outputCapacity,
        Duration runRetention,
        RetryPolicy extractionRetry) {}
