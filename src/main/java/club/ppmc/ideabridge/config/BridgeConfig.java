/**
 * BridgeConfig.java
 *
 * 桥接层核心组件的装配：应用上下文、完成桥、按类别的操作锁、结果缓存和测试结果提取器。
 * 这些组件都是进程内单例，显式构造后通过构造函数注入到各个服务。
 */
package club.ppmc.ideabridge.config;

import club.ppmc.ideabridge.core.CompletionBridge;
import club.ppmc.ideabridge.core.OperationClass;
import club.ppmc.ideabridge.core.OperationLockRegistry;
import club.ppmc.ideabridge.core.ResultCache;
import club.ppmc.ideabridge.core.RetryPolicy;
import club.ppmc.ideabridge.core.TestResultExtractor;
import club.ppmc.ideabridge.host.ApplicationDispatcher;
import club.ppmc.ideabridge.host.CompilerHost;
import club.ppmc.ideabridge.host.local.ExecutorApplicationDispatcher;
import club.ppmc.ideabridge.model.RunCategory;
import club.ppmc.ideabridge.service.RunRegistryService;
import java.time.Duration;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BridgeConfig {

    @Bean
    public BridgeProperties bridgeProperties(
            @Value("${bridge.lock.acquire-timeout:5s}") Duration lockAcquireTimeout,
            @Value("${bridge.lock.upstream-max-wait:60s}") Duration upstreamMaxWait,
            @Value("${bridge.lock.upstream-poll-interval:500ms}") Duration upstreamPollInterval,
            @Value("${bridge.timeouts.build:5m}") Duration buildTimeout,
            @Value("${bridge.timeouts.test:300s}") Duration testTimeout,
            @Value("${bridge.timeouts.run-start:30s}") Duration runStartTimeout,
            @Value("${bridge.timeouts.debug-call:5s}") Duration debugCallTimeout,
            @Value("${bridge.timeouts.debug-evaluate:10s}") Duration debugEvaluateTimeout,
            @Value("${bridge.runs.output-capacity:1000000}") int outputCapacity,
            @Value("${bridge.runs.retention:1h}") Duration runRetention,
            @Value("${bridge.test.extraction.max-attempts:5}") int extractionAttempts,
            @Value("${bridge.test.extraction.delay:200ms}") Duration extractionDelay) {
        return new BridgeProperties(
                lockAcquireTimeout,
                upstreamMaxWait,
                upstreamPollInterval,
                buildTimeout,
                testTimeout,
                runStartTimeout,
                debugCallTimeout,
                debugEvaluateTimeout,
                outputCapacity,
                runRetention,
                RetryPolicy.of(extractionAttempts, extractionDelay));
    }

    /**
     * 唯一的应用上下文线程。
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorApplicationDispatcher applicationDispatcher() {
        return new ExecutorApplicationDispatcher();
    }

    @Bean
    public CompletionBridge completionBridge(ApplicationDispatcher dispatcher) {
        return new CompletionBridge(dispatcher);
    }

    /**
     * 构建锁探测编译器是否在编译（包括不是由桥接层发起的编译）；
     * 测试锁探测注册表中是否还有存活的测试进程（例如之前超时但仍在运行的测试）。
     */
    @Bean
    public OperationLockRegistry operationLockRegistry(CompilerHost compilerHost, RunRegistryService runRegistry) {
        return new OperationLockRegistry(Map.of(
                OperationClass.BUILD, compilerHost::isCompilationActive,
                OperationClass.TEST, () -> runRegistry.hasActive(RunCategory.TEST)));
    }

    @Bean
    public ResultCache resultCache() {
        return new ResultCache();
    }

    @Bean
    public TestResultExtractor testResultExtractor(BridgeProperties properties) {
        return new TestResultExtractor(properties.extractionRetry());
    }
}
