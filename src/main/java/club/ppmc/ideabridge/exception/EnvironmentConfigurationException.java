/**
 * EnvironmentConfigurationException.java
 *
 * 一个自定义的运行时异常，用于表示执行环境（如JDK、Maven）未正确配置。
 * 编译与测试宿主在启动工具链前进行环境校验，失败时抛出此异常，
 * 服务层再将其转换为 ENVIRONMENT_MISCONFIGURED 类型的 BridgeError。
 */
package club.ppmc.ideabridge.exception;

import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import java.util.Map;
import lombok.Getter;

@Getter
public class EnvironmentConfigurationException extends RuntimeException {

    /** 缺失或无效的组件名称 ("jdk", "maven")。 */
    private final String missingComponent;

    /** (可选) 如果是JDK问题，这里可以指明需要的版本。 */
    private final String requiredVersion;

    public EnvironmentConfigurationException(String message, String missingComponent, String requiredVersion) {
        super(message);
        this.missingComponent = missingComponent;
        this.requiredVersion = requiredVersion;
    }

    /**
     * 将异常信息转换为一个Map，便于写入日志或诊断输出。
     */
    public Map<String, Object> toErrorData() {
        return Map.of(
                "type", "ENVIRONMENT_ERROR",
                "message", getMessage(),
                "missing", getMissingComponent(),
                "requiredVersion", getRequiredVersion() != null ? getRequiredVersion() : "");
    }

    public BridgeError toBridgeError() {
        return new BridgeError(BridgeErrorKind.ENVIRONMENT_MISCONFIGURED, getMessage(), getClass().getSimpleName());
    }
}
