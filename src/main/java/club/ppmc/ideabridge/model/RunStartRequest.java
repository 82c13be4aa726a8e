/**
 * RunStartRequest.java
 */
package club.ppmc.ideabridge.model;

import jakarta.validation.constraints.NotBlank;

/**
 * @param configName 运行配置名称。
 * @param projectRef 项目名称或路径。
 */
public record RunStartRequest(@NotBlank String configName, String projectRef) {}
