/**
 * Settings.java
 *
 * 该文件定义了一个POJO，用于表示和持久化桥接服务的环境配置和运行配置。
 * 由 SettingsService 负责加载和保存到工作区的 .ide/settings.json 文件中。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.ideabridge.model;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

@Data
public class Settings {

    /**
     * 工作区根目录的路径。工作区中每个包含 pom.xml 的子目录都是一个项目。
     */
    private String workspaceRoot = "./workspace";

    /**
     * Maven 的主目录（MAVEN_HOME），例如 "/opt/apache-maven-3.9.6"。
     */
    private String mavenHome;

    /**
     * 存储多个 JDK 版本的路径。
     * Key: JDK标识符, 如 "jdk11", "jdk17"。
     * Value: 对应JDK的 java 可执行文件的绝对路径。
     */
    private Map<String, String> jdkPaths = new HashMap<>();

    /**
     * 具名运行配置，按名称查找。
     */
    private Map<String, RunConfiguration> runConfigurations = new LinkedHashMap<>();
}
