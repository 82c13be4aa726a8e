/**
 * RunConfiguration.java
 *
 * 一个具名的运行配置，保存在 Settings 中，由用户在 .ide/settings.json 里编辑。
 * 它是一个可变对象，以便于Jackson库进行序列化和反序列化。
 */
package club.ppmc.ideabridge.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunConfiguration {

    /**
     * 命令及其参数，例如 ["java", "-cp", "target/classes", "com.example.Main"]。
     */
    private List<String> command = new ArrayList<>();

    /**
     * 相对于项目根目录的工作目录。为空时使用项目根目录。
     */
    private String workingDirectory;

    /**
     * 追加到进程环境中的变量。
     */
    private Map<String, String> environment = new HashMap<>();
}
