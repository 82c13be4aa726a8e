/**
 * CompileStatusNotification.java
 *
 * 编译完成回调，由编译宿主在应用上下文中调用。
 */
package club.ppmc.ideabridge.host;

import club.ppmc.ideabridge.model.CompileMessage;
import java.util.List;

@FunctionalInterface
public interface CompileStatusNotification {

    /**
     * @param aborted 编译是否被中止（例如工具链无法启动）。
     * @param messages 编译产生的错误与警告。
     */
    void finished(boolean aborted, List<CompileMessage> messages);
}
