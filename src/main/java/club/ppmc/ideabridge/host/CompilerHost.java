/**
 * CompilerHost.java
 *
 * 宿主的编译器。compile 立即返回，编译结束后通过 CompileStatusNotification 回调。
 */
package club.ppmc.ideabridge.host;

import club.ppmc.ideabridge.model.CompileMessage;
import java.util.List;

public interface CompilerHost {

    /**
     * 发起一次编译。必须在应用上下文中调用。
     *
     * @param incremental true 为增量编译，false 为完整重新构建。
     */
    void compile(ProjectHandle project, boolean incremental, CompileStatusNotification callback);

    /**
     * @return 是否有编译正在进行，包括不是由桥接层发起的编译。
     */
    boolean isCompilationActive();

    /**
     * @return 项目最近一次编译留下的诊断信息，从未编译过时为空列表。
     */
    List<CompileMessage> lastMessages(ProjectHandle project);
}
