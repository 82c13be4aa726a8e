/**
 * DebugSessionManager.java
 *
 * 宿主的调试会话管理器，同时保存用户设置的断点（断点跨会话保留）。
 */
package club.ppmc.ideabridge.host.debug;

import club.ppmc.ideabridge.model.debug.BreakpointInfo;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface DebugSessionManager {

    List<DebugSession> sessions();

    /**
     * @return 当前会话（最近一次附加的、尚未结束的会话）。
     */
    Optional<DebugSession> currentSession();

    /**
     * 附加到本机指定端口上以 JDWP 监听的虚拟机，成为新的当前会话。
     */
    DebugSession attach(String name, int port) throws IOException;

    /**
     * 断开当前会话。没有会话时什么也不做。
     */
    void detachCurrent();

    List<BreakpointInfo> breakpoints();

    /**
     * @return 断点是新加入的返回 true，已存在返回 false。
     */
    boolean setBreakpoint(String file, int line);

    /**
     * @return 断点存在并被移除返回 true。
     */
    boolean removeBreakpoint(String file, int line);
}
