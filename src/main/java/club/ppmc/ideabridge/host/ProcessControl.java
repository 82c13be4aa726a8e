/**
 * ProcessControl.java
 *
 * 已启动进程的控制句柄。
 */
package club.ppmc.ideabridge.host;

public interface ProcessControl {

    long pid();

    boolean isAlive();

    /**
     * 发送终止信号，不等待进程退出。退出状态仍由 ProcessListener.onTerminated 报告。
     */
    void destroy();
}
