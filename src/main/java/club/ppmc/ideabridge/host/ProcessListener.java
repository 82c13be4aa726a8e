/**
 * ProcessListener.java
 *
 * 进程事件监听器。必须在进程启动之前挂上，以免丢失最早的输出。
 */
package club.ppmc.ideabridge.host;

public interface ProcessListener {

    /**
     * 进程输出了一段文本（标准输出与标准错误已合并）。
     */
    void onOutput(String text);

    /**
     * 进程已退出且输出已读完。无论是自然退出还是被 stop 终止，都只会调用一次。
     */
    void onTerminated(int exitCode);
}
