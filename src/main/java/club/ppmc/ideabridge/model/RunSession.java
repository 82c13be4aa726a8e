/**
 * RunSession.java
 *
 * 运行注册表中的一个条目，代表一个由桥接层启动的进程。
 * 输出由进程监听器写入有界缓冲区；退出码只由终止监听器写入，stop 请求不直接修改状态。
 */
package club.ppmc.ideabridge.model;

import club.ppmc.ideabridge.core.OutputBuffer;
import club.ppmc.ideabridge.host.ProcessControl;
import java.time.Instant;
import lombok.Getter;

@Getter
public class RunSession {

    private final String id;
    private final long sequence;
    private final String configName;
    private final String projectName;
    private final RunCategory category;
    private final Instant startTime;
    private final OutputBuffer output;

    private volatile Integer exitCode;
    private volatile boolean running = true;
    private volatile boolean failedToStart;
    private volatile String failureReason;
    private volatile ProcessControl processControl;

    public RunSession(
            String id,
            long sequence,
            String configName,
            String projectName,
            RunCategory category,
            Instant startTime,
            int outputCapacity) {
        this.id = id;
        this.sequence = sequence;
        this.configName = configName;
        this.projectName = projectName;
        this.category = category;
        this.startTime = startTime;
        this.output = new OutputBuffer(outputCapacity);
    }

    public void attach(ProcessControl control) {
        this.processControl = control;
    }

    /**
     * 退出码先于 running 写入，读到 running == false 的线程一定能看到退出码。
     */
    public synchronized void markTerminated(int code) {
        if (!running) {
            return;
        }
        this.exitCode = code;
        this.running = false;
    }

    public synchronized void markFailedToStart(String reason) {
        output.append("[启动失败] " + reason + "\n");
        this.failureReason = reason;
        this.failedToStart = true;
        this.running = false;
    }

    public RunSummary toSummary() {
        return new RunSummary(id, configName, projectName, category, startTime, running, exitCode, failedToStart);
    }
}
