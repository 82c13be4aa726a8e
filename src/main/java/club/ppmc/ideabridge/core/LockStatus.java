/**
 * LockStatus.java
 *
 * 操作锁状态快照，用于诊断。
 */
package club.ppmc.ideabridge.core;

/**
 * @param operationClass 锁所属的操作类别。
 * @param locked 当前是否被持有。
 * @param holder 持有者线程名，未持有时为 null。
 * @param heldForMs 已持有的毫秒数，未持有时为 0。
 * @param queuedCallers 正在等待获取该锁的线程数（估计值）。
 * @param externalActivity 外部触发的同类活动是否正在进行。
 */
public record LockStatus(
        OperationClass operationClass,
        boolean locked,
        String holder,
        long heldForMs,
        int queuedCallers,
        boolean externalActivity) {}
