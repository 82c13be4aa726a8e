/**
 * OperationLock.java
 *
 * 按操作类别划分的互斥门。保证同一类别（如“构建”、“测试”）在同一时刻最多只有一个实例越过锁获取。
 *
 * 除了带超时的获取以外，它还提供：
 * - 外部活动探测：在获取前轮询是否有由外部（例如 IDE 自身界面、之前已超时但仍在运行的任务）触发的同类活动，并等待其结束；
 * - 尽力而为的 reset()：仅用于诊断与恢复，不保证一定能解锁。
 *
 * 锁基于公平的 ReentrantLock，但拒绝同一线程的重入获取，以保持“每类最多一个实例”的约束。
 */
package club.ppmc.ideabridge.core;

import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OperationLock {

    private final OperationClass operationClass;
    private final BooleanSupplier externalActivityProbe;
    private final ReentrantLock lock = new ReentrantLock(true);

    private volatile String holder;
    private volatile long acquiredAtMillis;

    public OperationLock(OperationClass operationClass, BooleanSupplier externalActivityProbe) {
        this.operationClass = operationClass;
        this.externalActivityProbe = externalActivityProbe;
    }

    public OperationClass operationClass() {
        return operationClass;
    }

    /**
     * 在给定时间内尝试获取锁。超时不会抛出异常，而是返回一个携带 LOCK_ACQUISITION_TIMEOUT 的失败结果。
     */
    public LockAcquisition acquire(Duration timeout) {
        if (lock.isHeldByCurrentThread()) {
            return LockAcquisition.failed(this, BridgeError.of(
                    BridgeErrorKind.LOCK_ACQUISITION_TIMEOUT,
                    String.format("当前线程已持有%s锁，同一类操作不能嵌套执行。", operationClass.displayName())));
        }
        try {
            if (lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                holder = Thread.currentThread().getName();
                acquiredAtMillis = System.currentTimeMillis();
                log.debug("{}锁已被线程 {} 获取。", operationClass.displayName(), holder);
                return LockAcquisition.acquired(this);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LockAcquisition.failed(this, new BridgeError(
                    BridgeErrorKind.LOCK_ACQUISITION_TIMEOUT,
                    String.format("等待%s锁时线程被中断。", operationClass.displayName()),
                    InterruptedException.class.getSimpleName()));
        }
        String currentHolder = holder;
        log.warn("在 {} 毫秒内未能获取{}锁，当前持有者: {}", timeout.toMillis(), operationClass.displayName(), currentHolder);
        return LockAcquisition.failed(this, BridgeError.of(
                BridgeErrorKind.LOCK_ACQUISITION_TIMEOUT,
                String.format("另一个%s操作正在进行中（持有者: %s），%d 毫秒内未能获取锁。请稍后重试，或调用 reset。",
                        operationClass.displayName(), currentHolder, timeout.toMillis())));
    }

    void release() {
        if (!lock.isHeldByCurrentThread()) {
            log.warn("线程 {} 试图释放并未持有的{}锁，已忽略。", Thread.currentThread().getName(), operationClass.displayName());
            return;
        }
        if (lock.getHoldCount() == 1) {
            holder = null;
            acquiredAtMillis = 0;
        }
        lock.unlock();
        log.debug("{}锁已释放。", operationClass.displayName());
    }

    public boolean isLocked() {
        return lock.isLocked();
    }

    public boolean isExternallyActive() {
        try {
            return externalActivityProbe.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("探测{}类外部活动时出错，按无活动处理: {}", operationClass.displayName(), e.getMessage());
            return false;
        }
    }

    /**
     * 在获取锁之前调用：轮询是否有外部触发的同类活动，并等待其结束。
     *
     * @param maxWait 最长等待时间。
     * @param pollInterval 轮询间隔。
     * @return 成功时为实际等待的时长；超时为 UPSTREAM_ACTIVITY_TIMEOUT。
     */
    public BridgeOutcome<Duration> waitForExternalActivity(Duration maxWait, Duration pollInterval) {
        long start = System.nanoTime();
        long deadline = start + maxWait.toNanos();
        boolean announced = false;
        while (isExternallyActive()) {
            long now = System.nanoTime();
            if (now >= deadline) {
                log.warn("等待外部{}活动结束超时（{} 毫秒）。", operationClass.displayName(), maxWait.toMillis());
                return BridgeOutcome.failure(
                        BridgeErrorKind.UPSTREAM_ACTIVITY_TIMEOUT,
                        String.format("已有一个外部触发的%s活动在进行，%d 毫秒内未结束。请稍后重试。",
                                operationClass.displayName(), maxWait.toMillis()));
            }
            if (!announced) {
                log.info("检测到外部触发的{}活动，等待其结束...", operationClass.displayName());
                announced = true;
            }
            try {
                long sleepNanos = Math.min(pollInterval.toNanos(), deadline - now);
                TimeUnit.NANOSECONDS.sleep(Math.max(sleepNanos, 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return BridgeOutcome.failure(new BridgeError(
                        BridgeErrorKind.UPSTREAM_ACTIVITY_TIMEOUT,
                        String.format("等待外部%s活动时线程被中断。", operationClass.displayName()),
                        InterruptedException.class.getSimpleName()));
            }
        }
        return BridgeOutcome.success(Duration.ofNanos(System.nanoTime() - start));
    }

    /**
     * 显式的恢复手段，结果不具有权威性：
     * 调用线程持有锁时将其释放；否则做一次非阻塞的探测获取/释放，锁被其他线程持有时只报告，不强制释放。
     */
    public LockResetReport reset() {
        String name = operationClass.displayName();
        if (lock.isHeldByCurrentThread()) {
            holder = null;
            acquiredAtMillis = 0;
            while (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
            log.info("reset: 调用线程持有的{}锁已释放。", name);
            return new LockResetReport(operationClass, LockResetReport.Outcome.RELEASED, null, name + "锁已由调用线程释放。");
        }
        if (lock.tryLock()) {
            lock.unlock();
            return new LockResetReport(operationClass, LockResetReport.Outcome.AVAILABLE, null, name + "锁当前可用。");
        }
        String currentHolder = holder;
        log.warn("reset: {}锁被线程 {} 持有，未强制释放。", name, currentHolder);
        return new LockResetReport(
                operationClass,
                LockResetReport.Outcome.HELD_ELSEWHERE,
                currentHolder,
                String.format("%s锁被 %s 持有（已持有 %d 毫秒），reset 不会强制释放；请等待该操作结束或超时。",
                        name, currentHolder, heldForMillis()));
    }

    public LockStatus status() {
        boolean locked = lock.isLocked();
        return new LockStatus(
                operationClass,
                locked,
                locked ? holder : null,
                locked ? heldForMillis() : 0,
                lock.getQueueLength(),
                isExternallyActive());
    }

    private long heldForMillis() {
        long since = acquiredAtMillis;
        return since == 0 ? 0 : System.currentTimeMillis() - since;
    }
}
