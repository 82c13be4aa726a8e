/**
 * LockAcquisition.java
 *
 * 一次获取操作锁的结果。获取成功时，close() 会释放锁，配合 try-with-resources 保证锁在任何路径上都被释放。
 * 获取失败时 close() 什么也不做。
 */
package club.ppmc.ideabridge.core;

import club.ppmc.ideabridge.model.BridgeError;

public final class LockAcquisition implements AutoCloseable {

    private final OperationLock lock;
    private final BridgeError error;
    private boolean released;

    private LockAcquisition(OperationLock lock, BridgeError error) {
        this.lock = lock;
        this.error = error;
    }

    static LockAcquisition acquired(OperationLock lock) {
        return new LockAcquisition(lock, null);
    }

    static LockAcquisition failed(OperationLock lock, BridgeError error) {
        return new LockAcquisition(lock, error);
    }

    public boolean acquired() {
        return error == null;
    }

    public BridgeError error() {
        return error;
    }

    public OperationClass operationClass() {
        return lock.operationClass();
    }

    @Override
    public void close() {
        if (error == null && !released) {
            released = true;
            lock.release();
        }
    }
}
