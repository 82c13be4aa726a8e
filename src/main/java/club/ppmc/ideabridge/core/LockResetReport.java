/**
 * LockResetReport.java
 *
 * reset() 的结果报告。reset 只是诊断/恢复手段，不保证解锁：锁被其他线程持有时只会报告，不会强制释放。
 */
package club.ppmc.ideabridge.core;

/**
 * @param operationClass 锁所属的操作类别。
 * @param outcome 重置结果。
 * @param holder 锁被其他线程持有时的持有者线程名。
 * @param message 面向人的说明。
 */
public record LockResetReport(OperationClass operationClass, Outcome outcome, String holder, String message) {

    public enum Outcome {
        /** 调用线程持有该锁，已释放。 */
        RELEASED,
        /** 探测性获取并释放成功，锁当前可用。 */
        AVAILABLE,
        /** 锁被其他线程持有，未做任何改变。 */
        HELD_ELSEWHERE
    }
}
