/**
 * OperationLockRegistry.java
 *
 * 进程内唯一的操作锁集合，每个 OperationClass 一把锁。
 * 每把锁携带该类别的外部活动探测器，由 BridgeConfig 在启动时装配。
 */
package club.ppmc.ideabridge.core;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

public class OperationLockRegistry {

    private final Map<OperationClass, OperationLock> locks = new EnumMap<>(OperationClass.class);

    /**
     * @param probes 每个类别的外部活动探测器，缺失的类别视为永远没有外部活动。
     */
    public OperationLockRegistry(Map<OperationClass, BooleanSupplier> probes) {
        for (OperationClass operationClass : OperationClass.values()) {
            BooleanSupplier probe = probes.getOrDefault(operationClass, () -> false);
            locks.put(operationClass, new OperationLock(operationClass, probe));
        }
    }

    public OperationLock lock(OperationClass operationClass) {
        return locks.get(operationClass);
    }

    public List<LockStatus> statuses() {
        var result = new ArrayList<LockStatus>();
        locks.values().forEach(lock -> result.add(lock.status()));
        return result;
    }

    public LockResetReport reset(OperationClass operationClass) {
        return lock(operationClass).reset();
    }
}
