/**
 * LockController.java
 *
 * 操作锁的诊断与恢复接口。reset 只是尽力而为：被其他线程持有的锁不会被强制释放。
 */
package club.ppmc.ideabridge.controller;

import club.ppmc.ideabridge.core.LockResetReport;
import club.ppmc.ideabridge.core.LockStatus;
import club.ppmc.ideabridge.core.OperationClass;
import club.ppmc.ideabridge.core.OperationLockRegistry;
import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/locks")
public class LockController {

    private final OperationLockRegistry lockRegistry;

    public LockController(OperationLockRegistry lockRegistry) {
        this.lockRegistry = lockRegistry;
    }

    @GetMapping
    public ResponseEntity<List<LockStatus>> statuses() {
        return ResponseEntity.ok(lockRegistry.statuses());
    }

    @PostMapping("/{operationClass}/reset")
    public ResponseEntity<?> reset(@PathVariable String operationClass) {
        OperationClass target;
        try {
            target = OperationClass.valueOf(operationClass.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            BridgeError error = BridgeError.of(BridgeErrorKind.VALIDATION_FAILED, String.format(
                    "未知的操作类别 '%s'，可选值: %s", operationClass, Arrays.toString(OperationClass.values())));
            return BridgeResponses.of(Map.of("error", error), error);
        }
        LockResetReport report = lockRegistry.reset(target);
        return ResponseEntity.ok(report);
    }
}
