/**
 * Completion.java
 *
 * 交给宿主回调的一次性完成句柄。无论回调被触发多少次，只有第一次信号生效，
 * 之后的信号（包括调用方超时之后迟到的回调）只会被记录，不会改变结果。
 */
package club.ppmc.ideabridge.core;

import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class Completion<T> {

    private final String operation;
    private final CompletableFuture<BridgeOutcome<T>> future = new CompletableFuture<>();

    Completion(String operation) {
        this.operation = operation;
    }

    /**
     * @return 如果这次信号决定了结果返回 true；如果结果早已确定返回 false。
     */
    public boolean complete(T value) {
        return resolve(BridgeOutcome.success(value));
    }

    public boolean fail(BridgeError error) {
        return resolve(BridgeOutcome.failure(error));
    }

    public boolean fail(BridgeErrorKind kind, String message) {
        return fail(BridgeError.of(kind, message));
    }

    public boolean isDone() {
        return future.isDone();
    }

    boolean resolve(BridgeOutcome<T> outcome) {
        boolean first = future.complete(outcome);
        if (!first) {
            log.debug("操作 '{}' 已有结果，忽略迟到的完成信号: {}", operation, outcome);
        }
        return first;
    }

    CompletableFuture<BridgeOutcome<T>> future() {
        return future;
    }
}
