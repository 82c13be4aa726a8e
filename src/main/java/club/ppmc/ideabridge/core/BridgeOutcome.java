/**
 * BridgeOutcome.java
 *
 * 一次桥接调用的结果：要么是一个值，要么是一个结构化错误，二者必居其一。
 */
package club.ppmc.ideabridge.core;

import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import java.util.Objects;
import java.util.function.Function;

public final class BridgeOutcome<T> {

    private final T value;
    private final BridgeError error;

    private BridgeOutcome(T value, BridgeError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> BridgeOutcome<T> success(T value) {
        return new BridgeOutcome<>(value, null);
    }

    public static <T> BridgeOutcome<T> failure(BridgeError error) {
        return new BridgeOutcome<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> BridgeOutcome<T> failure(BridgeErrorKind kind, String message) {
        return failure(BridgeError.of(kind, message));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("失败的结果没有值: " + error.message());
        }
        return value;
    }

    public BridgeError error() {
        return error;
    }

    public boolean hasErrorKind(BridgeErrorKind kind) {
        return error != null && error.kind() == kind;
    }

    /**
     * 成功时返回映射后的值，失败时返回由错误构造的替代值。
     */
    public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<BridgeError, ? extends R> onFailure) {
        return error == null ? onSuccess.apply(value) : onFailure.apply(error);
    }

    @Override
    public String toString() {
        return error == null ? "BridgeOutcome[success=" + value + "]" : "BridgeOutcome[failure=" + error + "]";
    }
}
