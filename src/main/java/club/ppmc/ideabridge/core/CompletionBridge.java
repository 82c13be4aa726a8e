/**
 * CompletionBridge.java
 *
 * 异步完成桥：把宿主应用上下文中基于回调的完成信号，转换为调用方线程可以带超时阻塞等待的结果。
 *
 * 工作流程：
 * 1. 工作被投递到 ApplicationDispatcher（唯一的应用上下文）上执行，并拿到一个 Completion 句柄；
 * 2. 宿主在完成时通过句柄回调，结果只会被确定一次；
 * 3. 调用方线程在 Future 上最多阻塞 TimeoutPolicy 指定的时间。
 *
 * 超时后立即返回 OPERATION_TIMEOUT。已派发的宿主任务可能仍在运行，桥不会尝试取消不属于它的任务。
 */
package club.ppmc.ideabridge.core;

import club.ppmc.ideabridge.host.ApplicationDispatcher;
import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class CompletionBridge {

    private final ApplicationDispatcher dispatcher;

    public CompletionBridge(ApplicationDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * 将工作派发到应用上下文并阻塞等待其完成。
     *
     * @param policy 超时策略。
     * @param work 在应用上下文中执行的工作，必须最终通过 Completion 发出完成信号。
     * @return 工作的结果，或者 OPERATION_TIMEOUT / INTERNAL_ERROR 等结构化错误。
     */
    public <T> BridgeOutcome<T> await(TimeoutPolicy policy, Consumer<Completion<T>> work) {
        if (dispatcher.isDispatchThread()) {
            // 在应用上下文中阻塞等待自己派发的工作必然死锁
            log.error("操作 '{}' 在应用上下文线程上请求阻塞等待，已拒绝。", policy.operation());
            return BridgeOutcome.failure(
                    BridgeErrorKind.INTERNAL_ERROR, "不能在应用上下文线程上同步等待操作: " + policy.operation());
        }

        var completion = new Completion<T>(policy.operation());
        try {
            dispatcher.invokeLater(() -> runGuarded(policy, work, completion));
        } catch (RejectedExecutionException e) {
            log.error("应用上下文拒绝了操作 '{}'，可能已关闭。", policy.operation(), e);
            return BridgeOutcome.failure(BridgeError.fault(e));
        }

        try {
            return completion.future().get(policy.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            BridgeOutcome<T> timedOut = BridgeOutcome.failure(policy.timeoutError());
            if (completion.resolve(timedOut)) {
                log.warn("操作 '{}' 在 {} 毫秒后超时，宿主端任务未被取消。", policy.operation(), policy.timeout().toMillis());
                return timedOut;
            }
            // 超时与完成信号恰好同时到达，以先确定的结果为准
            return completion.future().getNow(timedOut);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            completion.resolve(BridgeOutcome.failure(BridgeErrorKind.INTERNAL_ERROR, "等待被中断"));
            log.warn("等待操作 '{}' 时线程被中断。", policy.operation());
            return BridgeOutcome.failure(
                    new BridgeError(BridgeErrorKind.INTERNAL_ERROR, "等待操作被中断: " + policy.operation(),
                            InterruptedException.class.getSimpleName()));
        } catch (ExecutionException e) {
            // future 只会被正常完成，这里仅作兜底
            log.error("操作 '{}' 的结果 Future 异常完成", policy.operation(), e.getCause());
            return BridgeOutcome.failure(BridgeError.fault(e.getCause()));
        }
    }

    private <T> void runGuarded(TimeoutPolicy policy, Consumer<Completion<T>> work, Completion<T> completion) {
        if (completion.isDone()) {
            log.debug("操作 '{}' 在开始执行前已超时，跳过派发。", policy.operation());
            return;
        }
        try {
            work.accept(completion);
        } catch (RuntimeException e) {
            log.error("操作 '{}' 在应用上下文中执行失败", policy.operation(), e);
            completion.fail(BridgeError.fault(e));
        }
    }
}
