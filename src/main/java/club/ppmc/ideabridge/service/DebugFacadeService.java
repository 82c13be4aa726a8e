/**
 * DebugFacadeService.java
 *
 * 同步调试门面：把回调风格的调试会话操作（暂停、继续、单步、求值、调用栈、变量）包装为带超时的同步调用。
 * 前置条件（存在会话、会话已暂停、存在求值器）在派发之前检查，不满足时直接返回对应错误，不占用应用上下文。
 * 调用栈和变量可能分多次回调送达，在同一个超时预算内等待最后一批（last=true）或错误信号。
 */
package club.ppmc.ideabridge.service;

import club.ppmc.ideabridge.config.BridgeProperties;
import club.ppmc.ideabridge.core.BridgeOutcome;
import club.ppmc.ideabridge.core.Completion;
import club.ppmc.ideabridge.core.CompletionBridge;
import club.ppmc.ideabridge.core.TimeoutPolicy;
import club.ppmc.ideabridge.host.debug.ChildrenContainer;
import club.ppmc.ideabridge.host.debug.DebugSession;
import club.ppmc.ideabridge.host.debug.DebugSessionManager;
import club.ppmc.ideabridge.host.debug.ExpressionEvaluator;
import club.ppmc.ideabridge.host.debug.StackFrameContainer;
import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import club.ppmc.ideabridge.model.debug.BreakpointListResult;
import club.ppmc.ideabridge.model.debug.BreakpointResult;
import club.ppmc.ideabridge.model.debug.DebugEvaluateResult;
import club.ppmc.ideabridge.model.debug.DebugSessionInfo;
import club.ppmc.ideabridge.model.debug.DebugSessionsResult;
import club.ppmc.ideabridge.model.debug.DebugStackResult;
import club.ppmc.ideabridge.model.debug.DebugStepResult;
import club.ppmc.ideabridge.model.debug.DebugVariablesResult;
import club.ppmc.ideabridge.model.debug.StackFrameInfo;
import club.ppmc.ideabridge.model.debug.VariableInfo;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DebugFacadeService {

    private final DebugSessionManager sessionManager;
    private final CompletionBridge bridge;
    private final BridgeProperties properties;

    public DebugFacadeService(DebugSessionManager sessionManager, CompletionBridge bridge, BridgeProperties properties) {
        this.sessionManager = sessionManager;
        this.bridge = bridge;
        this.properties = properties;
    }

    public DebugSessionsResult listSessions() {
        Optional<DebugSession> current = sessionManager.currentSession();
        List<DebugSessionInfo> sessions = sessionManager.sessions().stream()
                .map(session -> new DebugSessionInfo(
                        session.name(), session.isSuspended(), current.map(c -> c == session).orElse(false)))
                .toList();
        return new DebugSessionsResult(sessions);
    }

    public DebugStepResult pause() {
        return control("pause", false, DebugSession::pause, "已暂停。");
    }

    /**
     * 只有已暂停的会话才能继续运行。
     */
    public DebugStepResult resume() {
        return control("resume", true, DebugSession::resume, "已继续运行。");
    }

    public DebugStepResult stepOver() {
        return control("stepOver", true, DebugSession::stepOver, "已执行步过。");
    }

    public DebugStepResult stepInto() {
        return control("stepInto", true, DebugSession::stepInto, "已执行步入。");
    }

    public DebugStepResult stepOut() {
        return control("stepOut", true, DebugSession::stepOut, "已执行步出。");
    }

    private DebugStepResult control(String action, boolean requireSuspended, Consumer<DebugSession> op, String message) {
        BridgeOutcome<DebugSession> session = requireSession(requireSuspended);
        if (!session.isSuccess()) {
            return DebugStepResult.failed(action, session.error());
        }
        BridgeOutcome<String> outcome = bridge.await(
                TimeoutPolicy.of("调试操作 " + action, properties.debugCallTimeout()),
                completion -> {
                    op.accept(session.value());
                    completion.complete(message);
                });
        return outcome.fold(done -> DebugStepResult.done(action, done), error -> DebugStepResult.failed(action, error));
    }

    public DebugStackResult getStack() {
        BridgeOutcome<DebugSession> session = requireSession(true);
        if (!session.isSuccess()) {
            return DebugStackResult.failed(session.error());
        }
        BridgeOutcome<List<StackFrameInfo>> outcome = bridge.await(
                TimeoutPolicy.of("获取调用栈", properties.debugEvaluateTimeout()),
                completion -> session.value().computeStackFrames(new CollectingFrames(completion)));
        return outcome.fold(
                frames -> new DebugStackResult(true, session.value().name(), frames, null),
                DebugStackResult::failed);
    }

    public DebugVariablesResult getVariables(int frameIndex) {
        BridgeOutcome<DebugSession> session = requireSession(true);
        if (!session.isSuccess()) {
            return DebugVariablesResult.failed(frameIndex, session.error());
        }
        DebugSession debugSession = session.value();
        BridgeOutcome<List<VariableInfo>> outcome = bridge.await(
                TimeoutPolicy.of("获取变量", properties.debugEvaluateTimeout()),
                completion -> {
                    var frames = new CompletionAdapter<List<StackFrameInfo>>(completion, frameList -> {
                        if (frameIndex < 0 || frameIndex >= frameList.size()) {
                            completion.fail(BridgeErrorKind.FRAME_NOT_FOUND, String.format(
                                    "栈帧 %d 不存在，当前调用栈共有 %d 帧。", frameIndex, frameList.size()));
                            return;
                        }
                        debugSession.computeChildren(frameIndex, new CollectingChildren(completion));
                    });
                    debugSession.computeStackFrames(new CollectingFrames(frames));
                });
        return outcome.fold(
                variables -> new DebugVariablesResult(true, frameIndex, variables, null),
                error -> DebugVariablesResult.failed(frameIndex, error));
    }

    public DebugEvaluateResult evaluate(String expression) {
        BridgeOutcome<DebugSession> session = requireSession(true);
        if (!session.isSuccess()) {
            return DebugEvaluateResult.failed(expression, session.error());
        }
        Optional<ExpressionEvaluator> evaluator = session.value().evaluator();
        if (evaluator.isEmpty()) {
            return DebugEvaluateResult.failed(expression,
                    BridgeError.of(BridgeErrorKind.EVALUATOR_UNAVAILABLE, "当前暂停位置没有可用的表达式求值器。"));
        }
        BridgeOutcome<VariableInfo> outcome = bridge.await(
                TimeoutPolicy.of("表达式求值", properties.debugEvaluateTimeout()),
                completion -> evaluator.get().evaluate(expression, new ExpressionEvaluator.EvaluationCallback() {
                    @Override
                    public void evaluated(VariableInfo result) {
                        completion.complete(result);
                    }

                    @Override
                    public void errorOccurred(String message) {
                        completion.fail(BridgeErrorKind.HOST_ERROR, message);
                    }
                }));
        return outcome.fold(
                result -> new DebugEvaluateResult(true, expression, result.value(), result.type(), null),
                error -> DebugEvaluateResult.failed(expression, error));
    }

    public BreakpointListResult listBreakpoints() {
        return new BreakpointListResult(sessionManager.breakpoints());
    }

    public BreakpointResult setBreakpoint(String file, int line) {
        BridgeOutcome<Boolean> outcome = bridge.await(
                TimeoutPolicy.of("设置断点", properties.debugCallTimeout()),
                completion -> completion.complete(sessionManager.setBreakpoint(file, line)));
        return outcome.fold(
                added -> new BreakpointResult(true, file, line, added ? "断点已设置。" : "断点已存在。", null),
                error -> new BreakpointResult(false, file, line, null, error));
    }

    public BreakpointResult removeBreakpoint(String file, int line) {
        BridgeOutcome<Boolean> outcome = bridge.await(
                TimeoutPolicy.of("移除断点", properties.debugCallTimeout()),
                completion -> completion.complete(sessionManager.removeBreakpoint(file, line)));
        return outcome.fold(
                removed -> new BreakpointResult(true, file, line, removed ? "断点已移除。" : "该位置没有断点。", null),
                error -> new BreakpointResult(false, file, line, null, error));
    }

    private BridgeOutcome<DebugSession> requireSession(boolean suspended) {
        Optional<DebugSession> session = sessionManager.currentSession();
        if (session.isEmpty()) {
            return BridgeOutcome.failure(BridgeErrorKind.NO_ACTIVE_DEBUG_SESSION, "当前没有活动的调试会话。");
        }
        if (suspended && !session.get().isSuspended()) {
            return BridgeOutcome.failure(BridgeErrorKind.SESSION_NOT_SUSPENDED,
                    "调试会话 '" + session.get().name() + "' 正在运行，请先暂停或等待命中断点。");
        }
        return BridgeOutcome.success(session.get());
    }

    /**
     * 把分批送达的结果累积起来，最后一批到达时交给下一步。
     */
    private static class CompletionAdapter<T> {

        private final Completion<?> completion;
        private final Consumer<T> onLast;

        CompletionAdapter(Completion<?> completion, Consumer<T> onLast) {
            this.completion = completion;
            this.onLast = onLast;
        }

        void last(T value) {
            onLast.accept(value);
        }

        void error(String message) {
            completion.fail(BridgeErrorKind.HOST_ERROR, message);
        }
    }

    private static class CollectingFrames implements StackFrameContainer {

        private final CompletionAdapter<List<StackFrameInfo>> target;
        private final List<StackFrameInfo> frames = new ArrayList<>();

        CollectingFrames(Completion<List<StackFrameInfo>> completion) {
            this(new CompletionAdapter<>(completion, completion::complete));
        }

        CollectingFrames(CompletionAdapter<List<StackFrameInfo>> target) {
            this.target = target;
        }

        @Override
        public synchronized void addStackFrames(List<StackFrameInfo> batch, boolean last) {
            frames.addAll(batch);
            if (last) {
                target.last(List.copyOf(frames));
            }
        }

        @Override
        public void errorOccurred(String message) {
            target.error(message);
        }
    }

    private static class CollectingChildren implements ChildrenContainer {

        private final Completion<List<VariableInfo>> completion;
        private final List<VariableInfo> children = new ArrayList<>();

        CollectingChildren(Completion<List<VariableInfo>> completion) {
            this.completion = completion;
        }

        @Override
        public synchronized void addChildren(List<VariableInfo> batch, boolean last) {
            children.addAll(batch);
            if (last) {
                completion.complete(List.copyOf(children));
            }
        }

        @Override
        public void errorOccurred(String message) {
            completion.fail(BridgeErrorKind.HOST_ERROR, message);
        }
    }
}
