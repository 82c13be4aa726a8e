/**
 * DebugSession.java
 *
 * 一个回调风格的调试会话。除 name/isSuspended 外的方法都必须在应用上下文中调用；
 * 结果通过容器回调异步送达，可能分多次到达。
 */
package club.ppmc.ideabridge.host.debug;

import java.util.Optional;

public interface DebugSession {

    String name();

    boolean isSuspended();

    void pause();

    void resume();

    void stepOver();

    void stepInto();

    void stepOut();

    /**
     * 计算挂起线程的调用栈，通过 container 分批送达，最后一批 last=true。
     */
    void computeStackFrames(StackFrameContainer container);

    /**
     * 计算指定栈帧中可见的变量。
     */
    void computeChildren(int frameIndex, ChildrenContainer container);

    /**
     * @return 当前挂起位置可用的表达式求值器。未挂起或不支持求值时为空。
     */
    Optional<ExpressionEvaluator> evaluator();
}
