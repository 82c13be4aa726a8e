/**
 * TestNode.java
 *
 * 测试结果树中的一个节点。叶子节点是测试用例，非叶子节点是测试套件。
 */
package club.ppmc.ideabridge.host;

import java.util.List;

/**
 * @param name 节点名。用例可能是 {@code method(com.example.FooTest)} 形式，也可能只是方法名。
 * @param leaf 是否为测试用例。
 * @param state 用例状态，套件节点为 UNKNOWN。
 * @param errorMessage 失败时的诊断信息（通常包含异常类型）。
 * @param stacktrace 失败时的堆栈。
 * @param durationMs 耗时，毫秒。
 * @param children 子节点。
 */
public record TestNode(
        String name,
        boolean leaf,
        State state,
        String errorMessage,
        String stacktrace,
        long durationMs,
        List<TestNode> children) {

    public TestNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static TestNode suite(String name, List<TestNode> children) {
        return new TestNode(name, false, State.UNKNOWN, null, null, 0, children);
    }

    public static TestNode testCase(String name, State state, String errorMessage, String stacktrace, long durationMs) {
        return new TestNode(name, true, state, errorMessage, stacktrace, durationMs, List.of());
    }

    public enum State {
        PASSED,
        IGNORED,
        DEFECT,
        UNKNOWN
    }
}
