/**
 * ApplicationDispatcher.java
 *
 * 宿主环境唯一的“应用上下文”。所有会修改宿主状态（项目、运行配置、调试会话）的操作
 * 都必须通过 invokeLater 投递到这里执行，而不是直接在调用方线程上执行。
 */
package club.ppmc.ideabridge.host;

public interface ApplicationDispatcher {

    /**
     * 将任务排队到应用上下文中异步执行。
     */
    void invokeLater(Runnable task);

    /**
     * @return 当前线程是否就是应用上下文线程。
     */
    boolean isDispatchThread();
}
