/**
 * ExecutorApplicationDispatcher.java
 *
 * 以单个命名守护线程实现的应用上下文。所有派发的任务按提交顺序串行执行。
 */
package club.ppmc.ideabridge.host.local;

import club.ppmc.ideabridge.host.ApplicationDispatcher;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ExecutorApplicationDispatcher implements ApplicationDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorApplicationDispatcher.class);
    public static final String THREAD_NAME = "ide-app-context";

    private final ExecutorService executor;
    private volatile Thread dispatchThread;

    public ExecutorApplicationDispatcher() {
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            dispatchThread = thread;
            return thread;
        });
    }

    @Override
    public void invokeLater(Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // 单个任务失败不能让应用上下文线程退出
                LOGGER.error("应用上下文中的任务执行失败", e);
            }
        });
    }

    @Override
    public boolean isDispatchThread() {
        return Thread.currentThread() == dispatchThread;
    }

    public void shutdown() {
        LOGGER.info("正在关闭应用上下文...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
