package club.ppmc.ideabridge.core;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.ideabridge.host.local.ExecutorApplicationDispatcher;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class CompletionBridgeTest {

    private final ExecutorApplicationDispatcher dispatcher = new ExecutorApplicationDispatcher();
    private final CompletionBridge bridge = new CompletionBridge(dispatcher);

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    void returnsValueCompletedFromCallback() {
        BridgeOutcome<String> outcome = bridge.await(
                TimeoutPolicy.of("echo", Duration.ofSeconds(2)),
                completion -> new Thread(() -> completion.complete("done")).start());

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.value()).isEqualTo("done");
    }

    @Test
    void workRunsOnDispatchThread() {
        BridgeOutcome<String> outcome = bridge.await(
                TimeoutPolicy.of("thread", Duration.ofSeconds(2)),
                completion -> completion.complete(Thread.currentThread().getName()));

        assertThat(outcome.value()).isEqualTo(ExecutorApplicationDispatcher.THREAD_NAME);
    }

    @Test
    void neverCompletingWorkTimesOutWithinBudget() {
        long start = System.nanoTime();

        BridgeOutcome<String> outcome = bridge.await(
                TimeoutPolicy.of("silent", Duration.ofMillis(200)), completion -> {});

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        assertThat(outcome.hasErrorKind(BridgeErrorKind.OPERATION_TIMEOUT)).isTrue();
        assertThat(elapsed).isLessThan(Duration.ofMillis(1200));
    }

    @Test
    void lateCompletionAfterTimeoutIsIgnored() throws InterruptedException {
        var handle = new AtomicReference<Completion<String>>();
        BridgeOutcome<String> outcome = bridge.await(
                TimeoutPolicy.of("late", Duration.ofMillis(100)), handle::set);

        assertThat(outcome.hasErrorKind(BridgeErrorKind.OPERATION_TIMEOUT)).isTrue();
        assertThat(handle.get().complete("too late")).isFalse();
        assertThat(handle.get().isDone()).isTrue();
    }

    @Test
    void onlyFirstSignalDecidesResult() {
        BridgeOutcome<String> outcome = bridge.await(
                TimeoutPolicy.of("twice", Duration.ofSeconds(2)),
                completion -> {
                    completion.complete("first");
                    completion.complete("second");
                    completion.fail(BridgeErrorKind.HOST_ERROR, "third");
                });

        assertThat(outcome.value()).isEqualTo("first");
    }

    @Test
    void exceptionInWorkBecomesInternalError() {
        BridgeOutcome<String> outcome = bridge.await(
                TimeoutPolicy.of("boom", Duration.ofSeconds(2)),
                completion -> {
                    throw new IllegalStateException("boom");
                });

        assertThat(outcome.hasErrorKind(BridgeErrorKind.INTERNAL_ERROR)).isTrue();
        assertThat(outcome.error().faultType()).isEqualTo("IllegalStateException");
    }

    @Test
    void refusesToBlockOnDispatchThread() throws InterruptedException {
        var nested = new AtomicReference<BridgeOutcome<String>>();
        var done = new CountDownLatch(1);
        dispatcher.invokeLater(() -> {
            nested.set(bridge.await(TimeoutPolicy.of("nested", Duration.ofSeconds(5)),
                    completion -> completion.complete("unreachable")));
            done.countDown();
        });

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(nested.get().hasErrorKind(BridgeErrorKind.INTERNAL_ERROR)).isTrue();
    }

    @Test
    void queuedWorkIsSkippedAfterTimeout() throws InterruptedException {
        var blocker = new CountDownLatch(1);
        dispatcher.invokeLater(() -> {
            try {
                blocker.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        var ran = new AtomicBoolean();

        BridgeOutcome<String> outcome = bridge.await(
                TimeoutPolicy.of("queued", Duration.ofMillis(100)),
                completion -> {
                    ran.set(true);
                    completion.complete("ran");
                });
        blocker.countDown();
        var drained = new CountDownLatch(1);
        dispatcher.invokeLater(drained::countDown);

        assertThat(drained.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(outcome.hasErrorKind(BridgeErrorKind.OPERATION_TIMEOUT)).isTrue();
        assertThat(ran.get()).isFalse();
    }
}
