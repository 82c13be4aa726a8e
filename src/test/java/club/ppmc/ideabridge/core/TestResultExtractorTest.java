package club.ppmc.ideabridge.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import club.ppmc.ideabridge.host.TestNode;
import club.ppmc.ideabridge.host.TestNode.State;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import club.ppmc.ideabridge.model.TestCaseResult;
import club.ppmc.ideabridge.model.TestRunResult;
import club.ppmc.ideabridge.model.TestStatus;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TestResultExtractorTest {

    private final TestResultExtractor extractor = new TestResultExtractor(RetryPolicy.of(5, Duration.ofMillis(200)));

    @Test
    void emptyTreeWithZeroExitReportsNoMatchingTestsAfterAllAttempts() {
        var reads = new AtomicInteger();
        long start = System.nanoTime();

        TestRunResult result = extractor.extract(() -> {
            reads.incrementAndGet();
            return Optional.empty();
        }, 0);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        assertThat(reads.get()).isEqualTo(5);
        assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(800));
        assertThat(result.success()).isFalse();
        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.NO_MATCHING_TESTS);
    }

    @Test
    void emptyTreeWithNonZeroExitProducesSyntheticErrorCase() {
        var fast = new TestResultExtractor(RetryPolicy.of(2, Duration.ZERO));

        TestRunResult result = fast.extract(Optional::empty, 3);

        assertThat(result.success()).isFalse();
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.tests()).singleElement().satisfies(test -> {
            assertThat(test.status()).isEqualTo(TestStatus.ERROR);
            assertThat(test.className()).isEmpty();
            assertThat(test.message()).isEqualTo("Test process exited with code 3");
        });
    }

    @Test
    void readFailuresWithZeroExitReportExtractionFailed() {
        var fast = new TestResultExtractor(RetryPolicy.of(3, Duration.ZERO));

        TestRunResult result = fast.extract(() -> {
            throw new IOException("corrupt report");
        }, 0);

        assertThat(result.error().kind()).isEqualTo(BridgeErrorKind.EXTRACTION_FAILED);
        assertThat(result.error().message()).contains("corrupt report");
    }

    @Test
    void treeThatAppearsLateIsPickedUp() {
        var reads = new AtomicInteger();
        TestNode tree = TestNode.suite("com.example.FooTest",
                List.of(TestNode.testCase("works", State.PASSED, null, null, 5)));

        TestRunResult result = new TestResultExtractor(RetryPolicy.of(5, Duration.ofMillis(10)))
                .extract(() -> reads.incrementAndGet() < 3 ? Optional.empty() : Optional.of(tree), 0);

        assertThat(reads.get()).isEqualTo(3);
        assertThat(result.success()).isTrue();
        assertThat(result.passed()).isEqualTo(1);
        assertThat(result.tests().get(0).className()).isEqualTo("com.example.FooTest");
        assertThat(result.tests().get(0).methodName()).isEqualTo("works");
    }

    @Test
    void countsEachStatusAndSplitsQualifiedNames() {
        TestNode tree = TestNode.suite("project", List.of(
                TestNode.suite("com.example.CalcTest", List.of(
                        TestNode.testCase("adds(com.example.CalcTest)", State.PASSED, null, null, 3),
                        TestNode.testCase("divides(com.example.CalcTest)", State.DEFECT,
                                "org.opentest4j.AssertionFailedError: expected: <2> but was: <3>", "at ...", 4),
                        TestNode.testCase("parses(com.example.CalcTest)", State.DEFECT,
                                "java.lang.NullPointerException: null", "at ...", 1),
                        TestNode.testCase("later(com.example.CalcTest)", State.IGNORED, null, null, 0)))));

        TestRunResult result = extractor.extract(() -> Optional.of(tree), 1);

        assertThat(result.success()).isFalse();
        assertThat(result.passed()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(2);
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.tests())
                .extracting(TestCaseResult::methodName, TestCaseResult::status)
                .containsExactly(
                        tuple("adds", TestStatus.PASSED),
                        tuple("divides", TestStatus.FAILED),
                        tuple("parses", TestStatus.ERROR),
                        tuple("later", TestStatus.SKIPPED));
        assertThat(result.tests()).allSatisfy(test -> assertThat(test.className()).isEqualTo("com.example.CalcTest"));
    }

    @Test
    void classifiesDefectsByFailureKind() {
        assertThat(TestResultExtractor.classify(defect("java.lang.AssertionError: boom"))).isEqualTo(TestStatus.FAILED);
        assertThat(TestResultExtractor.classify(defect("junit.framework.ComparisonFailure"))).isEqualTo(TestStatus.FAILED);
        assertThat(TestResultExtractor.classify(defect("java.lang.IllegalStateException: x"))).isEqualTo(TestStatus.ERROR);
        assertThat(TestResultExtractor.classify(defect("expected 2"))).isEqualTo(TestStatus.FAILED);
        assertThat(TestResultExtractor.classify(TestNode.testCase("t", State.UNKNOWN, null, null, 0)))
                .isEqualTo(TestStatus.ERROR);
    }

    private static TestNode defect(String message) {
        return TestNode.testCase("t", State.DEFECT, message, null, 0);
    }
}
