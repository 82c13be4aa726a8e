/**
 * TestRunResult.java
 *
 * 一次测试操作的结构化结果。failed 同时计入 FAILED 与 ERROR 两类用例。
 */
package club.ppmc.ideabridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestRunResult(
        boolean success,
        int passed,
        int failed,
        int skipped,
        long timeMs,
        List<TestCaseResult> tests,
        String runId,
        BridgeError error) {

    public static TestRunResult of(List<TestCaseResult> tests, long timeMs, String runId) {
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        for (TestCaseResult test : tests) {
            switch (test.status()) {
                case PASSED -> passed++;
                case SKIPPED -> skipped++;
                case FAILED, ERROR -> failed++;
            }
        }
        return new TestRunResult(failed == 0, passed, failed, skipped, timeMs, List.copyOf(tests), runId, null);
    }

    public static TestRunResult failed(BridgeError error, long timeMs, String runId) {
        return new TestRunResult(false, 0, 0, 0, timeMs, List.of(), runId, error);
    }

    public TestRunResult withTiming(long newTimeMs, String newRunId) {
        return new TestRunResult(success, passed, failed, skipped, newTimeMs, tests, newRunId, error);
    }
}
