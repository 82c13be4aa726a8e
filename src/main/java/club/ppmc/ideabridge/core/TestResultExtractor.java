/**
 * TestResultExtractor.java
 *
 * 在测试进程退出后提取测试结果。结果树是异步生成的，进程退出时可能还不存在，
 * 所以按 RetryPolicy 做有界轮询；全部尝试仍为空时，退回到进程退出码来判断结果。
 *
 * 退回规则：
 * - 退出码非 0：生成一条合成的 ERROR 用例，整体失败；
 * - 退出码为 0：没有任何匹配的测试，报告 NO_MATCHING_TESTS（不算成功）；
 * - 退出码为 0 且每次读取都出错：报告 EXTRACTION_FAILED。
 */
package club.ppmc.ideabridge.core;

import club.ppmc.ideabridge.host.TestNode;
import club.ppmc.ideabridge.model.BridgeError;
import club.ppmc.ideabridge.model.BridgeErrorKind;
import club.ppmc.ideabridge.model.TestCaseResult;
import club.ppmc.ideabridge.model.TestRunResult;
import club.ppmc.ideabridge.model.TestStatus;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class TestResultExtractor {

    private static final Pattern QUALIFIED_CASE = Pattern.compile("^([^()]+)\\(([^()]+)\\)$");
    private static final List<String> ASSERTION_MARKERS =
            List.of("AssertionError", "AssertionFailedError", "ComparisonFailure");

    private final RetryPolicy retryPolicy;

    public TestResultExtractor(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
    }

    /**
     * 结果树的读取方式。读取失败抛出 IOException，结果尚未生成返回空。
     */
    @FunctionalInterface
    public interface TreeReader {
        Optional<TestNode> read() throws IOException;
    }

    /**
     * @param reader 结果树读取方式。
     * @param exitCode 测试进程的退出码。
     * @return 测试结果；timeMs 和 runId 由调用方补上。
     */
    public TestRunResult extract(TreeReader reader, int exitCode) {
        int readFailures = 0;
        String lastFailure = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                Optional<TestNode> root = reader.read();
                if (root.isPresent()) {
                    List<TestCaseResult> cases = new ArrayList<>();
                    collect(root.get(), null, cases);
                    if (!cases.isEmpty()) {
                        log.debug("第 {} 次尝试提取到 {} 个测试用例。", attempt, cases.size());
                        return TestRunResult.of(cases, 0, null);
                    }
                }
            } catch (IOException | RuntimeException e) {
                readFailures++;
                lastFailure = e.getMessage();
                log.warn("第 {} 次读取测试结果失败: {}", attempt, e.getMessage());
            }
            if (attempt < retryPolicy.maxAttempts() && !sleepBeforeRetry()) {
                break;
            }
        }
        return fallBackToExitCode(exitCode, readFailures, lastFailure);
    }

    private boolean sleepBeforeRetry() {
        try {
            TimeUnit.MILLISECONDS.sleep(retryPolicy.delay().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("等待测试结果时线程被中断，停止重试。");
            return false;
        }
    }

    private TestRunResult fallBackToExitCode(int exitCode, int readFailures, String lastFailure) {
        if (exitCode != 0) {
            log.info("未找到测试结果，根据退出码 {} 判定为失败。", exitCode);
            var synthetic = new TestCaseResult(
                    "", "", TestStatus.ERROR, 0, "Test process exited with code " + exitCode, null);
            return TestRunResult.of(List.of(synthetic), 0, null);
        }
        if (readFailures > 0) {
            return TestRunResult.failed(
                    BridgeError.of(
                            BridgeErrorKind.EXTRACTION_FAILED, "无法读取测试结果: " + lastFailure),
                    0, null);
        }
        return TestRunResult.failed(
                BridgeError.of(
                        BridgeErrorKind.NO_MATCHING_TESTS, "测试进程正常退出，但没有执行任何匹配的测试。"),
                0, null);
    }

    private void collect(TestNode node, String parentName, List<TestCaseResult> out) {
        if (!node.leaf()) {
            for (TestNode child : node.children()) {
                collect(child, node.name(), out);
            }
            return;
        }
        String className = parentName != null ? parentName : "";
        String methodName = node.name();
        Matcher matcher = QUALIFIED_CASE.matcher(node.name());
        if (matcher.matches()) {
            methodName = matcher.group(1);
            className = matcher.group(2);
        }
        TestStatus status = classify(node);
        boolean failed = status == TestStatus.FAILED || status == TestStatus.ERROR;
        out.add(new TestCaseResult(
                className,
                methodName,
                status,
                node.durationMs(),
                failed ? node.errorMessage() : null,
                failed ? node.stacktrace() : null));
    }

    /**
     * 断言失败归为 FAILED，其余异常归为 ERROR，无法判断时归为 FAILED。
     */
    static TestStatus classify(TestNode node) {
        return switch (node.state()) {
            case PASSED -> TestStatus.PASSED;
            case IGNORED -> TestStatus.SKIPPED;
            case DEFECT -> classifyDefect(node);
            // 未完成或状态未知的用例不算通过
            case UNKNOWN -> TestStatus.ERROR;
        };
    }

    private static TestStatus classifyDefect(TestNode node) {
        String text = (node.errorMessage() == null ? "" : node.errorMessage())
                + "\n" + (node.stacktrace() == null ? "" : node.stacktrace());
        for (String marker : ASSERTION_MARKERS) {
            if (text.contains(marker)) {
                return TestStatus.FAILED;
            }
        }
        if (text.contains("Exception") || text.contains("Error")) {
            return TestStatus.ERROR;
        }
        return TestStatus.FAILED;
    }
}
