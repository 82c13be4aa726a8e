/**
 * SurefireReportReader.java
 *
 * 从 Maven surefire 生成的 target/surefire-reports/TEST-*.xml 构造测试结果树。
 * 只读取在给定时间之后写入的报告，避免把上一次测试的结果当作本次结果。
 * 树的形状为：根（项目）→ 套件（测试类）→ 用例。
 */
package club.ppmc.ideabridge.host.local;

import club.ppmc.ideabridge.host.ProjectHandle;
import club.ppmc.ideabridge.host.TestNode;
import club.ppmc.ideabridge.host.TestResultTreeSource;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.codehaus.plexus.util.xml.Xpp3Dom;
import org.codehaus.plexus.util.xml.Xpp3DomBuilder;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SurefireReportReader implements TestResultTreeSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(SurefireReportReader.class);
    private static final int MAX_DEPTH = 6;

    @Override
    public Optional<TestNode> readTree(ProjectHandle project, Instant since) throws IOException {
        List<Path> reports = findReports(project.basePath(), since);
        if (reports.isEmpty()) {
            return Optional.empty();
        }
        var suites = new ArrayList<TestNode>();
        for (Path report : reports) {
            suites.add(parseReport(report));
        }
        LOGGER.debug("从 {} 份 surefire 报告中读取到 {} 个测试套件。", reports.size(), suites.size());
        return Optional.of(TestNode.suite(project.name(), suites));
    }

    private List<Path> findReports(Path projectDir, Instant since) throws IOException {
        if (!Files.isDirectory(projectDir)) {
            return List.of();
        }
        try (Stream<Path> paths = Files.walk(projectDir, MAX_DEPTH)) {
            return paths.filter(path -> path.getParent() != null
                            && path.getParent().getFileName() != null
                            && "surefire-reports".equals(path.getParent().getFileName().toString()))
                    .filter(path -> {
                        String fileName = path.getFileName().toString();
                        return fileName.startsWith("TEST-") && fileName.endsWith(".xml");
                    })
                    .filter(path -> modifiedSince(path, since))
                    .sorted()
                    .toList();
        }
    }

    private boolean modifiedSince(Path path, Instant since) {
        try {
            return !Files.getLastModifiedTime(path).toInstant().isBefore(since);
        } catch (IOException e) {
            LOGGER.debug("无法读取 {} 的修改时间: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * 解析单份报告为一个套件节点。
     *
     * @throws IOException 报告不完整（例如仍在写入）或格式错误时抛出。
     */
    static TestNode parseReport(Path report) throws IOException {
        try (Reader reader = Files.newBufferedReader(report, StandardCharsets.UTF_8)) {
            return toSuite(Xpp3DomBuilder.build(reader));
        } catch (XmlPullParserException e) {
            throw new IOException("无法解析测试报告 " + report.getFileName() + ": " + e.getMessage(), e);
        }
    }

    static TestNode toSuite(Xpp3Dom suite) {
        var cases = new ArrayList<TestNode>();
        for (Xpp3Dom testCase : suite.getChildren("testcase")) {
            cases.add(toCase(testCase));
        }
        return TestNode.suite(suite.getAttribute("name"), cases);
    }

    private static TestNode toCase(Xpp3Dom testCase) {
        String name = testCase.getAttribute("name");
        String className = testCase.getAttribute("classname");
        String caseName = className != null ? name + "(" + className + ")" : name;
        long durationMs = parseSeconds(testCase.getAttribute("time"));

        Xpp3Dom defect = testCase.getChild("failure");
        if (defect == null) {
            defect = testCase.getChild("error");
        }
        if (defect != null) {
            String type = defect.getAttribute("type");
            String message = defect.getAttribute("message");
            String errorMessage = type == null ? message : (message == null ? type : type + ": " + message);
            return TestNode.testCase(caseName, TestNode.State.DEFECT, errorMessage, defect.getValue(), durationMs);
        }
        if (testCase.getChild("skipped") != null) {
            return TestNode.testCase(caseName, TestNode.State.IGNORED, null, null, durationMs);
        }
        return TestNode.testCase(caseName, TestNode.State.PASSED, null, null, durationMs);
    }

    private static long parseSeconds(String seconds) {
        if (seconds == null || seconds.isBlank()) {
            return 0;
        }
        try {
            return Math.round(Double.parseDouble(seconds.replace(",", "")) * 1000);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
