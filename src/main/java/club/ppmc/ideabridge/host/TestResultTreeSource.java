/**
 * TestResultTreeSource.java
 *
 * 测试结果树的来源。结果树在测试进程退出后异步生成，读取方需要容忍“暂时还没有”。
 */
package club.ppmc.ideabridge.host;

import java.io.IOException;
import java.time.Instant;
import java.util.Optional;

public interface TestResultTreeSource {

    /**
     * 读取 since 之后生成的测试结果。
     *
     * @return 结果树的根；还没有任何结果时为空。
     * @throws IOException 结果存在但无法读取或解析时抛出。
     */
    Optional<TestNode> readTree(ProjectHandle project, Instant since) throws IOException;
}
