/**
 * ProjectLocator.java
 *
 * 查找宿主中已打开的项目。
 */
package club.ppmc.ideabridge.host;

import java.util.List;
import java.util.Optional;

public interface ProjectLocator {

    List<ProjectHandle> openProjects();

    /**
     * 按引用解析项目。引用为空时取第一个已打开的项目；
     * 否则按路径（相等或以其结尾）或名称（忽略大小写）匹配，匹配不到时返回空，不会退回到其他项目。
     */
    Optional<ProjectHandle> resolve(String projectRef);
}
