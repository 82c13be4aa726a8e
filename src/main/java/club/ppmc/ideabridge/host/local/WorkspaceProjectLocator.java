/**
 * WorkspaceProjectLocator.java
 *
 * 把工作区中的 Maven 项目视为“已打开的项目”：工作区根目录本身（若含 pom.xml）以及其直接子目录中含 pom.xml 的目录。
 */
package club.ppmc.ideabridge.host.local;

import club.ppmc.ideabridge.host.ProjectHandle;
import club.ppmc.ideabridge.host.ProjectLocator;
import club.ppmc.ideabridge.service.SettingsService;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

@Component
public class WorkspaceProjectLocator implements ProjectLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkspaceProjectLocator.class);

    private final SettingsService settingsService;

    public WorkspaceProjectLocator(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Override
    public List<ProjectHandle> openProjects() {
        Path root = settingsService.getWorkspaceRoot();
        if (!Files.isDirectory(root)) {
            LOGGER.warn("工作区目录 {} 不存在。", root);
            return List.of();
        }
        var projects = new ArrayList<ProjectHandle>();
        if (Files.isRegularFile(root.resolve("pom.xml"))) {
            projects.add(new ProjectHandle(root.getFileName().toString(), root));
        }
        try (var children = Files.list(root)) {
            children.filter(Files::isDirectory)
                    .filter(dir -> Files.isRegularFile(dir.resolve("pom.xml")))
                    .sorted(Comparator.comparing(dir -> dir.getFileName().toString()))
                    .forEach(dir -> projects.add(new ProjectHandle(dir.getFileName().toString(), dir)));
        } catch (IOException e) {
            throw new UncheckedIOException("无法列出工作区目录 " + root, e);
        }
        return projects;
    }

    @Override
    public Optional<ProjectHandle> resolve(String projectRef) {
        List<ProjectHandle> projects = openProjects();
        if (!StringUtils.hasText(projectRef)) {
            return projects.stream().findFirst();
        }
        String ref = projectRef.trim();
        Path refPath = toPath(ref);
        return projects.stream()
                .filter(project -> matches(project, ref, refPath))
                .findFirst();
    }

    private boolean matches(ProjectHandle project, String ref, Path refPath) {
        if (project.name().equalsIgnoreCase(ref)) {
            return true;
        }
        if (refPath == null) {
            return false;
        }
        Path base = project.basePath().normalize();
        return base.equals(refPath.toAbsolutePath().normalize()) || base.endsWith(refPath.normalize());
    }

    private Path toPath(String ref) {
        try {
            return Paths.get(ref);
        } catch (InvalidPathException e) {
            LOGGER.debug("项目引用 '{}' 不是合法路径，仅按名称匹配。", ref);
            return null;
        }
    }
}
