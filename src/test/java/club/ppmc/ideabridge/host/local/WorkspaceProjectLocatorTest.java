package club.ppmc.ideabridge.host.local;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.ideabridge.host.ProjectHandle;
import club.ppmc.ideabridge.service.SettingsService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspaceProjectLocatorTest {

    @TempDir
    Path workspace;

    private WorkspaceProjectLocator locator;

    @BeforeEach
    void setUp() throws IOException {
        createProject("beta");
        createProject("alpha");
        Files.createDirectories(workspace.resolve("notes"));
        var settings = new SettingsService(workspace.toString(), "", Map.of());
        settings.init();
        locator = new WorkspaceProjectLocator(settings);
    }

    @Test
    void directoriesWithPomAreOpenProjects() {
        assertThat(locator.openProjects()).extracting(ProjectHandle::name).containsExactly("alpha", "beta");
    }

    @Test
    void blankReferenceResolvesToFirstProject() {
        assertThat(locator.resolve(null)).get().extracting(ProjectHandle::name).isEqualTo("alpha");
        assertThat(locator.resolve("  ")).get().extracting(ProjectHandle::name).isEqualTo("alpha");
    }

    @Test
    void resolvesByNameIgnoringCaseOrByPath() {
        assertThat(locator.resolve("BETA")).get().extracting(ProjectHandle::name).isEqualTo("beta");
        assertThat(locator.resolve(workspace.resolve("beta").toString()))
                .get().extracting(ProjectHandle::name).isEqualTo("beta");
    }

    @Test
    void unknownReferenceDoesNotFallBack() {
        assertThat(locator.resolve("gamma")).isEmpty();
    }

    private void createProject(String name) throws IOException {
        Path dir = Files.createDirectories(workspace.resolve(name));
        Files.writeString(dir.resolve("pom.xml"), "<project/>");
    }
}
