package club.ppmc.ideabridge.host.local;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.ideabridge.host.ProjectHandle;
import club.ppmc.ideabridge.model.CompileMessage;
import club.ppmc.ideabridge.util.MavenProjectHelper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class MavenCompilerHostTest {

    private static final ProjectHandle DEMO = new ProjectHandle("demo", Path.of("/work/demo"));

    private final ExecutorApplicationDispatcher dispatcher = new ExecutorApplicationDispatcher();

    @AfterEach
    void tearDown() {
        dispatcher.shutdown();
    }

    @Test
    void unexpectedBuildFailureStillFinishesAndReleasesActivity() throws Exception {
        var helper = new MavenProjectHelper(null) {
            @Override
            public int executeMavenBuild(Path projectDir, List<String> goals, Consumer<String> lineConsumer) {
                throw new UncheckedIOException(new IOException("stream closed"));
            }
        };
        var host = new MavenCompilerHost(helper, dispatcher);
        var finished = new CompletableFuture<Boolean>();

        host.compile(DEMO, true, (aborted, messages) -> finished.complete(aborted));

        assertThat(finished.get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(host.isCompilationActive()).isFalse();
        assertThat(host.lastMessages(DEMO)).singleElement()
                .satisfies(message -> assertThat(message.message()).contains("stream closed"));
        host.shutdown();
    }

    @Test
    void rejectedSubmissionFinishesAsAborted() throws Exception {
        var host = new MavenCompilerHost(new MavenProjectHelper(null), dispatcher);
        host.shutdown();
        var finished = new CompletableFuture<Boolean>();

        host.compile(DEMO, true, (aborted, messages) -> finished.complete(aborted));

        assertThat(finished.get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(host.isCompilationActive()).isFalse();
    }

    @Test
    void parsesErrorsAndWarningsWithPositions() {
        List<CompileMessage> messages = MavenCompilerHost.parseDiagnostics(List.of(
                "[INFO] Compiling 3 source files to /work/demo/target/classes",
                "[WARNING] /work/demo/src/main/java/com/example/Legacy.java:[8,17] [deprecation] Date(int,int,int) has been deprecated",
                "[ERROR] /work/demo/src/main/java/com/example/App.java:[12,5] cannot find symbol",
                "[INFO] BUILD FAILURE"));

        assertThat(messages).containsExactly(
                new CompileMessage(CompileMessage.WARNING,
                        "[deprecation] Date(int,int,int) has been deprecated",
                        "/work/demo/src/main/java/com/example/Legacy.java", 8, 17),
                new CompileMessage(CompileMessage.ERROR, "cannot find symbol",
                        "/work/demo/src/main/java/com/example/App.java", 12, 5));
    }

    @Test
    void repeatedDiagnosticsAreReportedOnce() {
        String line = "[ERROR] /work/demo/src/main/java/com/example/App.java:[12,5] cannot find symbol";

        List<CompileMessage> messages = MavenCompilerHost.parseDiagnostics(List.of(line, "[INFO] ---", line));

        assertThat(messages).hasSize(1);
    }

    @Test
    void ignoresLinesWithoutPosition() {
        assertThat(MavenCompilerHost.parseDiagnostics(List.of(
                "[ERROR] Failed to execute goal org.apache.maven.plugins:maven-compiler-plugin:3.11.0:compile",
                "[ERROR] -> [Help 1]"))).isEmpty();
    }
}
