package club.ppmc.ideabridge.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.ideabridge.config.BridgeProperties;
import club.ppmc.ideabridge.core.CompletionBridge;
import club.ppmc.ideabridge.exception.GlobalExceptionHandler;
import club.ppmc.ideabridge.host.local.ExecutorApplicationDispatcher;
import club.ppmc.ideabridge.model.debug.StackFrameInfo;
import club.ppmc.ideabridge.model.debug.VariableInfo;
import club.ppmc.ideabridge.service.DebugFacadeService;
import club.ppmc.ideabridge.service.DebugLaunchService;
import club.ppmc.ideabridge.service.RunRegistryService;
import club.ppmc.ideabridge.support.FakeDebugSession;
import club.ppmc.ideabridge.support.FakeDebugSessionManager;
import club.ppmc.ideabridge.support.FakeExecutionHost;
import club.ppmc.ideabridge.support.FakeProjectLocator;
import club.ppmc.ideabridge.support.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class DebugControllerTest {

    private final ExecutorApplicationDispatcher dispatcher = new ExecutorApplicationDispatcher();
    private final CompletionBridge bridge = new CompletionBridge(dispatcher);
    private final BridgeProperties properties = TestProperties.fast();
    private final FakeExecutionHost executionHost = new FakeExecutionHost();
    private final FakeProjectLocator projectLocator = FakeProjectLocator.single("demo");
    private final FakeDebugSessionManager sessionManager = new FakeDebugSessionManager();
    private final RunRegistryService runRegistry =
            new RunRegistryService(executionHost, projectLocator, dispatcher, bridge, properties);
    private final DebugFacadeService facade = new DebugFacadeService(sessionManager, bridge, properties);
    private final MockMvc mockMvc = MockMvcBuilders
            .standaloneSetup(
                    new DebugController(facade, new DebugLaunchService(
                            executionHost, projectLocator, sessionManager, runRegistry, bridge, properties)),
                    new BreakpointController(facade))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();

    @AfterEach
    void tearDown() {
        runRegistry.reset();
        dispatcher.shutdown();
    }

    @Test
    void inspectionWithoutSessionIsConflict() throws Exception {
        mockMvc.perform(get("/api/debug/stack"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.kind").value("NO_ACTIVE_DEBUG_SESSION"));
        mockMvc.perform(post("/api/debug/step/over"))
                .andExpect(status().isConflict());
    }

    @Test
    void suspendedSessionExposesFramesAndVariables() throws Exception {
        sessionManager.withCurrent(new FakeDebugSession("run-1:com.example.App")
                .suspended(true)
                .withFrame(new StackFrameInfo(0, "com.example.App", "main", "App.java", 12),
                        new VariableInfo("count", "int", "3")));

        mockMvc.perform(get("/api/debug/stack"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.frames[0].methodName").value("main"));
        mockMvc.perform(get("/api/debug/variables").param("frameIndex", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.variables[0].name").value("count"));
        mockMvc.perform(get("/api/debug/variables").param("frameIndex", "5"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.kind").value("FRAME_NOT_FOUND"));
    }

    @Test
    void blankExpressionFailsValidation() throws Exception {
        mockMvc.perform(post("/api/debug/evaluate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"expression\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.kind").value("VALIDATION_FAILED"));
    }

    @Test
    void nonNumericFrameIndexFailsValidation() throws Exception {
        mockMvc.perform(get("/api/debug/variables").param("frameIndex", "top"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.kind").value("VALIDATION_FAILED"));
    }

    @Test
    void breakpointsCanBeSetListedAndRemoved() throws Exception {
        String body = "{\"file\":\"src/main/java/com/example/App.java\",\"line\":12}";

        mockMvc.perform(post("/api/breakpoint/set").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        mockMvc.perform(get("/api/breakpoint/list"))
                .andExpect(jsonPath("$.breakpoints[0].line").value(12));
        mockMvc.perform(post("/api/breakpoint/remove").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/breakpoint/list"))
                .andExpect(jsonPath("$.breakpoints").isEmpty());
    }

    @Test
    void nonPositiveBreakpointLineIsRejected() throws Exception {
        mockMvc.perform(post("/api/breakpoint/set")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"file\":\"App.java\",\"line\":0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void stopWithoutSessionSucceeds() throws Exception {
        mockMvc.perform(post("/api/debug/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("stop"));
    }
}
