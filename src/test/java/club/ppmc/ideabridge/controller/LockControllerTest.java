package club.ppmc.ideabridge.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.ideabridge.core.OperationClass;
import club.ppmc.ideabridge.core.OperationLockRegistry;
import club.ppmc.ideabridge.exception.GlobalExceptionHandler;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class LockControllerTest {

    private final OperationLockRegistry lockRegistry = new OperationLockRegistry(Map.of(
            OperationClass.BUILD, () -> false,
            OperationClass.TEST, () -> true));
    private final MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new LockController(lockRegistry))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();

    @Test
    void listsEveryOperationClass() throws Exception {
        mockMvc.perform(get("/api/locks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[?(@.operationClass == 'TEST')].externalActivity").value(true))
                .andExpect(jsonPath("$[?(@.operationClass == 'BUILD')].locked").value(false));
    }

    @Test
    void resetOfFreeLockReportsAvailable() throws Exception {
        mockMvc.perform(post("/api/locks/build/reset"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.operationClass").value("BUILD"))
                .andExpect(jsonPath("$.outcome").value("AVAILABLE"));
    }

    @Test
    void unknownOperationClassIsRejected() throws Exception {
        mockMvc.perform(post("/api/locks/deploy/reset"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.kind").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.error.category").value("VALIDATION"));
    }
}
