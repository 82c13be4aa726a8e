/**
 * RunSummary.java
 */
package club.ppmc.ideabridge.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSummary(
        String runId,
        String configName,
        String projectName,
        RunCategory category,
        Instant startTime,
        boolean running,
        Integer exitCode,
        boolean failedToStart) {}
