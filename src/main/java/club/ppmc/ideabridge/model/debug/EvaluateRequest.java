/**
 * EvaluateRequest.java
 */
package club.ppmc.ideabridge.model.debug;

import jakarta.validation.constraints.NotBlank;

public record EvaluateRequest(@NotBlank String expression) {}
