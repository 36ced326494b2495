package com.vcc.copilot.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

/**
 * Request DTO for a copilot chat turn.
 */
public record ChatRequest(
        @NotEmpty(message = "At least one message is required")
        @Size(max = 50, message = "At most 50 messages are allowed")
        List<@NotNull(message = "Message entries must not be null") @Valid MessageInput> messages,

        @Pattern(regexp = UUID_PATTERN, message = "Project ID must be a UUID")
        String projectId,

        @Valid
        Options options
) {
    static final String UUID_PATTERN = "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$";

    /**
     * One caller turn. System turns are reserved for the gateway.
     */
    public record MessageInput(
            @NotBlank(message = "Message role is required")
            @Pattern(regexp = "^(user|assistant)$", message = "Message role must be user or assistant")
            String role,

            @NotBlank(message = "Message content is required")
            @Size(max = 8000, message = "Message content must be at most 8000 characters")
            String content
    ) {
    }

    /**
     * Optional model overrides, clamped to the tier ceilings.
     */
    public record Options(
            Double temperature,

            @Positive(message = "maxTokens must be positive")
            Integer maxTokens
    ) {
    }

    public UUID projectUuid() {
        return projectId != null && !projectId.isBlank() ? UUID.fromString(projectId) : null;
    }

    public Double temperature() {
        return options != null ? options.temperature() : null;
    }

    public Integer maxTokens() {
        return options != null ? options.maxTokens() : null;
    }
}
