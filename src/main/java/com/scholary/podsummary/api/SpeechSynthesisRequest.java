package com.scholary.podsummary.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/**
 * Request to synthesize speech for a job.
 *
 * @param voice provider voice id; omitted means the configured default
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SpeechSynthesisRequest(@NotBlank String jobId, @NotBlank String text, String voice) {}
