package com.scholary.podsummary.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/**
 * Request to start processing a job.
 *
 * @param jobId job to process
 * @param enableTts also synthesize the summary overview as audio; defaults to {@code false}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessRequest(@NotBlank String jobId, boolean enableTts) {}
