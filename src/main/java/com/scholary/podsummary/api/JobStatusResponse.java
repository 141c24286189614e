package com.scholary.podsummary.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.scholary.podsummary.job.Job;
import com.scholary.podsummary.job.JobStage;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Current state of a job.
 *
 * <p>{@code stage} is serialized with its wire name ({@code uploaded}, {@code transcribing}, ...).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobStatusResponse(
    String jobId,
    JobStage stage,
    String detail,
    Instant createdAt,
    Instant updatedAt,
    List<String> errors,
    Map<String, String> assets) {

  public static JobStatusResponse from(Job job) {
    return new JobStatusResponse(
        job.jobId(),
        job.stage(),
        job.detail(),
        job.createdAt(),
        job.updatedAt(),
        job.errors(),
        job.assets());
  }
}
