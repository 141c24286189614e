package com.scholary.podsummary.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.scholary.podsummary.service.JobResults;
import com.scholary.podsummary.transcript.Summary;
import com.scholary.podsummary.transcript.Transcript;

/**
 * Response for a results query.
 *
 * <p>{@code transcript} and {@code summary} are {@code null} until the corresponding stage has
 * finished; {@code audio_url} points at the source audio.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResultsResponse(
    String jobId,
    JobStatusResponse status,
    Transcript transcript,
    Summary summary,
    String audioUrl,
    String summaryAudioUrl) {

  public static ResultsResponse from(JobResults results) {
    return new ResultsResponse(
        results.job().jobId(),
        JobStatusResponse.from(results.job()),
        results.transcript(),
        results.summary(),
        results.audioUrl(),
        results.summaryAudioUrl());
  }
}
