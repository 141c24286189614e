package com.scholary.podsummary.job;

import com.scholary.podsummary.transcript.Summary;
import com.scholary.podsummary.transcript.Transcript;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time view of a job.
 *
 * <p>Instances are immutable copies handed out by {@link JobRegistry}; holding one never blocks or
 * observes later mutations.
 */
public record Job(
    String jobId,
    JobStage stage,
    String detail,
    Instant createdAt,
    Instant updatedAt,
    List<String> errors,
    Map<String, String> assets,
    Transcript transcript,
    Summary summary,
    String summaryAudioRef) {

  public Job {
    errors = List.copyOf(errors);
    assets = Map.copyOf(assets);
  }

  public Optional<String> asset(String name) {
    return Optional.ofNullable(assets.get(name));
  }

  public boolean hasFailed() {
    return stage == JobStage.FAILED;
  }
}
