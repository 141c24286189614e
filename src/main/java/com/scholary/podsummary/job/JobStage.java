package com.scholary.podsummary.job;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Processing stages of a job, in pipeline order.
 *
 * <p>{@link #FAILED} sits outside the sequence: it is reachable from every non-terminal stage and
 * nothing follows it.
 */
public enum JobStage {
  UPLOADED("uploaded"),
  TRANSCRIBING("transcribing"),
  DIARIZING("diarizing"),
  SUMMARIZING("summarizing"),
  SYNTHESIZING_SPEECH("tts"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String wireName;

  JobStage(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** True if {@code this} may follow {@code current} in a forward transition. */
  public boolean canFollow(JobStage current) {
    if (current.isTerminal() || this == FAILED) {
      return false;
    }
    return ordinal() > current.ordinal();
  }
}
