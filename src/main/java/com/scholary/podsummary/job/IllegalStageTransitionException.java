package com.scholary.podsummary.job;

import com.scholary.podsummary.PodSummaryException;

/**
 * Thrown when a mutation would move a job backwards through the stage sequence or out of a
 * terminal stage.
 */
public class IllegalStageTransitionException extends PodSummaryException {

  public IllegalStageTransitionException(String jobId, JobStage from, JobStage to) {
    super(String.format("Illegal stage transition for job %s: %s -> %s", jobId, from, to));
  }
}
