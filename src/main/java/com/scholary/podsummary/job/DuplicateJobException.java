package com.scholary.podsummary.job;

import com.scholary.podsummary.PodSummaryException;

/** Thrown when a job is created with an id that is already registered. */
public class DuplicateJobException extends PodSummaryException {

  public DuplicateJobException(String jobId) {
    super("Job already exists: " + jobId);
  }
}
