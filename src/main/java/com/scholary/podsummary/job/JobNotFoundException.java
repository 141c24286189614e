package com.scholary.podsummary.job;

import com.scholary.podsummary.PodSummaryException;

/** Thrown when a job id is not present in the registry. */
public class JobNotFoundException extends PodSummaryException {

  private final String jobId;

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
