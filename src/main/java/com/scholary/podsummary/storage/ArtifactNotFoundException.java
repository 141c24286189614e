package com.scholary.podsummary.storage;

import com.scholary.podsummary.PodSummaryException;

/** Thrown when a named artifact does not exist for a job. */
public class ArtifactNotFoundException extends PodSummaryException {

  public ArtifactNotFoundException(String jobId, String name) {
    super(String.format("Artifact not found: jobId=%s, name=%s", jobId, name));
  }
}
