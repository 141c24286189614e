package com.scholary.podsummary;

/**
 * Base class for all application exceptions.
 *
 * <p>Unchecked, so stage code can let failures propagate to the pipeline boundary where they are
 * recorded on the job.
 */
public class PodSummaryException extends RuntimeException {

  public PodSummaryException(String message) {
    super(message);
  }

  public PodSummaryException(String message, Throwable cause) {
    super(message, cause);
  }
}
