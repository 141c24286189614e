package com.scholary.podsummary.storage;

import com.scholary.podsummary.PodSummaryException;

/**
 * Thrown when an artifact cannot be written or read.
 *
 * <p>Runtime exception: inside a pipeline run it is recorded on the job like any other stage
 * failure.
 */
public class StorageException extends PodSummaryException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
