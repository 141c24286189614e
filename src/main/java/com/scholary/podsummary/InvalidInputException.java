package com.scholary.podsummary;

/**
 * Thrown when a request or stage input is unusable: a missing audio source, a malformed URL, an
 * empty transcript handed to summarization.
 */
public class InvalidInputException extends PodSummaryException {

  public InvalidInputException(String message) {
    super(message);
  }
}
