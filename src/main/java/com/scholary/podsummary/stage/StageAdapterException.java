package com.scholary.podsummary.stage;

import com.scholary.podsummary.PodSummaryException;

/**
 * Failure surfaced by a stage adapter: the provider was unreachable, rejected the request,
 * returned something unusable, or is not configured.
 *
 * <p>Carries the provider name so the error recorded on the job says which backend failed.
 */
public class StageAdapterException extends PodSummaryException {

  private final String provider;

  public StageAdapterException(String provider, String message) {
    super(provider + ": " + message);
    this.provider = provider;
  }

  public StageAdapterException(String provider, String message, Throwable cause) {
    super(provider + ": " + message, cause);
    this.provider = provider;
  }

  public String getProvider() {
    return provider;
  }
}
