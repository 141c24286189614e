package com.scholary.podsummary.storage;

import com.scholary.podsummary.InvalidInputException;
import java.util.regex.Pattern;

/**
 * Shared naming rules for artifact stores.
 *
 * <p>Job ids and artifact names end up in filesystem paths and object keys, so both are restricted
 * to a safe character set before any I/O happens.
 */
abstract class AbstractArtifactStore implements ArtifactStore {

  private static final Pattern JOB_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");
  private static final Pattern ARTIFACT_NAME =
      Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9._-]{0,127}");

  private final String publicBaseUrl;

  protected AbstractArtifactStore(String publicBaseUrl) {
    this.publicBaseUrl =
        publicBaseUrl.endsWith("/")
            ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
            : publicBaseUrl;
  }

  @Override
  public String reference(String jobId, String name) {
    validate(jobId, name);
    return publicBaseUrl + "/" + jobId + "/" + name;
  }

  protected static void validate(String jobId, String name) {
    validateJobId(jobId);
    if (name == null || !ARTIFACT_NAME.matcher(name).matches() || name.contains("..")) {
      throw new InvalidInputException("Invalid artifact name: " + name);
    }
  }

  protected static void validateJobId(String jobId) {
    if (jobId == null || !JOB_ID.matcher(jobId).matches()) {
      throw new InvalidInputException("Invalid job id: " + jobId);
    }
  }
}
