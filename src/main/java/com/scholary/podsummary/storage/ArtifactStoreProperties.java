package com.scholary.podsummary.storage;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for artifact storage.
 *
 * <p>Maps to the "artifacts.*" keys in application.yml. {@code backend} selects between the local
 * filesystem and an S3-compatible bucket.
 */
@ConfigurationProperties(prefix = "artifacts")
@Validated
public record ArtifactStoreProperties(
    @NotNull Backend backend,
    @NotBlank String rootDir,
    @NotBlank String publicBaseUrl,
    @Valid S3 s3) {

  public enum Backend {
    LOCAL,
    S3
  }

  public record S3(
      String endpoint,
      String accessKey,
      String secretKey,
      String bucket,
      String region,
      String prefix,
      boolean pathStyleAccess) {}
}
