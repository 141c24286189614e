package com.scholary.podsummary.config;

import com.scholary.podsummary.storage.ArtifactStore;
import com.scholary.podsummary.storage.ArtifactStoreProperties;
import com.scholary.podsummary.storage.LocalArtifactStore;
import com.scholary.podsummary.storage.S3ArtifactStore;
import java.nio.file.Path;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for artifact storage.
 *
 * <p>Wires up the {@link ArtifactStore} bean for the backend named by {@code artifacts.backend}.
 */
@Configuration
@EnableConfigurationProperties(ArtifactStoreProperties.class)
public class ArtifactStoreConfig {

  @Bean
  public ArtifactStore artifactStore(ArtifactStoreProperties properties) {
    return switch (properties.backend()) {
      case LOCAL -> new LocalArtifactStore(
          Path.of(properties.rootDir()), properties.publicBaseUrl());
      case S3 -> {
        if (properties.s3() == null) {
          throw new IllegalStateException("artifacts.s3 must be configured for the s3 backend");
        }
        yield new S3ArtifactStore(properties.s3(), properties.publicBaseUrl());
      }
    };
  }
}
