package com.scholary.podsummary.stage.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper transcription client.
 *
 * <p>Timeouts are in seconds. {@code maxRetries} counts attempts, so 1 disables retrying.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {

  /**
   * Longest a single transcription can take: every attempt running into {@code readTimeout}, plus
   * the backoff between attempts (2^n seconds and up to one second of jitter after attempt n).
   */
  public Duration worstCaseDuration() {
    long seconds = (long) readTimeout * maxRetries;
    for (int attempt = 1; attempt < maxRetries; attempt++) {
      seconds += (1L << attempt) + 1;
    }
    return Duration.ofSeconds(seconds);
  }
}
