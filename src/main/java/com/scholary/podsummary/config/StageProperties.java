package com.scholary.podsummary.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Provider selection and credentials for the pipeline stages.
 *
 * <p>Each {@code provider} is read once at startup by {@link StageAdapterConfig}. Credentials may
 * be blank; an adapter without credentials fails when called, not at startup.
 */
@ConfigurationProperties(prefix = "stages")
@Validated
public record StageProperties(
    @NotNull @Valid Transcription transcription,
    @NotNull @Valid Diarization diarization,
    @NotNull @Valid Summarization summarization,
    @NotNull @Valid Speech speech) {

  public record Transcription(@NotBlank String provider) {}

  public record Diarization(@NotBlank String provider, @NotEmpty List<String> speakerLabels) {}

  public record Summarization(
      @NotBlank String provider,
      String model,
      String apiKey,
      String baseUrl,
      String geminiApiKey,
      @Positive int timeoutSeconds) {}

  public record Speech(
      @NotBlank String provider,
      String elevenLabsApiKey,
      String elevenLabsVoice,
      String azureSpeechKey,
      String azureSpeechRegion,
      String azureVoice,
      @Positive int timeoutSeconds) {}
}
