package com.scholary.podsummary.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podsummary.pipeline.PipelineProperties;
import com.scholary.podsummary.stage.DiarizationAdapter;
import com.scholary.podsummary.stage.SpeechSynthesisAdapter;
import com.scholary.podsummary.stage.SummarizationAdapter;
import com.scholary.podsummary.stage.TranscriptionAdapter;
import com.scholary.podsummary.stage.diarization.RoundRobinDiarizationAdapter;
import com.scholary.podsummary.stage.summary.GeminiSummarizationAdapter;
import com.scholary.podsummary.stage.summary.OpenAiSummarizationAdapter;
import com.scholary.podsummary.stage.tts.AzureSpeechSynthesisAdapter;
import com.scholary.podsummary.stage.tts.DisabledSpeechSynthesisAdapter;
import com.scholary.podsummary.stage.tts.ElevenLabsSpeechSynthesisAdapter;
import com.scholary.podsummary.stage.whisper.WhisperProperties;
import com.scholary.podsummary.stage.whisper.WhisperTranscriptionAdapter;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects one adapter per stage from {@code stages.*.provider}.
 *
 * <p>The choice is made once here; the pipeline only ever sees the capability interfaces. An
 * unknown provider name fails startup.
 */
@Configuration
@EnableConfigurationProperties({StageProperties.class, WhisperProperties.class})
public class StageAdapterConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(StageAdapterConfig.class);

  /**
   * @throws IllegalStateException if Whisper's read timeout and retries can outlast {@code
   *     pipeline.stageTimeout}; such a call would always be cut off mid-retry
   */
  @Bean
  public TranscriptionAdapter transcriptionAdapter(
      StageProperties properties,
      WhisperProperties whisperProperties,
      PipelineProperties pipelineProperties,
      ObjectMapper objectMapper) {
    String provider = normalize(properties.transcription().provider());
    LOGGER.info("Configuring transcription provider: {}", provider);
    if ("whisper".equals(provider)) {
      Duration worstCase = whisperProperties.worstCaseDuration();
      if (worstCase.compareTo(pipelineProperties.stageTimeout()) > 0) {
        throw new IllegalStateException(
            String.format(
                "whisper.readTimeout=%ds with maxRetries=%d can take up to %ds, longer than "
                    + "pipeline.stageTimeout=%ds",
                whisperProperties.readTimeout(),
                whisperProperties.maxRetries(),
                worstCase.toSeconds(),
                pipelineProperties.stageTimeout().toSeconds()));
      }
      return new WhisperTranscriptionAdapter(whisperProperties, objectMapper);
    }
    throw unknown("transcription", provider);
  }

  @Bean
  public DiarizationAdapter diarizationAdapter(StageProperties properties) {
    String provider = normalize(properties.diarization().provider());
    LOGGER.info("Configuring diarization provider: {}", provider);
    if ("round-robin".equals(provider)) {
      return new RoundRobinDiarizationAdapter(properties.diarization().speakerLabels());
    }
    throw unknown("diarization", provider);
  }

  @Bean
  public SummarizationAdapter summarizationAdapter(
      StageProperties properties, ObjectMapper objectMapper) {
    StageProperties.Summarization summarization = properties.summarization();
    String provider = normalize(summarization.provider());
    Duration timeout = Duration.ofSeconds(summarization.timeoutSeconds());
    LOGGER.info("Configuring summarization provider: {}", provider);

    return switch (provider) {
      case "openai", "deepseek" -> new OpenAiSummarizationAdapter(
          objectMapper,
          summarization.baseUrl(),
          summarization.apiKey(),
          summarization.model(),
          timeout);
      case "gemini" -> new GeminiSummarizationAdapter(
          objectMapper,
          firstNonBlank(summarization.geminiApiKey(), summarization.apiKey()),
          summarization.model(),
          timeout);
      default -> throw unknown("summarization", provider);
    };
  }

  @Bean
  public SpeechSynthesisAdapter speechSynthesisAdapter(
      StageProperties properties, ObjectMapper objectMapper) {
    StageProperties.Speech speech = properties.speech();
    String provider = normalize(speech.provider());
    Duration timeout = Duration.ofSeconds(speech.timeoutSeconds());
    LOGGER.info("Configuring speech synthesis provider: {}", provider);

    return switch (provider) {
      case "elevenlabs" -> new ElevenLabsSpeechSynthesisAdapter(
          objectMapper, speech.elevenLabsApiKey(), speech.elevenLabsVoice(), timeout);
      case "azure" -> new AzureSpeechSynthesisAdapter(
          speech.azureSpeechKey(), speech.azureSpeechRegion(), speech.azureVoice(), timeout);
      case "none" -> new DisabledSpeechSynthesisAdapter();
      default -> throw unknown("speech", provider);
    };
  }

  private static String normalize(String provider) {
    return provider.trim().toLowerCase(Locale.ROOT);
  }

  private static String firstNonBlank(String first, String second) {
    return first != null && !first.isBlank() ? first : second;
  }

  private static IllegalStateException unknown(String stage, String provider) {
    return new IllegalStateException(
        String.format("Unsupported %s provider configured: '%s'", stage, provider));
  }
}
