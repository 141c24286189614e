package com.scholary.podsummary.stage.tts;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podsummary.stage.SpeechSynthesisAdapter;
import com.scholary.podsummary.stage.StageAdapterException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Speech synthesis through the ElevenLabs text-to-speech API. */
public class ElevenLabsSpeechSynthesisAdapter implements SpeechSynthesisAdapter {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(ElevenLabsSpeechSynthesisAdapter.class);

  static final String PROVIDER = "elevenlabs";
  static final String MODEL_ID = "eleven_turbo_v2";
  private static final String BASE_URL = "https://api.elevenlabs.io/v1/text-to-speech/";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String apiKey;
  private final String defaultVoice;
  private final Duration timeout;

  public ElevenLabsSpeechSynthesisAdapter(
      ObjectMapper objectMapper, String apiKey, String defaultVoice, Duration timeout) {
    this(HttpClient.newHttpClient(), objectMapper, apiKey, defaultVoice, timeout);
  }

  ElevenLabsSpeechSynthesisAdapter(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      String apiKey,
      String defaultVoice,
      Duration timeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.apiKey = apiKey;
    this.defaultVoice = defaultVoice;
    this.timeout = timeout;
  }

  @Override
  public String providerName() {
    return PROVIDER;
  }

  @Override
  public byte[] synthesize(String text, String voice) {
    if (apiKey == null || apiKey.isBlank()) {
      throw new StageAdapterException(PROVIDER, "ElevenLabs API key missing.");
    }
    String voiceId = voice != null && !voice.isBlank() ? voice : defaultVoice;
    LOGGER.info("Generating speech for {} chars with voice={}", text.length(), voiceId);

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(BASE_URL + URLEncoder.encode(voiceId, StandardCharsets.UTF_8)))
              .timeout(timeout)
              .header("xi-api-key", apiKey)
              .header("Content-Type", "application/json")
              .header("Accept", "audio/mpeg")
              .POST(
                  HttpRequest.BodyPublishers.ofString(
                      objectMapper.writeValueAsString(Map.of("text", text, "model_id", MODEL_ID))))
              .build();

      HttpResponse<byte[]> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
      if (response.statusCode() != 200) {
        String body = new String(response.body(), StandardCharsets.UTF_8);
        throw new StageAdapterException(PROVIDER, "ElevenLabs TTS failed: " + body);
      }
      return response.body();

    } catch (IOException e) {
      throw new StageAdapterException(PROVIDER, "ElevenLabs request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StageAdapterException(PROVIDER, "ElevenLabs request interrupted", e);
    }
  }
}
