package com.scholary.podsummary.stage.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podsummary.stage.StageAdapterException;
import com.scholary.podsummary.stage.SummarizationAdapter;
import com.scholary.podsummary.transcript.SpeakerTurn;
import com.scholary.podsummary.transcript.Summary;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Summarization through the Gemini {@code generateContent} API with a JSON response type. */
public class GeminiSummarizationAdapter implements SummarizationAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiSummarizationAdapter.class);

  static final String PROVIDER = "gemini";
  static final String DEFAULT_MODEL = "gemini-1.5-flash-latest";
  private static final String ENDPOINT =
      "https://generativelanguage.googleapis.com/v1beta/models/%s:generateContent?key=%s";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String apiKey;
  private final String model;
  private final Duration timeout;

  public GeminiSummarizationAdapter(
      ObjectMapper objectMapper, String apiKey, String model, Duration timeout) {
    this(HttpClient.newHttpClient(), objectMapper, apiKey, model, timeout);
  }

  GeminiSummarizationAdapter(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      String apiKey,
      String model,
      Duration timeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.apiKey = apiKey;
    this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
    this.timeout = timeout;
    LOGGER.info("Gemini summarization adapter initialized: model={}", this.model);
  }

  @Override
  public String providerName() {
    return PROVIDER;
  }

  @Override
  public Summary summarize(List<SpeakerTurn> turns) {
    String transcript = SummaryPrompt.renderTranscript(turns);
    if (apiKey == null || apiKey.isBlank()) {
      throw new StageAdapterException(PROVIDER, "Gemini API key not configured.");
    }

    Map<String, Object> payload =
        Map.of(
            "contents",
            List.of(
                Map.of(
                    "parts",
                    List.of(
                        Map.of(
                            "text",
                            SummaryPrompt.INSTRUCTIONS + "\nTranscript:\n" + transcript)))),
            "generationConfig",
            Map.of("responseMimeType", "application/json"));

    LOGGER.info("Requesting summary for {} turns with model={}", turns.size(), model);
    String body = post(payload);
    return SummaryPrompt.parse(objectMapper, extractText(body), PROVIDER);
  }

  private String post(Map<String, Object> payload) {
    try {
      String uri =
          String.format(
              ENDPOINT,
              URLEncoder.encode(model, StandardCharsets.UTF_8),
              URLEncoder.encode(apiKey, StandardCharsets.UTF_8));
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(uri))
              .timeout(timeout)
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
              .build();

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() / 100 != 2) {
        LOGGER.error("Gemini API error: {} - {}", response.statusCode(), response.body());
        throw new StageAdapterException(
            PROVIDER, "Gemini API returned status " + response.statusCode());
      }
      return response.body();

    } catch (IOException e) {
      throw new StageAdapterException(PROVIDER, "Gemini request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StageAdapterException(PROVIDER, "Gemini request interrupted", e);
    }
  }

  private String extractText(String body) {
    try {
      JsonNode text =
          objectMapper
              .readTree(body)
              .path("candidates")
              .path(0)
              .path("content")
              .path("parts")
              .path(0)
              .path("text");
      if (!text.isTextual()) {
        throw new StageAdapterException(PROVIDER, "Unexpected Gemini response format.");
      }
      return text.asText();
    } catch (IOException e) {
      throw new StageAdapterException(PROVIDER, "Unexpected Gemini response format.", e);
    }
  }
}
