package com.scholary.podsummary.stage.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podsummary.stage.StageAdapterException;
import com.scholary.podsummary.stage.SummarizationAdapter;
import com.scholary.podsummary.transcript.SpeakerTurn;
import com.scholary.podsummary.transcript.Summary;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summarization through an OpenAI-compatible chat completions endpoint.
 *
 * <p>Any provider speaking the same protocol (DeepSeek, a local gateway) can be used by pointing
 * {@code baseUrl} at it. Requests JSON output via {@code response_format}.
 */
public class OpenAiSummarizationAdapter implements SummarizationAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiSummarizationAdapter.class);

  static final String PROVIDER = "openai";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String baseUrl;
  private final String apiKey;
  private final String model;
  private final Duration timeout;

  public OpenAiSummarizationAdapter(
      ObjectMapper objectMapper, String baseUrl, String apiKey, String model, Duration timeout) {
    this(HttpClient.newHttpClient(), objectMapper, baseUrl, apiKey, model, timeout);
  }

  OpenAiSummarizationAdapter(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      String baseUrl,
      String apiKey,
      String model,
      Duration timeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    this.apiKey = apiKey;
    this.model = model;
    this.timeout = timeout;
    LOGGER.info(
        "OpenAI summarization adapter initialized: baseUrl={}, model={}", this.baseUrl, model);
  }

  @Override
  public String providerName() {
    return PROVIDER;
  }

  @Override
  public Summary summarize(List<SpeakerTurn> turns) {
    String transcript = SummaryPrompt.renderTranscript(turns);
    if (apiKey == null || apiKey.isBlank()) {
      throw new StageAdapterException(PROVIDER, "OpenAI API key not configured.");
    }

    Map<String, Object> requestBody =
        Map.of(
            "model", model,
            "response_format", Map.of("type", "json_object"),
            "messages",
                List.of(
                    Map.of("role", "system", "content", SummaryPrompt.SYSTEM_MESSAGE),
                    Map.of(
                        "role",
                        "user",
                        "content",
                        SummaryPrompt.INSTRUCTIONS + "\nTranscript:\n" + transcript)));

    LOGGER.info("Requesting summary for {} turns with model={}", turns.size(), model);
    String content = extractContent(post(requestBody));
    return SummaryPrompt.parse(objectMapper, content, PROVIDER);
  }

  private String post(Map<String, Object> requestBody) {
    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(baseUrl + "/chat/completions"))
              .timeout(timeout)
              .header("Authorization", "Bearer " + apiKey)
              .header("Content-Type", "application/json")
              .POST(
                  HttpRequest.BodyPublishers.ofString(
                      objectMapper.writeValueAsString(requestBody)))
              .build();

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() / 100 != 2) {
        LOGGER.error("OpenAI API error: {} - {}", response.statusCode(), response.body());
        throw new StageAdapterException(
            PROVIDER, "OpenAI API returned status " + response.statusCode());
      }
      return response.body();

    } catch (IOException e) {
      throw new StageAdapterException(PROVIDER, "OpenAI request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StageAdapterException(PROVIDER, "OpenAI request interrupted", e);
    }
  }

  private String extractContent(String responseBody) {
    try {
      JsonNode content =
          objectMapper
              .readTree(responseBody)
              .path("choices")
              .path(0)
              .path("message")
              .path("content");
      if (!content.isTextual()) {
        throw new StageAdapterException(PROVIDER, "Unexpected OpenAI response format.");
      }
      return content.asText();
    } catch (IOException e) {
      throw new StageAdapterException(PROVIDER, "Unexpected OpenAI response format.", e);
    }
  }
}
