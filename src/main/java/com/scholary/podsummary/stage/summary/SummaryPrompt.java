package com.scholary.podsummary.stage.summary;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podsummary.InvalidInputException;
import com.scholary.podsummary.stage.StageAdapterException;
import com.scholary.podsummary.transcript.SpeakerHighlights;
import com.scholary.podsummary.transcript.SpeakerTurn;
import com.scholary.podsummary.transcript.Summary;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Prompt rendering and response parsing shared by the LLM summarization adapters.
 *
 * <p>Providers are asked for a JSON object with {@code overview}, {@code key_points} and {@code
 * per_speaker}. Missing fields get defaults instead of failing the stage.
 */
final class SummaryPrompt {

  static final String SYSTEM_MESSAGE = "You are an expert podcast summarizer.";

  static final String INSTRUCTIONS =
      "Summarize this transcript, giving per-speaker highlights and overall episode summary.\n\n"
          + "Return JSON with keys: overview (string), key_points (list of strings), "
          + "per_speaker (list of {speaker, highlights[]}).\n";

  static final String DEFAULT_OVERVIEW = "Summary unavailable.";
  static final String DEFAULT_SPEAKER = "Unknown";

  private SummaryPrompt() {}

  /**
   * One line per turn: {@code [12.00-15.50] Speaker 1: text}.
   *
   * @throws InvalidInputException if there are no turns
   */
  static String renderTranscript(List<SpeakerTurn> turns) {
    if (turns == null || turns.isEmpty()) {
      throw new InvalidInputException("Transcript is empty.");
    }
    return turns.stream()
        .map(
            turn ->
                String.format(
                    Locale.ROOT,
                    "[%.2f-%.2f] %s: %s",
                    turn.start(),
                    turn.end(),
                    turn.speaker(),
                    turn.text()))
        .collect(Collectors.joining("\n"));
  }

  static Summary parse(ObjectMapper objectMapper, String json, String provider) {
    JsonNode root;
    try {
      root = objectMapper.readTree(stripCodeFence(json));
    } catch (JsonProcessingException e) {
      throw new StageAdapterException(
          provider, "Summary is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new StageAdapterException(provider, "Unexpected summary response format.");
    }

    String overview = root.path("overview").asText("");
    if (overview.isBlank()) {
      overview = DEFAULT_OVERVIEW;
    }

    List<String> keyPoints = new ArrayList<>();
    root.path("key_points").forEach(point -> keyPoints.add(point.asText()));

    List<SpeakerHighlights> perSpeaker = new ArrayList<>();
    for (JsonNode item : root.path("per_speaker")) {
      String speaker = item.path("speaker").asText("");
      List<String> highlights = new ArrayList<>();
      item.path("highlights").forEach(h -> highlights.add(h.asText()));
      perSpeaker.add(
          new SpeakerHighlights(speaker.isBlank() ? DEFAULT_SPEAKER : speaker, highlights));
    }

    return new Summary(overview, keyPoints, perSpeaker);
  }

  // Some models wrap JSON in ```json fences even when asked not to.
  private static String stripCodeFence(String text) {
    String trimmed = text == null ? "" : text.strip();
    if (trimmed.startsWith("```")) {
      int firstNewline = trimmed.indexOf('\n');
      int lastFence = trimmed.lastIndexOf("```");
      if (firstNewline > 0 && lastFence > firstNewline) {
        return trimmed.substring(firstNewline + 1, lastFence).strip();
      }
    }
    return trimmed;
  }
}
