package com.scholary.podsummary.transcript;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * Structured summary of a transcript.
 *
 * <p>Serialized with snake_case keys ({@code key_points}, {@code per_speaker}) which is also the
 * shape summarization providers are asked to return.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Summary(String overview, List<String> keyPoints, List<SpeakerHighlights> perSpeaker) {

  public Summary {
    keyPoints = keyPoints == null ? List.of() : List.copyOf(keyPoints);
    perSpeaker = perSpeaker == null ? List.of() : List.copyOf(perSpeaker);
  }
}
