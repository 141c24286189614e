package com.scholary.podsummary.transcript;

import java.util.List;

/**
 * A transcript of one audio source.
 *
 * <p>Immutable. Diarization produces a new instance via {@link #withTurns(List)} rather than
 * editing turns in place.
 */
public record Transcript(String language, Double duration, List<SpeakerTurn> turns) {

  public Transcript {
    turns = turns == null ? List.of() : List.copyOf(turns);
  }

  public Transcript withTurns(List<SpeakerTurn> newTurns) {
    return new Transcript(language, duration, newTurns);
  }
}
