package com.scholary.podsummary.stage;

import com.scholary.podsummary.transcript.SpeakerTurn;
import java.util.List;

/** Output of the transcription stage: detected language, optional duration and ordered turns. */
public record TranscriptionResult(String language, Double duration, List<SpeakerTurn> turns) {

  public TranscriptionResult {
    turns = turns == null ? List.of() : List.copyOf(turns);
  }
}
