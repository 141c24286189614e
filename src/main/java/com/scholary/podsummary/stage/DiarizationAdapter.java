package com.scholary.podsummary.stage;

import com.scholary.podsummary.transcript.SpeakerTurn;
import java.util.List;

/** Speaker attribution stage. */
public interface DiarizationAdapter {

  /**
   * Assign speaker labels to transcribed turns.
   *
   * <p>Must return exactly one turn per input turn, in the same order. Implementations fail rather
   * than drop or add turns.
   *
   * @throws StageAdapterException if diarization fails
   */
  List<SpeakerTurn> diarize(List<SpeakerTurn> turns, AudioSource audio);

  String providerName();
}
