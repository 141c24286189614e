package com.scholary.podsummary.stage;

import com.scholary.podsummary.transcript.SpeakerTurn;
import com.scholary.podsummary.transcript.Summary;
import java.util.List;

/** Summarization stage. */
public interface SummarizationAdapter {

  /**
   * Summarize a diarized transcript.
   *
   * @throws com.scholary.podsummary.InvalidInputException if {@code turns} is empty
   * @throws StageAdapterException if the provider fails
   */
  Summary summarize(List<SpeakerTurn> turns);

  String providerName();
}
