package com.scholary.podsummary.stage.diarization;

import com.scholary.podsummary.stage.AudioSource;
import com.scholary.podsummary.stage.DiarizationAdapter;
import com.scholary.podsummary.stage.StageAdapterException;
import com.scholary.podsummary.transcript.SpeakerTurn;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Placeholder diarization used when no diarization backend is configured.
 *
 * <p>Does not look at the audio. Assigns the configured labels to turns in rotation, so turn 0
 * gets the first label, turn 1 the second and so on. Timing and text are preserved.
 */
public class RoundRobinDiarizationAdapter implements DiarizationAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(RoundRobinDiarizationAdapter.class);

  private final List<String> speakerLabels;

  public RoundRobinDiarizationAdapter(List<String> speakerLabels) {
    if (speakerLabels == null || speakerLabels.isEmpty()) {
      throw new IllegalArgumentException("At least one speaker label is required");
    }
    this.speakerLabels = List.copyOf(speakerLabels);
  }

  @Override
  public String providerName() {
    return "round-robin";
  }

  @Override
  public List<SpeakerTurn> diarize(List<SpeakerTurn> turns, AudioSource audio) {
    if (turns == null) {
      throw new StageAdapterException(providerName(), "No turns to diarize");
    }
    List<SpeakerTurn> labelled = new ArrayList<>(turns.size());
    for (int i = 0; i < turns.size(); i++) {
      labelled.add(turns.get(i).withSpeaker(speakerLabels.get(i % speakerLabels.size())));
    }
    LOGGER.debug("Assigned {} speakers across {} turns", speakerLabels.size(), turns.size());
    return labelled;
  }
}
