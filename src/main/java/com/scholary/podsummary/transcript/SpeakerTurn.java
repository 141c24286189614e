package com.scholary.podsummary.transcript;

/**
 * A single speaker-attributed, time-bounded span of transcribed text.
 *
 * <p>Offsets are seconds from the start of the source audio.
 */
public record SpeakerTurn(String speaker, double start, double end, String text) {

  public static final String UNKNOWN_SPEAKER = "unknown";

  /** Copy of this turn with a different speaker label; timing and text are kept. */
  public SpeakerTurn withSpeaker(String newSpeaker) {
    return new SpeakerTurn(newSpeaker, start, end, text);
  }
}
