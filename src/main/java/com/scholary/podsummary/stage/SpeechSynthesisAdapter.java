package com.scholary.podsummary.stage;

/** Text-to-speech stage. */
public interface SpeechSynthesisAdapter {

  /**
   * Render text as MP3 audio.
   *
   * @param text text to speak
   * @param voice provider-specific voice id, or {@code null} for the configured default
   * @return MP3 bytes
   * @throws StageAdapterException if synthesis fails or no provider is configured
   */
  byte[] synthesize(String text, String voice);

  String providerName();
}
