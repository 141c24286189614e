package com.scholary.podsummary.stage.tts;

import com.scholary.podsummary.stage.SpeechSynthesisAdapter;
import com.scholary.podsummary.stage.StageAdapterException;

/** Used when {@code stages.speech.provider} is {@code none}; every call fails. */
public class DisabledSpeechSynthesisAdapter implements SpeechSynthesisAdapter {

  @Override
  public String providerName() {
    return "none";
  }

  @Override
  public byte[] synthesize(String text, String voice) {
    throw new StageAdapterException(providerName(), "TTS provider not configured or unsupported.");
  }
}
