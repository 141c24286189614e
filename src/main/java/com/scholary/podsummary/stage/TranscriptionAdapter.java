package com.scholary.podsummary.stage;

/**
 * Speech-to-text stage.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the pipeline.
 * Speaker labels in the returned turns are placeholders; diarization assigns real ones.
 */
public interface TranscriptionAdapter {

  /**
   * Transcribe an audio source.
   *
   * @throws StageAdapterException if transcription fails
   */
  TranscriptionResult transcribe(AudioSource audio);

  String providerName();
}
