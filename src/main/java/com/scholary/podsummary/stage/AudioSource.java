package com.scholary.podsummary.stage;

/**
 * Audio handed to the transcription and diarization stages.
 *
 * @param jobId owning job
 * @param fileName artifact name of the source, e.g. {@code source.mp3}
 * @param content raw audio bytes
 */
public record AudioSource(String jobId, String fileName, byte[] content) {}
