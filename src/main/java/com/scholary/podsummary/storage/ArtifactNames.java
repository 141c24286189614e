package com.scholary.podsummary.storage;

import java.util.Locale;

/** Logical asset names and the file names they are persisted under. */
public final class ArtifactNames {

  public static final String SOURCE_AUDIO_ASSET = "source_audio";
  public static final String TRANSCRIPT_ASSET = "transcript";
  public static final String DIARIZED_TRANSCRIPT_ASSET = "diarized_transcript";
  public static final String SUMMARY_ASSET = "summary";
  public static final String SUMMARY_AUDIO_ASSET = "summary_audio";

  public static final String SOURCE_PREFIX = "source";
  public static final String TRANSCRIPT_FILE = "transcript.json";
  public static final String DIARIZED_FILE = "diarized.json";
  public static final String SUMMARY_FILE = "summary.json";
  public static final String SUMMARY_AUDIO_FILE = "summary.mp3";

  private static final String DEFAULT_AUDIO_EXTENSION = ".mp3";

  private ArtifactNames() {}

  /**
   * File name for an uploaded source, keeping the extension of the client's file name.
   *
   * <p>{@code "episode.WAV"} becomes {@code "source.wav"}; a missing or odd extension falls back to
   * {@code "source.mp3"}.
   */
  public static String sourceFileName(String originalFilename) {
    return SOURCE_PREFIX + extension(originalFilename);
  }

  public static boolean isSourceFile(String fileName) {
    return fileName.startsWith(SOURCE_PREFIX + ".");
  }

  /** Media type an artifact is served and stored with, derived from its file extension. */
  public static String contentType(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".json")) {
      return "application/json";
    }
    if (lower.endsWith(".mp3")) {
      return "audio/mpeg";
    }
    if (lower.endsWith(".wav")) {
      return "audio/wav";
    }
    if (lower.endsWith(".m4a")) {
      return "audio/mp4";
    }
    return "application/octet-stream";
  }

  private static String extension(String filename) {
    if (filename == null) {
      return DEFAULT_AUDIO_EXTENSION;
    }
    int dot = filename.lastIndexOf('.');
    if (dot < 0 || dot == filename.length() - 1) {
      return DEFAULT_AUDIO_EXTENSION;
    }
    String ext = filename.substring(dot).toLowerCase(Locale.ROOT);
    return ext.matches("\\.[a-z0-9]{1,8}") ? ext : DEFAULT_AUDIO_EXTENSION;
  }
}
