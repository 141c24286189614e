package com.scholary.podsummary.stage.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podsummary.stage.AudioSource;
import com.scholary.podsummary.stage.StageAdapterException;
import com.scholary.podsummary.stage.TranscriptionAdapter;
import com.scholary.podsummary.stage.TranscriptionResult;
import com.scholary.podsummary.transcript.SpeakerTurn;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transcription adapter backed by a faster-whisper HTTP service.
 *
 * <p>Sends the whole source file as multipart/form-data to {@code /api/v1/transcribe} and maps the
 * returned segments to turns with an {@code unknown} speaker. Transport failures and non-200
 * responses are retried with exponential backoff and jitter; an empty segment list is not.
 *
 * <p>Java's HttpClient has no multipart support, so the body is assembled by hand.
 */
public class WhisperTranscriptionAdapter implements TranscriptionAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperTranscriptionAdapter.class);

  static final String PROVIDER = "whisper";

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperTranscriptionAdapter(WhisperProperties properties, ObjectMapper objectMapper) {
    this(
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build(),
        properties,
        objectMapper);
  }

  WhisperTranscriptionAdapter(
      HttpClient httpClient, WhisperProperties properties, ObjectMapper objectMapper) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.objectMapper = objectMapper;
    LOGGER.info("Initialized Whisper adapter: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String providerName() {
    return PROVIDER;
  }

  @Override
  public TranscriptionResult transcribe(AudioSource audio) {
    LOGGER.info(
        "Transcribing audio: file={}, bytes={}", audio.fileName(), audio.content().length);

    WhisperResponse response = transcribeWithRetries(audio);
    if (response.segments() == null || response.segments().isEmpty()) {
      throw new StageAdapterException(PROVIDER, "Whisper returned no segments.");
    }

    List<SpeakerTurn> turns =
        response.segments().stream()
            .map(
                segment ->
                    new SpeakerTurn(
                        SpeakerTurn.UNKNOWN_SPEAKER,
                        segment.start(),
                        Math.max(segment.end(), segment.start()),
                        segment.text() == null ? "" : segment.text().strip()))
            .toList();

    String language = response.language() == null ? "en" : response.language();
    LOGGER.info("Transcription successful: {} turns, language={}", turns.size(), language);
    return new TranscriptionResult(language, response.duration(), turns);
  }

  private WhisperResponse transcribeWithRetries(AudioSource audio) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranscribe(audio);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new StageAdapterException(PROVIDER, "Transcription interrupted", e);
      }
    }

    throw new StageAdapterException(
        PROVIDER,
        String.format(
            "Transcription failed after %d attempts: %s",
            properties.maxRetries(), lastException == null ? "" : lastException.getMessage()),
        lastException);
  }

  private WhisperResponse attemptTranscribe(AudioSource audio)
      throws IOException, InterruptedException {
    String boundary = UUID.randomUUID().toString();

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(BodyPublishers.ofByteArray(buildMultipartBody(audio, boundary)))
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }
    return objectMapper.readValue(response.body(), WhisperResponse.class);
  }

  /**
   * Build a multipart/form-data body with a single {@code file} part.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="source.mp3"
   * Content-Type: application/octet-stream
   *
   * [binary data]
   * --boundary--
   * </pre>
   */
  byte[] buildMultipartBody(AudioSource audio, String boundary) {
    String head =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\""
            + audio.fileName()
            + "\"\r\n"
            + "Content-Type: application/octet-stream\r\n\r\n";
    String tail = "\r\n--" + boundary + "--\r\n";

    ByteArrayOutputStream body =
        new ByteArrayOutputStream(head.length() + audio.content().length + tail.length());
    body.writeBytes(head.getBytes(StandardCharsets.UTF_8));
    body.writeBytes(audio.content());
    body.writeBytes(tail.getBytes(StandardCharsets.UTF_8));
    return body.toByteArray();
  }

  private void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new StageAdapterException(PROVIDER, "Transcription interrupted", ie);
    }
  }
}
