package com.scholary.podsummary.ingest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fetches remote audio over HTTP(S).
 *
 * <p>Follows redirects, applies {@code ingest.downloadTimeout} to the whole request and stops
 * reading once {@code ingest.maxDownloadBytes} is exceeded.
 */
@Component
public class AudioDownloader {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioDownloader.class);

  private static final int BUFFER_SIZE = 64 * 1024;

  private final HttpClient httpClient;
  private final IngestProperties properties;

  @Autowired
  public AudioDownloader(IngestProperties properties) {
    this(
        HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(properties.downloadTimeout())
            .build(),
        properties);
  }

  AudioDownloader(HttpClient httpClient, IngestProperties properties) {
    this.httpClient = httpClient;
    this.properties = properties;
  }

  /**
   * Download the resource fully into memory.
   *
   * @throws IOException on transport failure, a non-2xx status or an oversized body
   * @throws InterruptedException if interrupted while waiting for the response
   */
  public byte[] download(URI uri) throws IOException, InterruptedException {
    LOGGER.info("Downloading audio: url={}", uri);

    HttpRequest request =
        HttpRequest.newBuilder().uri(uri).timeout(properties.downloadTimeout()).GET().build();
    HttpResponse<InputStream> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());

    try (InputStream body = response.body()) {
      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        throw new IOException("HTTP " + response.statusCode() + " from " + uri);
      }
      byte[] content = readLimited(body, properties.maxDownloadBytes());
      LOGGER.info("Downloaded audio: url={}, bytes={}", uri, content.length);
      return content;
    }
  }

  private static byte[] readLimited(InputStream in, long maxBytes) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[BUFFER_SIZE];
    long total = 0;
    int read;
    while ((read = in.read(buffer)) != -1) {
      total += read;
      if (total > maxBytes) {
        throw new IOException("Download exceeds limit of " + maxBytes + " bytes");
      }
      out.write(buffer, 0, read);
    }
    if (total == 0) {
      throw new IOException("Downloaded file is empty");
    }
    return out.toByteArray();
  }
}
