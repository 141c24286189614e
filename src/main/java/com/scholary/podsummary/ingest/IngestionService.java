package com.scholary.podsummary.ingest;

import com.scholary.podsummary.InvalidInputException;
import com.scholary.podsummary.job.Job;
import com.scholary.podsummary.job.JobRegistry;
import com.scholary.podsummary.logging.StructuredLogger;
import com.scholary.podsummary.storage.ArtifactNames;
import com.scholary.podsummary.storage.ArtifactStore;
import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Creates jobs from an uploaded file or a podcast URL.
 *
 * <p>Uploads are stored synchronously, so the returned job already carries its
 * {@code source_audio} asset. URL downloads run on the ingest executor; until one finishes the job
 * has no source audio, and a failed download fails the job with {@code "Download failed: ..."}.
 */
@Service
public class IngestionService {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionService.class);

  private final JobRegistry registry;
  private final ArtifactStore artifactStore;
  private final AudioDownloader downloader;
  private final Executor ingestExecutor;

  public IngestionService(
      JobRegistry registry,
      ArtifactStore artifactStore,
      AudioDownloader downloader,
      @Qualifier("ingestExecutor") Executor ingestExecutor) {
    this.registry = registry;
    this.artifactStore = artifactStore;
    this.downloader = downloader;
    this.ingestExecutor = ingestExecutor;
  }

  /**
   * Create a job from exactly one audio source.
   *
   * @param content uploaded bytes, or {@code null}
   * @param filename client file name of the upload, used for its extension
   * @param url podcast URL, or {@code null}
   * @throws InvalidInputException if neither or both sources are given
   */
  public Job ingest(byte[] content, String filename, String url) {
    boolean hasFile = content != null;
    boolean hasUrl = url != null && !url.isBlank();
    if (!hasFile && !hasUrl) {
      throw new InvalidInputException("Provide either an audio file or a podcast URL.");
    }
    if (hasFile && hasUrl) {
      throw new InvalidInputException("Provide either an audio file or a podcast URL, not both.");
    }
    return hasFile ? ingestUpload(content, filename) : ingestUrl(url);
  }

  /** Create a job and store the uploaded bytes as its source audio. */
  public Job ingestUpload(byte[] content, String filename) {
    if (content == null || content.length == 0) {
      throw new InvalidInputException("Uploaded audio file is empty.");
    }
    String jobId = newJobId();
    registry.create(jobId);

    String fileName = ArtifactNames.sourceFileName(filename);
    String ref = artifactStore.write(jobId, fileName, content);
    Job job = registry.setAsset(jobId, ArtifactNames.SOURCE_AUDIO_ASSET, ref);
    LOGGER.info(
        "Ingested upload: jobId={}, file={}, bytes={}", jobId, fileName, content.length);
    return job;
  }

  /** Create a job and download its source audio in the background. */
  public Job ingestUrl(String url) {
    URI uri = parseUrl(url);
    String jobId = newJobId();
    Job job = registry.create(jobId);

    try {
      ingestExecutor.execute(() -> download(jobId, uri));
      LOGGER.info("Queued download: jobId={}, url={}", jobId, uri);
    } catch (RejectedExecutionException e) {
      LOGGER.error("Download executor rejected job {}", jobId, e);
      job = registry.fail(jobId, "Download failed: download queue is full");
    }
    return job;
  }

  void download(String jobId, URI uri) {
    StructuredLogger.setJobContext(jobId);
    try {
      byte[] content = downloader.download(uri);
      String ref = artifactStore.write(jobId, ArtifactNames.sourceFileName(null), content);
      registry.setAsset(jobId, ArtifactNames.SOURCE_AUDIO_ASSET, ref);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      registry.fail(jobId, "Download failed: interrupted");
    } catch (IOException | RuntimeException e) {
      LOGGER.warn("Download failed for job {}: {}", jobId, e.getMessage());
      String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      registry.fail(jobId, "Download failed: " + message);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private static URI parseUrl(String url) {
    URI uri;
    try {
      uri = URI.create(url.trim());
    } catch (IllegalArgumentException e) {
      throw new InvalidInputException("Invalid podcast URL: " + url);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
      throw new InvalidInputException("Podcast URL must be an absolute http(s) URL: " + url);
    }
    return uri;
  }

  private static String newJobId() {
    return UUID.randomUUID().toString().replace("-", "");
  }
}
