package com.scholary.podsummary.storage;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Per-job artifact persistence.
 *
 * <p>Artifacts are addressed by job id and file name. A job's namespace is created on its first
 * write; writes to an existing name replace it. Implementations exist for the local filesystem and
 * for S3-compatible object storage.
 */
public interface ArtifactStore {

  /**
   * Persist an artifact.
   *
   * @return the artifact's public reference, as {@link #reference(String, String)} would return
   * @throws StorageException if the write fails
   */
  String write(String jobId, String name, byte[] content);

  default String writeText(String jobId, String name, String content) {
    return write(jobId, name, content.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Read an artifact fully into memory.
   *
   * @throws ArtifactNotFoundException if it does not exist
   * @throws StorageException if the read fails
   */
  byte[] read(String jobId, String name);

  boolean exists(String jobId, String name);

  /** Name of the job's source audio file ({@code source.*}), if one has been stored. */
  Optional<String> findSourceAudio(String jobId);

  /**
   * Public locator for an artifact. Pure: performs no I/O and does not require the artifact to
   * exist yet.
   */
  String reference(String jobId, String name);
}
