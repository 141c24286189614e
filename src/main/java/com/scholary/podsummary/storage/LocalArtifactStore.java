package com.scholary.podsummary.storage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filesystem implementation of {@link ArtifactStore}: one directory per job under a root
 * directory.
 *
 * <p>Writes go to a temp file in the job directory which is then moved over the target, so a
 * concurrent reader sees either the old or the new content, never a partial file.
 */
public class LocalArtifactStore extends AbstractArtifactStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalArtifactStore.class);

  private final Path rootDir;

  public LocalArtifactStore(Path rootDir, String publicBaseUrl) {
    super(publicBaseUrl);
    this.rootDir = rootDir.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.rootDir);
    } catch (IOException e) {
      throw new StorageException("Failed to create artifact root directory: " + rootDir, e);
    }
    LOGGER.info("Initialized local artifact store: rootDir={}", this.rootDir);
  }

  @Override
  public String write(String jobId, String name, byte[] content) {
    validate(jobId, name);
    Path jobDir = rootDir.resolve(jobId);
    Path target = jobDir.resolve(name);
    Path temp = null;
    try {
      Files.createDirectories(jobDir);
      temp = Files.createTempFile(jobDir, "." + name, ".tmp");
      Files.write(temp, content);
      moveIntoPlace(temp, target);
      LOGGER.debug("Wrote artifact: jobId={}, name={}, bytes={}", jobId, name, content.length);
      return reference(jobId, name);
    } catch (IOException e) {
      deleteQuietly(temp);
      String message = String.format("Failed to write artifact: jobId=%s, name=%s", jobId, name);
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  @Override
  public byte[] read(String jobId, String name) {
    validate(jobId, name);
    Path path = rootDir.resolve(jobId).resolve(name);
    try {
      return Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      throw new ArtifactNotFoundException(jobId, name);
    } catch (IOException e) {
      String message = String.format("Failed to read artifact: jobId=%s, name=%s", jobId, name);
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  @Override
  public boolean exists(String jobId, String name) {
    validate(jobId, name);
    return Files.isRegularFile(rootDir.resolve(jobId).resolve(name));
  }

  @Override
  public Optional<String> findSourceAudio(String jobId) {
    validateJobId(jobId);
    Path jobDir = rootDir.resolve(jobId);
    if (!Files.isDirectory(jobDir)) {
      return Optional.empty();
    }
    try (Stream<Path> files = Files.list(jobDir)) {
      return files
          .filter(Files::isRegularFile)
          .map(path -> path.getFileName().toString())
          .filter(ArtifactNames::isSourceFile)
          .sorted()
          .findFirst();
    } catch (IOException e) {
      String message = "Failed to list artifacts for job " + jobId;
      LOGGER.error(message, e);
      throw new StorageException(message, e);
    }
  }

  private void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file {}: {}", temp, e.getMessage());
    }
  }
}
