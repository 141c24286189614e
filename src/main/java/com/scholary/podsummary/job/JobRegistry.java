package com.scholary.podsummary.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.podsummary.transcript.Summary;
import com.scholary.podsummary.transcript.Transcript;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory table of job state keyed by job id.
 *
 * <p>Backed by a Caffeine cache built without size or time bounds, so a job stays registered for
 * the lifetime of the process. Each job's mutable state lives in a {@link JobEntry} whose monitor
 * serializes every mutator and {@link #snapshot(String)} for that job; jobs never contend with
 * each other.
 *
 * <p>{@code updatedAt} is clamped so it never moves backwards, even if the clock does.
 */
@Repository
public class JobRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobRegistry.class);

  private final Cache<String, JobEntry> jobs;
  private final Clock clock;

  public JobRegistry(Clock clock) {
    this.clock = clock;
    this.jobs = Caffeine.newBuilder().build();
  }

  /**
   * Register a new job in {@link JobStage#UPLOADED}.
   *
   * @throws DuplicateJobException if the id is already registered; the existing job is untouched
   */
  public Job create(String jobId) {
    JobEntry entry = new JobEntry(jobId, clock.instant());
    JobEntry existing = jobs.asMap().putIfAbsent(jobId, entry);
    if (existing != null) {
      throw new DuplicateJobException(jobId);
    }
    LOGGER.info("Registered job: {}", jobId);
    synchronized (entry) {
      return entry.snapshot();
    }
  }

  public Job get(String jobId) {
    return snapshot(jobId);
  }

  public boolean contains(String jobId) {
    return jobs.getIfPresent(jobId) != null;
  }

  public long size() {
    return jobs.estimatedSize();
  }

  /** Consistent point-in-time copy of the job. */
  public Job snapshot(String jobId) {
    JobEntry entry = entry(jobId);
    synchronized (entry) {
      return entry.snapshot();
    }
  }

  /**
   * Move the job forward to {@code stage}.
   *
   * @throws IllegalStageTransitionException if {@code stage} does not come after the current stage,
   *     the job is already terminal, or {@code stage} is {@link JobStage#FAILED} (use {@link
   *     #fail(String, String)})
   */
  public Job advance(String jobId, JobStage stage, String detail) {
    JobEntry entry = entry(jobId);
    synchronized (entry) {
      if (!stage.canFollow(entry.stage)) {
        throw new IllegalStageTransitionException(jobId, entry.stage, stage);
      }
      LOGGER.debug("Job {} stage {} -> {}", jobId, entry.stage, stage);
      entry.stage = stage;
      entry.detail = detail;
      touch(entry);
      return entry.snapshot();
    }
  }

  /**
   * Append an error and move the job to {@link JobStage#FAILED}.
   *
   * <p>Calling this on a job that has already failed appends another error. A completed job cannot
   * fail.
   */
  public Job fail(String jobId, String message) {
    JobEntry entry = entry(jobId);
    synchronized (entry) {
      if (entry.stage == JobStage.COMPLETED) {
        throw new IllegalStageTransitionException(jobId, entry.stage, JobStage.FAILED);
      }
      entry.errors.add(message);
      entry.stage = JobStage.FAILED;
      touch(entry);
      LOGGER.warn("Job {} failed: {}", jobId, message);
      return entry.snapshot();
    }
  }

  /**
   * Record the reference of a stored artifact under its logical name, replacing any earlier one.
   *
   * @throws NullPointerException if {@code name} or {@code reference} is null; the job is untouched
   */
  public Job setAsset(String jobId, String name, String reference) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(reference, "reference");
    JobEntry entry = entry(jobId);
    synchronized (entry) {
      entry.assets.put(name, reference);
      touch(entry);
      return entry.snapshot();
    }
  }

  public Job setTranscript(String jobId, Transcript transcript) {
    JobEntry entry = entry(jobId);
    synchronized (entry) {
      entry.transcript = transcript;
      touch(entry);
      return entry.snapshot();
    }
  }

  public Job setSummary(String jobId, Summary summary) {
    JobEntry entry = entry(jobId);
    synchronized (entry) {
      entry.summary = summary;
      touch(entry);
      return entry.snapshot();
    }
  }

  public Job setSummaryAudio(String jobId, String reference) {
    JobEntry entry = entry(jobId);
    synchronized (entry) {
      entry.summaryAudioRef = reference;
      touch(entry);
      return entry.snapshot();
    }
  }

  private JobEntry entry(String jobId) {
    JobEntry entry = jobId == null ? null : jobs.getIfPresent(jobId);
    if (entry == null) {
      throw new JobNotFoundException(jobId);
    }
    return entry;
  }

  private void touch(JobEntry entry) {
    Instant now = clock.instant();
    if (now.isAfter(entry.updatedAt)) {
      entry.updatedAt = now;
    }
  }

  /** Mutable job state. Every field is guarded by the entry's own monitor. */
  private static final class JobEntry {
    private final String jobId;
    private final Instant createdAt;
    private final List<String> errors = new ArrayList<>();
    private final Map<String, String> assets = new HashMap<>();

    private JobStage stage = JobStage.UPLOADED;
    private String detail;
    private Instant updatedAt;
    private Transcript transcript;
    private Summary summary;
    private String summaryAudioRef;

    private JobEntry(String jobId, Instant createdAt) {
      this.jobId = jobId;
      this.createdAt = createdAt;
      this.updatedAt = createdAt;
    }

    private Job snapshot() {
      return new Job(
          jobId,
          stage,
          detail,
          createdAt,
          updatedAt,
          errors,
          assets,
          transcript,
          summary,
          summaryAudioRef);
    }
  }
}
