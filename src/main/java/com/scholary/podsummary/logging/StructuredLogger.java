package com.scholary.podsummary.logging;

import com.scholary.podsummary.job.JobStage;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event sets an {@code event_type} field plus event-specific fields for the duration of the
 * log call, so log shippers can index pipeline progress without parsing messages. The job id is
 * carried separately via {@link #setJobContext(String)} for the whole run.
 */
public class StructuredLogger {

  public static final String JOB_ID = "jobId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String jobId, JobStage stage, String provider) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage.wireName());
      MDC.put("provider", provider);

      logger.info(
          "Stage started: jobId={}, stage={}, provider={}", jobId, stage.wireName(), provider);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String jobId, JobStage stage, long durationMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage.wireName());
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info(
          "Stage finished: jobId={}, stage={}, duration={}ms", jobId, stage.wireName(), durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failure event. */
  public void logStageFailed(String jobId, JobStage stage, String errorType, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("stage", stage.wireName());
      MDC.put("errorType", errorType);

      logger.error(
          "Stage failed: jobId={}, stage={}, error={}, message={}",
          jobId,
          stage.wireName(),
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log job completion event. */
  public void logJobCompleted(String jobId, long totalMs, boolean speechSynthesized) {
    try {
      MDC.put("event_type", "job_completed");
      MDC.put("durationMs", String.valueOf(totalMs));
      MDC.put("speechSynthesized", String.valueOf(speechSynthesized));

      logger.info(
          "Job completed: jobId={}, duration={}ms, speechSynthesized={}",
          jobId,
          totalMs,
          speechSynthesized);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put(JOB_ID, jobId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove(JOB_ID);
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("provider");
    MDC.remove("durationMs");
    MDC.remove("errorType");
    MDC.remove("speechSynthesized");
  }
}
