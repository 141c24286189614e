package com.scholary.podsummary.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podsummary.InvalidInputException;
import com.scholary.podsummary.job.IllegalStageTransitionException;
import com.scholary.podsummary.job.Job;
import com.scholary.podsummary.job.JobRegistry;
import com.scholary.podsummary.job.JobStage;
import com.scholary.podsummary.logging.StructuredLogger;
import com.scholary.podsummary.stage.AudioSource;
import com.scholary.podsummary.stage.DiarizationAdapter;
import com.scholary.podsummary.stage.SpeechSynthesisAdapter;
import com.scholary.podsummary.stage.StageAdapterException;
import com.scholary.podsummary.stage.SummarizationAdapter;
import com.scholary.podsummary.stage.TranscriptionAdapter;
import com.scholary.podsummary.stage.TranscriptionResult;
import com.scholary.podsummary.storage.ArtifactNames;
import com.scholary.podsummary.storage.ArtifactStore;
import com.scholary.podsummary.storage.StorageException;
import com.scholary.podsummary.transcript.SpeakerTurn;
import com.scholary.podsummary.transcript.Summary;
import com.scholary.podsummary.transcript.Transcript;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives a job through transcription, diarization, summarization and optional speech synthesis.
 *
 * <p>Each run executes on the pipeline executor. Every stage is recorded in the {@link JobRegistry}
 * before its adapter is invoked, so a status poll during a slow stage shows the stage in progress.
 * Adapter calls run on a separate stage executor and are bounded by {@code pipeline.stageTimeout};
 * a call that overruns is interrupted and fails the stage.
 *
 * <p>Any exception raised by a stage fails the job with {@code "<Stage> failed: <cause>"} and stops
 * the sequence. Nothing is retried here and artifacts already written are left in place.
 *
 * <p>At most one run per job is active. A launch for a job that is already running, or that has
 * left {@link JobStage#UPLOADED}, returns the current snapshot without starting anything.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobRegistry registry;
  private final ArtifactStore artifactStore;
  private final TranscriptionAdapter transcriptionAdapter;
  private final DiarizationAdapter diarizationAdapter;
  private final SummarizationAdapter summarizationAdapter;
  private final SpeechSynthesisAdapter speechSynthesisAdapter;
  private final ObjectMapper objectMapper;
  private final Executor pipelineExecutor;
  private final Executor stageExecutor;
  private final Duration stageTimeout;
  private final String defaultVoice;

  private final ConcurrentMap<String, CompletableFuture<Void>> activeRuns =
      new ConcurrentHashMap<>();

  public PipelineOrchestrator(
      JobRegistry registry,
      ArtifactStore artifactStore,
      TranscriptionAdapter transcriptionAdapter,
      DiarizationAdapter diarizationAdapter,
      SummarizationAdapter summarizationAdapter,
      SpeechSynthesisAdapter speechSynthesisAdapter,
      ObjectMapper objectMapper,
      @Qualifier("pipelineExecutor") Executor pipelineExecutor,
      @Qualifier("stageExecutor") Executor stageExecutor,
      PipelineProperties properties) {
    this.registry = registry;
    this.artifactStore = artifactStore;
    this.transcriptionAdapter = transcriptionAdapter;
    this.diarizationAdapter = diarizationAdapter;
    this.summarizationAdapter = summarizationAdapter;
    this.speechSynthesisAdapter = speechSynthesisAdapter;
    this.objectMapper = objectMapper;
    this.pipelineExecutor = pipelineExecutor;
    this.stageExecutor = stageExecutor;
    this.stageTimeout = properties.stageTimeout();
    this.defaultVoice = properties.defaultVoice();
  }

  /**
   * Schedule a run for the job and return its current snapshot immediately.
   *
   * @param jobId job to process
   * @param sourceAudioName artifact name of the job's source audio
   * @param enableSpeechSynthesis whether to synthesize the summary overview as audio
   * @throws com.scholary.podsummary.job.JobNotFoundException if the job does not exist
   */
  public Job launch(String jobId, String sourceAudioName, boolean enableSpeechSynthesis) {
    Job current = registry.snapshot(jobId);
    if (current.stage() != JobStage.UPLOADED) {
      LOGGER.info("Not launching job {}: stage is {}", jobId, current.stage().wireName());
      return current;
    }

    CompletableFuture<Void> handle = new CompletableFuture<>();
    if (activeRuns.putIfAbsent(jobId, handle) != null) {
      LOGGER.info("Not launching job {}: a run is already active", jobId);
      return registry.snapshot(jobId);
    }

    // A previous run may have finished between the first check and the claim
    current = registry.snapshot(jobId);
    if (current.stage() != JobStage.UPLOADED) {
      release(jobId, handle);
      return current;
    }

    try {
      CompletableFuture.runAsync(
              () -> run(jobId, sourceAudioName, enableSpeechSynthesis), pipelineExecutor)
          .whenComplete(
              (ignored, error) -> {
                if (error != null) {
                  recordEscapedFailure(jobId, error);
                }
                release(jobId, handle);
              });
      LOGGER.info(
          "Launched pipeline: jobId={}, source={}, speechSynthesis={}",
          jobId,
          sourceAudioName,
          enableSpeechSynthesis);
    } catch (RejectedExecutionException e) {
      LOGGER.error("Pipeline executor rejected job {}", jobId, e);
      registry.fail(jobId, "Pipeline failed: processing capacity exhausted, try again later");
      release(jobId, handle);
    }
    return registry.snapshot(jobId);
  }

  /**
   * Wait for the job's active run, if any, to finish.
   *
   * @return {@code true} if no run is active or it finished within {@code timeout}
   */
  public boolean awaitRun(String jobId, Duration timeout) throws InterruptedException {
    CompletableFuture<Void> handle = activeRuns.get(jobId);
    if (handle == null) {
      return true;
    }
    try {
      handle.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      return false;
    } catch (ExecutionException e) {
      return true;
    }
  }

  public int activeRuns() {
    return activeRuns.size();
  }

  public boolean isRunning(String jobId) {
    return activeRuns.containsKey(jobId);
  }

  void run(String jobId, String sourceAudioName, boolean enableSpeechSynthesis) {
    StructuredLogger.setJobContext(jobId);
    long runStart = System.nanoTime();
    JobStage stage = JobStage.TRANSCRIBING;
    try {
      enter(jobId, stage, "Running transcription", transcriptionAdapter.providerName());
      AudioSource audio =
          new AudioSource(jobId, sourceAudioName, artifactStore.read(jobId, sourceAudioName));
      Transcript transcript = transcribe(jobId, audio);

      stage = JobStage.DIARIZING;
      enter(jobId, stage, "Applying speaker diarization", diarizationAdapter.providerName());
      transcript = diarize(jobId, transcript, audio);

      stage = JobStage.SUMMARIZING;
      enter(jobId, stage, "Generating summary", summarizationAdapter.providerName());
      Summary summary = summarize(jobId, transcript);

      if (enableSpeechSynthesis) {
        stage = JobStage.SYNTHESIZING_SPEECH;
        enter(
            jobId, stage, "Synthesizing summary audio", speechSynthesisAdapter.providerName());
        synthesize(jobId, summary);
      }

      stage = JobStage.COMPLETED;
      registry.advance(jobId, JobStage.COMPLETED, "Processing complete");
      structuredLogger.logJobCompleted(jobId, elapsedMs(runStart), enableSpeechSynthesis);

    } catch (RuntimeException e) {
      String cause = describe(e);
      structuredLogger.logStageFailed(jobId, stage, e.getClass().getSimpleName(), cause);
      LOGGER.debug("Stage failure detail for job {}", jobId, e);
      registry.fail(jobId, stageLabel(stage) + " failed: " + cause);

    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private Transcript transcribe(String jobId, AudioSource audio) {
    long started = System.nanoTime();
    TranscriptionResult result =
        callAdapter(
            transcriptionAdapter.providerName(), () -> transcriptionAdapter.transcribe(audio));
    Transcript transcript = new Transcript(result.language(), result.duration(), result.turns());

    registry.setTranscript(jobId, transcript);
    String ref = artifactStore.writeText(jobId, ArtifactNames.TRANSCRIPT_FILE, toJson(transcript));
    registry.setAsset(jobId, ArtifactNames.TRANSCRIPT_ASSET, ref);

    LOGGER.info(
        "Transcribed {} turns, language={}", transcript.turns().size(), transcript.language());
    structuredLogger.logStageFinished(jobId, JobStage.TRANSCRIBING, elapsedMs(started));
    return transcript;
  }

  private Transcript diarize(String jobId, Transcript transcript, AudioSource audio) {
    long started = System.nanoTime();
    String provider = diarizationAdapter.providerName();
    List<SpeakerTurn> input = transcript.turns();
    List<SpeakerTurn> diarized =
        callAdapter(provider, () -> diarizationAdapter.diarize(input, audio));

    if (diarized == null || diarized.size() != input.size()) {
      throw new StageAdapterException(
          provider,
          String.format(
              "returned %d turns for %d input turns",
              diarized == null ? 0 : diarized.size(), input.size()));
    }

    Transcript result = transcript.withTurns(diarized);
    registry.setTranscript(jobId, result);
    String ref = artifactStore.writeText(jobId, ArtifactNames.DIARIZED_FILE, toJson(result));
    registry.setAsset(jobId, ArtifactNames.DIARIZED_TRANSCRIPT_ASSET, ref);

    structuredLogger.logStageFinished(jobId, JobStage.DIARIZING, elapsedMs(started));
    return result;
  }

  private Summary summarize(String jobId, Transcript transcript) {
    long started = System.nanoTime();
    List<SpeakerTurn> turns = transcript.turns();
    if (turns.isEmpty()) {
      throw new InvalidInputException("Transcript is empty.");
    }

    Summary summary =
        callAdapter(
            summarizationAdapter.providerName(), () -> summarizationAdapter.summarize(turns));

    registry.setSummary(jobId, summary);
    String ref = artifactStore.writeText(jobId, ArtifactNames.SUMMARY_FILE, toJson(summary));
    registry.setAsset(jobId, ArtifactNames.SUMMARY_ASSET, ref);

    structuredLogger.logStageFinished(jobId, JobStage.SUMMARIZING, elapsedMs(started));
    return summary;
  }

  private void synthesize(String jobId, Summary summary) {
    long started = System.nanoTime();
    String text = summary.overview();
    byte[] audio =
        callAdapter(
            speechSynthesisAdapter.providerName(),
            () -> speechSynthesisAdapter.synthesize(text, defaultVoice));

    String ref = artifactStore.write(jobId, ArtifactNames.SUMMARY_AUDIO_FILE, audio);
    registry.setAsset(jobId, ArtifactNames.SUMMARY_AUDIO_ASSET, ref);
    registry.setSummaryAudio(jobId, ref);

    structuredLogger.logStageFinished(jobId, JobStage.SYNTHESIZING_SPEECH, elapsedMs(started));
  }

  private void enter(String jobId, JobStage stage, String detail, String provider) {
    registry.advance(jobId, stage, detail);
    structuredLogger.logStageStarted(jobId, stage, provider);
  }

  /**
   * Run an adapter call on the stage executor, bounded by the stage timeout.
   *
   * <p>The timeout counts from the moment the call starts on a stage thread, so time spent queued
   * behind other jobs' calls is not charged to this one. On timeout the worker is interrupted and
   * its thread returned to the pool.
   */
  private <T> T callAdapter(String provider, Supplier<T> call) {
    CountDownLatch started = new CountDownLatch(1);
    FutureTask<T> task =
        new FutureTask<>(
            () -> {
              started.countDown();
              return call.get();
            });
    try {
      stageExecutor.execute(task);
    } catch (RejectedExecutionException e) {
      throw new StageAdapterException(provider, "stage executor rejected the call", e);
    }

    try {
      started.await();
      return task.get(stageTimeout.toMillis(), TimeUnit.MILLISECONDS);

    } catch (TimeoutException e) {
      task.cancel(true);
      throw new StageAdapterException(
          provider, "timed out after " + stageTimeout.toMillis() + "ms", e);

    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new StageAdapterException(provider, describe(cause), cause);

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      task.cancel(true);
      throw new StageAdapterException(provider, "interrupted", e);
    }
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new StorageException("Failed to serialize artifact: " + e.getOriginalMessage(), e);
    }
  }

  private void recordEscapedFailure(String jobId, Throwable error) {
    Throwable cause = error.getCause() != null ? error.getCause() : error;
    LOGGER.error("Pipeline run for job {} terminated abnormally", jobId, cause);
    try {
      if (registry.snapshot(jobId).stage() != JobStage.COMPLETED) {
        registry.fail(jobId, "Pipeline failed: " + describe(cause));
      }
    } catch (IllegalStageTransitionException e) {
      LOGGER.warn("Could not record failure for job {}: {}", jobId, e.getMessage());
    }
  }

  private void release(String jobId, CompletableFuture<Void> handle) {
    activeRuns.remove(jobId, handle);
    handle.complete(null);
  }

  private static String stageLabel(JobStage stage) {
    return switch (stage) {
      case TRANSCRIBING -> "Transcription";
      case DIARIZING -> "Diarization";
      case SUMMARIZING -> "Summarization";
      case SYNTHESIZING_SPEECH -> "Speech synthesis";
      default -> "Pipeline";
    };
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }
}
