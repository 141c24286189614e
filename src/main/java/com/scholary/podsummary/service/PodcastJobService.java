package com.scholary.podsummary.service;

import com.scholary.podsummary.InvalidInputException;
import com.scholary.podsummary.ingest.IngestionService;
import com.scholary.podsummary.job.Job;
import com.scholary.podsummary.job.JobRegistry;
import com.scholary.podsummary.pipeline.PipelineOrchestrator;
import com.scholary.podsummary.pipeline.PipelineProperties;
import com.scholary.podsummary.stage.SpeechSynthesisAdapter;
import com.scholary.podsummary.storage.ArtifactNames;
import com.scholary.podsummary.storage.ArtifactNotFoundException;
import com.scholary.podsummary.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry points for podcast jobs.
 *
 * <p>Validates requests and delegates: ingestion creates jobs, the orchestrator runs them, the
 * registry answers status queries. Speech synthesis requested here runs synchronously on the
 * caller's thread, outside any pipeline run.
 */
@Service
public class PodcastJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(PodcastJobService.class);

  private final JobRegistry registry;
  private final IngestionService ingestionService;
  private final PipelineOrchestrator orchestrator;
  private final ArtifactStore artifactStore;
  private final SpeechSynthesisAdapter speechSynthesisAdapter;
  private final String defaultVoice;

  public PodcastJobService(
      JobRegistry registry,
      IngestionService ingestionService,
      PipelineOrchestrator orchestrator,
      ArtifactStore artifactStore,
      SpeechSynthesisAdapter speechSynthesisAdapter,
      PipelineProperties pipelineProperties) {
    this.registry = registry;
    this.ingestionService = ingestionService;
    this.orchestrator = orchestrator;
    this.artifactStore = artifactStore;
    this.speechSynthesisAdapter = speechSynthesisAdapter;
    this.defaultVoice = pipelineProperties.defaultVoice();
  }

  /**
   * Create a job from an uploaded file or a podcast URL; exactly one must be given.
   *
   * @throws InvalidInputException if no source, both sources, an empty file or a bad URL is given
   */
  public Job createJob(byte[] content, String filename, String podcastUrl) {
    return ingestionService.ingest(content, filename, podcastUrl);
  }

  /**
   * Start the pipeline for a job whose source audio is stored.
   *
   * <p>Idempotent: for a job that is running or already finished this returns the current status
   * without starting a second run.
   *
   * @throws com.scholary.podsummary.job.JobNotFoundException if the job does not exist
   * @throws ArtifactNotFoundException if the source audio has not been stored yet
   */
  public Job startProcessing(String jobId, boolean enableSpeechSynthesis) {
    registry.get(jobId);
    String sourceAudio =
        artifactStore
            .findSourceAudio(jobId)
            .orElseThrow(
                () -> new ArtifactNotFoundException(jobId, ArtifactNames.SOURCE_AUDIO_ASSET));
    return orchestrator.launch(jobId, sourceAudio, enableSpeechSynthesis);
  }

  public JobResults getResults(String jobId) {
    return JobResults.from(registry.snapshot(jobId));
  }

  /**
   * Synthesize {@code text} and attach it to the job as its summary audio, replacing any earlier
   * one.
   *
   * @return the reference of the stored audio
   * @throws InvalidInputException if {@code text} is blank
   * @throws com.scholary.podsummary.stage.StageAdapterException if synthesis fails
   */
  public String requestSpeechSynthesis(String jobId, String text, String voice) {
    registry.get(jobId);
    if (text == null || text.isBlank()) {
      throw new InvalidInputException("Text to synthesize must not be blank.");
    }
    String effectiveVoice = voice == null || voice.isBlank() ? defaultVoice : voice;

    LOGGER.info(
        "Synthesizing speech: jobId={}, provider={}, chars={}",
        jobId,
        speechSynthesisAdapter.providerName(),
        text.length());
    byte[] audio = speechSynthesisAdapter.synthesize(text, effectiveVoice);

    String ref = artifactStore.write(jobId, ArtifactNames.SUMMARY_AUDIO_FILE, audio);
    registry.setAsset(jobId, ArtifactNames.SUMMARY_AUDIO_ASSET, ref);
    registry.setSummaryAudio(jobId, ref);
    return ref;
  }

  /**
   * Load a stored artifact.
   *
   * @throws ArtifactNotFoundException if it does not exist
   * @throws InvalidInputException if the job id or name is malformed
   */
  public Artifact fetchArtifact(String jobId, String name) {
    byte[] content = artifactStore.read(jobId, name);
    return new Artifact(name, ArtifactNames.contentType(name), content);
  }
}
