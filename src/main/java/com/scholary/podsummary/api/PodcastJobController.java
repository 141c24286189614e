package com.scholary.podsummary.api;

import com.scholary.podsummary.job.Job;
import com.scholary.podsummary.service.Artifact;
import com.scholary.podsummary.service.PodcastJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for podcast jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Uploading audio or submitting a podcast URL
 *   <li>Starting the processing pipeline
 *   <li>Polling results
 *   <li>On-demand speech synthesis
 *   <li>Serving stored artifacts
 * </ul>
 */
@RestController
@Tag(name = "Podcast jobs", description = "Podcast transcription and summarization API")
public class PodcastJobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(PodcastJobController.class);

  private final PodcastJobService jobService;

  public PodcastJobController(PodcastJobService jobService) {
    this.jobService = jobService;
  }

  /**
   * Create a job from an uploaded file or a podcast URL.
   *
   * <p>A URL is downloaded in the background; poll results until {@code assets.source_audio}
   * appears before starting processing.
   */
  @PostMapping("/upload")
  @Operation(
      summary = "Upload podcast audio",
      description =
          "Accepts either a multipart 'file' or a 'podcast_url' parameter, never both. "
              + "Returns the new job id.")
  public ResponseEntity<UploadResponse> upload(
      @RequestParam(value = "file", required = false) MultipartFile file,
      @RequestParam(value = "podcast_url", required = false) String podcastUrl)
      throws IOException {
    byte[] content = file == null ? null : file.getBytes();
    String filename = file == null ? null : file.getOriginalFilename();
    LOGGER.info(
        "Upload request: file={}, bytes={}, url={}",
        filename,
        content == null ? 0 : content.length,
        podcastUrl);

    Job job = jobService.createJob(content, filename, podcastUrl);
    return ResponseEntity.ok(new UploadResponse(job.jobId(), JobStatusResponse.from(job)));
  }

  @PostMapping("/process")
  @Operation(
      summary = "Start processing",
      description =
          "Runs transcription, diarization, summarization and, if enable_tts is set, speech "
              + "synthesis in the background. Calling it again for a running or finished job "
              + "returns the current status.")
  public ResponseEntity<ProcessResponse> process(@Valid @RequestBody ProcessRequest request) {
    LOGGER.info("Process request: jobId={}, enableTts={}", request.jobId(), request.enableTts());
    Job job = jobService.startProcessing(request.jobId(), request.enableTts());
    return ResponseEntity.ok(new ProcessResponse(job.jobId(), JobStatusResponse.from(job)));
  }

  @GetMapping("/results/{jobId}")
  @Operation(summary = "Get job status and results")
  public ResponseEntity<ResultsResponse> results(@PathVariable("jobId") String jobId) {
    return ResponseEntity.ok(ResultsResponse.from(jobService.getResults(jobId)));
  }

  @PostMapping("/tts")
  @Operation(
      summary = "Synthesize speech",
      description = "Synthesizes the given text and attaches it to the job as its summary audio.")
  public ResponseEntity<SpeechSynthesisResponse> synthesize(
      @Valid @RequestBody SpeechSynthesisRequest request) {
    LOGGER.info("TTS request: jobId={}, voice={}", request.jobId(), request.voice());
    String audioUrl =
        jobService.requestSpeechSynthesis(request.jobId(), request.text(), request.voice());
    return ResponseEntity.ok(new SpeechSynthesisResponse(request.jobId(), audioUrl));
  }

  @GetMapping("/media/{jobId}/{name}")
  @Operation(summary = "Download a stored artifact")
  public ResponseEntity<byte[]> media(
      @PathVariable("jobId") String jobId, @PathVariable("name") String name) {
    Artifact artifact = jobService.fetchArtifact(jobId, name);
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(artifact.contentType()))
        .body(artifact.content());
  }

  @GetMapping("/health")
  @Operation(summary = "Liveness check")
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }
}
