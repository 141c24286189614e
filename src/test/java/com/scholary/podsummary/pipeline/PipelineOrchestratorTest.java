package com.scholary.podsummary.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podsummary.job.Job;
import com.scholary.podsummary.job.JobNotFoundException;
import com.scholary.podsummary.job.JobRegistry;
import com.scholary.podsummary.job.JobStage;
import com.scholary.podsummary.stage.AudioSource;
import com.scholary.podsummary.stage.DiarizationAdapter;
import com.scholary.podsummary.stage.SpeechSynthesisAdapter;
import com.scholary.podsummary.stage.StageAdapterException;
import com.scholary.podsummary.stage.SummarizationAdapter;
import com.scholary.podsummary.stage.TranscriptionAdapter;
import com.scholary.podsummary.stage.TranscriptionResult;
import com.scholary.podsummary.stage.diarization.RoundRobinDiarizationAdapter;
import com.scholary.podsummary.storage.ArtifactNames;
import com.scholary.podsummary.storage.LocalArtifactStore;
import com.scholary.podsummary.transcript.SpeakerHighlights;
import com.scholary.podsummary.transcript.SpeakerTurn;
import com.scholary.podsummary.transcript.Summary;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PipelineOrchestratorTest {

  private static final String JOB_ID = "job1";
  private static final Duration WAIT = Duration.ofSeconds(10);

  private static final List<SpeakerTurn> THREE_TURNS =
      List.of(
          new SpeakerTurn(SpeakerTurn.UNKNOWN_SPEAKER, 0.0, 2.0, "Welcome to the show."),
          new SpeakerTurn(SpeakerTurn.UNKNOWN_SPEAKER, 2.0, 4.0, "Thanks for having me."),
          new SpeakerTurn(SpeakerTurn.UNKNOWN_SPEAKER, 4.0, 6.0, "Let's get started."));

  private static final Summary TEST_SUMMARY =
      new Summary(
          "test",
          List.of("point"),
          List.of(new SpeakerHighlights("Speaker 1", List.of("hosted"))));

  @TempDir Path tempDir;

  @Mock private TranscriptionAdapter transcription;
  @Mock private SummarizationAdapter summarization;
  @Mock private SpeechSynthesisAdapter speech;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private JobRegistry registry;
  private LocalArtifactStore store;
  private ExecutorService pipelineExecutor;
  private ExecutorService stageExecutor;

  @BeforeEach
  void setUp() {
    registry = new JobRegistry(Clock.systemUTC());
    store = new LocalArtifactStore(tempDir, "/media");
    pipelineExecutor = Executors.newFixedThreadPool(2);
    stageExecutor = Executors.newCachedThreadPool();

    lenient().when(transcription.providerName()).thenReturn("fake-stt");
    lenient().when(summarization.providerName()).thenReturn("fake-llm");
    lenient().when(speech.providerName()).thenReturn("fake-tts");

    registry.create(JOB_ID);
    String ref = store.write(JOB_ID, "source.mp3", new byte[] {1, 2, 3});
    registry.setAsset(JOB_ID, ArtifactNames.SOURCE_AUDIO_ASSET, ref);
  }

  @AfterEach
  void tearDown() {
    pipelineExecutor.shutdownNow();
    stageExecutor.shutdownNow();
  }

  private PipelineOrchestrator orchestrator(DiarizationAdapter diarization, Duration stageTimeout) {
    return orchestrator(diarization, stageTimeout, pipelineExecutor);
  }

  private PipelineOrchestrator orchestrator(
      DiarizationAdapter diarization, Duration stageTimeout, Executor executor) {
    return orchestrator(diarization, stageTimeout, executor, stageExecutor);
  }

  private PipelineOrchestrator orchestrator(
      DiarizationAdapter diarization,
      Duration stageTimeout,
      Executor executor,
      Executor adapterExecutor) {
    return new PipelineOrchestrator(
        registry,
        store,
        transcription,
        diarization,
        summarization,
        speech,
        objectMapper,
        executor,
        adapterExecutor,
        new PipelineProperties(2, 10, 4, stageTimeout, 1, "narrator"));
  }

  private PipelineOrchestrator defaultOrchestrator() {
    return orchestrator(
        new RoundRobinDiarizationAdapter(List.of("Speaker 1", "Speaker 2")), WAIT);
  }

  private Job runToEnd(PipelineOrchestrator orchestrator, boolean enableTts) throws Exception {
    orchestrator.launch(JOB_ID, "source.mp3", enableTts);
    assertThat(orchestrator.awaitRun(JOB_ID, WAIT)).isTrue();
    return registry.snapshot(JOB_ID);
  }

  @Test
  void launch_shouldCompleteThreeTurnEpisode() throws Exception {
    when(transcription.transcribe(any()))
        .thenReturn(new TranscriptionResult("en", 6.0, THREE_TURNS));
    when(summarization.summarize(anyList())).thenReturn(TEST_SUMMARY);

    Job job = runToEnd(defaultOrchestrator(), false);

    assertThat(job.stage()).isEqualTo(JobStage.COMPLETED);
    assertThat(job.detail()).isEqualTo("Processing complete");
    assertThat(job.errors()).isEmpty();
    assertThat(job.summary().overview()).isEqualTo("test");
    assertThat(job.assets())
        .containsKeys(
            ArtifactNames.TRANSCRIPT_ASSET,
            ArtifactNames.DIARIZED_TRANSCRIPT_ASSET,
            ArtifactNames.SUMMARY_ASSET)
        .doesNotContainKey(ArtifactNames.SUMMARY_AUDIO_ASSET);
    assertThat(job.assets().get(ArtifactNames.SUMMARY_ASSET)).isEqualTo("/media/job1/summary.json");
    assertThat(job.transcript().turns())
        .extracting(SpeakerTurn::speaker)
        .containsExactly("Speaker 1", "Speaker 2", "Speaker 1");
    assertThat(job.transcript().turns())
        .extracting(SpeakerTurn::text)
        .containsExactly("Welcome to the show.", "Thanks for having me.", "Let's get started.");

    JsonNode summaryJson = objectMapper.readTree(store.read(JOB_ID, ArtifactNames.SUMMARY_FILE));
    assertThat(summaryJson.path("overview").asText()).isEqualTo("test");
    assertThat(summaryJson.has("key_points")).isTrue();

    JsonNode transcriptJson =
        objectMapper.readTree(store.read(JOB_ID, ArtifactNames.TRANSCRIPT_FILE));
    assertThat(transcriptJson.path("turns").get(0).path("speaker").asText()).isEqualTo("unknown");
    JsonNode diarizedJson = objectMapper.readTree(store.read(JOB_ID, ArtifactNames.DIARIZED_FILE));
    assertThat(diarizedJson.path("turns").get(1).path("speaker").asText()).isEqualTo("Speaker 2");

    verify(speech, never()).synthesize(any(), any());
  }

  @Test
  void launch_shouldSynthesizeSummaryAudioWhenEnabled() throws Exception {
    when(transcription.transcribe(any()))
        .thenReturn(new TranscriptionResult("en", 6.0, THREE_TURNS));
    when(summarization.summarize(anyList())).thenReturn(TEST_SUMMARY);
    when(speech.synthesize("test", "narrator")).thenReturn(new byte[] {7, 7});

    Job job = runToEnd(defaultOrchestrator(), true);

    assertThat(job.stage()).isEqualTo(JobStage.COMPLETED);
    assertThat(job.summaryAudioRef()).isEqualTo("/media/job1/summary.mp3");
    assertThat(job.assets())
        .containsEntry(ArtifactNames.SUMMARY_AUDIO_ASSET, "/media/job1/summary.mp3");
    assertThat(store.read(JOB_ID, ArtifactNames.SUMMARY_AUDIO_FILE)).containsExactly(7, 7);
  }

  @Test
  void diarizationFailure_shouldFailJobAndKeepTranscript(@Mock DiarizationAdapter diarization)
      throws Exception {
    when(transcription.transcribe(any()))
        .thenReturn(new TranscriptionResult("en", 6.0, THREE_TURNS));
    when(diarization.providerName()).thenReturn("pyannote");
    when(diarization.diarize(anyList(), any()))
        .thenThrow(new StageAdapterException("pyannote", "model crashed"));

    Job job = runToEnd(orchestrator(diarization, WAIT), false);

    assertThat(job.stage()).isEqualTo(JobStage.FAILED);
    assertThat(job.errors()).containsExactly("Diarization failed: pyannote: model crashed");
    assertThat(job.assets())
        .containsEntry(ArtifactNames.TRANSCRIPT_ASSET, "/media/job1/transcript.json")
        .doesNotContainKeys(ArtifactNames.DIARIZED_TRANSCRIPT_ASSET, ArtifactNames.SUMMARY_ASSET);
    assertThat(store.exists(JOB_ID, ArtifactNames.TRANSCRIPT_FILE)).isTrue();
    assertThat(job.transcript().turns()).hasSize(3);
    verify(summarization, never()).summarize(anyList());
  }

  @Test
  void diarizationChangingTurnCount_shouldFailJob(@Mock DiarizationAdapter diarization)
      throws Exception {
    when(transcription.transcribe(any()))
        .thenReturn(new TranscriptionResult("en", 6.0, THREE_TURNS));
    when(diarization.providerName()).thenReturn("lossy");
    when(diarization.diarize(anyList(), any())).thenReturn(THREE_TURNS.subList(0, 2));

    Job job = runToEnd(orchestrator(diarization, WAIT), false);

    assertThat(job.stage()).isEqualTo(JobStage.FAILED);
    assertThat(job.errors())
        .singleElement()
        .asString()
        .startsWith("Diarization failed: lossy: ")
        .contains("returned 2 turns for 3 input turns");
    assertThat(job.assets()).doesNotContainKey(ArtifactNames.DIARIZED_TRANSCRIPT_ASSET);
  }

  @Test
  void emptyTranscript_shouldFailAtSummarizationWithoutCallingProvider() throws Exception {
    when(transcription.transcribe(any())).thenReturn(new TranscriptionResult("en", 0.0, List.of()));

    Job job = runToEnd(defaultOrchestrator(), false);

    assertThat(job.stage()).isEqualTo(JobStage.FAILED);
    assertThat(job.errors()).containsExactly("Summarization failed: Transcript is empty.");
    verify(summarization, never()).summarize(anyList());
  }

  @Test
  void speechSynthesisFailure_shouldFailJobAndKeepSummary() throws Exception {
    when(transcription.transcribe(any()))
        .thenReturn(new TranscriptionResult("en", 6.0, THREE_TURNS));
    when(summarization.summarize(anyList())).thenReturn(TEST_SUMMARY);
    when(speech.synthesize(any(), any()))
        .thenThrow(new StageAdapterException("fake-tts", "quota exceeded"));

    Job job = runToEnd(defaultOrchestrator(), true);

    assertThat(job.stage()).isEqualTo(JobStage.FAILED);
    assertThat(job.errors()).containsExactly("Speech synthesis failed: fake-tts: quota exceeded");
    assertThat(job.summary()).isEqualTo(TEST_SUMMARY);
    assertThat(job.assets()).containsKey(ArtifactNames.SUMMARY_ASSET);
    assertThat(job.summaryAudioRef()).isNull();
  }

  @Test
  void slowAdapter_shouldFailStageOnTimeout() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    when(transcription.transcribe(any()))
        .thenAnswer(
            invocation -> {
              release.await(10, TimeUnit.SECONDS);
              return new TranscriptionResult("en", 6.0, THREE_TURNS);
            });

    try {
      Job job =
          runToEnd(
              orchestrator(
                  new RoundRobinDiarizationAdapter(List.of("A")), Duration.ofMillis(200)),
              false);

      assertThat(job.stage()).isEqualTo(JobStage.FAILED);
      assertThat(job.errors())
          .containsExactly("Transcription failed: fake-stt: timed out after 200ms");
      assertThat(job.assets()).doesNotContainKey(ArtifactNames.TRANSCRIPT_ASSET);
    } finally {
      release.countDown();
    }
  }

  @Test
  void timedOutCall_shouldReleaseStageThreadForOtherJobs() throws Exception {
    ExecutorService singleStageThread = Executors.newSingleThreadExecutor();
    CountDownLatch slowCallStarted = new CountDownLatch(1);
    AtomicBoolean slowCallInterrupted = new AtomicBoolean();
    when(transcription.transcribe(any()))
        .thenAnswer(
            invocation -> {
              AudioSource audio = invocation.getArgument(0);
              if ("slow".equals(audio.jobId())) {
                slowCallStarted.countDown();
                try {
                  Thread.sleep(3_000);
                } catch (InterruptedException e) {
                  slowCallInterrupted.set(true);
                  throw new StageAdapterException("fake-stt", "interrupted");
                }
              }
              return new TranscriptionResult("en", 6.0, THREE_TURNS);
            });
    when(summarization.summarize(anyList())).thenReturn(TEST_SUMMARY);
    for (String jobId : List.of("slow", "fast")) {
      registry.create(jobId);
      store.write(jobId, "source.mp3", new byte[] {1});
    }

    try {
      PipelineOrchestrator orchestrator =
          orchestrator(
              new RoundRobinDiarizationAdapter(List.of("A", "B")),
              Duration.ofMillis(500),
              pipelineExecutor,
              singleStageThread);

      orchestrator.launch("slow", "source.mp3", false);
      assertThat(slowCallStarted.await(5, TimeUnit.SECONDS)).isTrue();
      orchestrator.launch("fast", "source.mp3", false);

      assertThat(orchestrator.awaitRun("slow", WAIT)).isTrue();
      assertThat(orchestrator.awaitRun("fast", WAIT)).isTrue();

      Job slow = registry.snapshot("slow");
      assertThat(slow.stage()).isEqualTo(JobStage.FAILED);
      assertThat(slow.errors())
          .containsExactly("Transcription failed: fake-stt: timed out after 500ms");
      assertThat(slowCallInterrupted).isTrue();

      Job fast = registry.snapshot("fast");
      assertThat(fast.errors()).isEmpty();
      assertThat(fast.stage()).isEqualTo(JobStage.COMPLETED);
    } finally {
      singleStageThread.shutdownNow();
    }
  }

  @Test
  void unexpectedError_shouldBeRecordedOnJob() throws Exception {
    when(transcription.transcribe(any())).thenThrow(new AssertionError("boom"));

    Job job = runToEnd(defaultOrchestrator(), false);

    assertThat(job.stage()).isEqualTo(JobStage.FAILED);
    assertThat(job.errors()).containsExactly("Pipeline failed: boom");
  }

  @Test
  void concurrentLaunches_shouldStartOnlyOneRun() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    when(transcription.transcribe(any()))
        .thenAnswer(
            invocation -> {
              release.await(10, TimeUnit.SECONDS);
              return new TranscriptionResult("en", 6.0, THREE_TURNS);
            });
    when(summarization.summarize(anyList())).thenReturn(TEST_SUMMARY);

    PipelineOrchestrator orchestrator = defaultOrchestrator();
    ExecutorService callers = Executors.newFixedThreadPool(2);
    CountDownLatch go = new CountDownLatch(1);
    try {
      List<Future<Job>> launches = new ArrayList<>();
      for (int i = 0; i < 2; i++) {
        launches.add(
            callers.submit(
                () -> {
                  go.await();
                  return orchestrator.launch(JOB_ID, "source.mp3", false);
                }));
      }
      go.countDown();
      for (Future<Job> launch : launches) {
        launch.get(5, TimeUnit.SECONDS);
      }

      await()
          .atMost(WAIT)
          .until(() -> registry.snapshot(JOB_ID).stage() == JobStage.TRANSCRIBING);
      assertThat(orchestrator.activeRuns()).isEqualTo(1);
      assertThat(orchestrator.isRunning(JOB_ID)).isTrue();

      Job whileRunning = orchestrator.launch(JOB_ID, "source.mp3", true);
      assertThat(whileRunning.stage()).isEqualTo(JobStage.TRANSCRIBING);
    } finally {
      release.countDown();
      callers.shutdownNow();
    }

    assertThat(orchestrator.awaitRun(JOB_ID, WAIT)).isTrue();
    assertThat(registry.snapshot(JOB_ID).stage()).isEqualTo(JobStage.COMPLETED);
    verify(transcription, times(1)).transcribe(any());
    verify(summarization, times(1)).summarize(anyList());
    await().atMost(WAIT).until(() -> orchestrator.activeRuns() == 0);
  }

  @Test
  void launchAfterCompletion_shouldReturnCachedResultWithoutRerunning() throws Exception {
    when(transcription.transcribe(any()))
        .thenReturn(new TranscriptionResult("en", 6.0, THREE_TURNS));
    when(summarization.summarize(anyList())).thenReturn(TEST_SUMMARY);
    PipelineOrchestrator orchestrator = defaultOrchestrator();
    runToEnd(orchestrator, false);

    Job again = orchestrator.launch(JOB_ID, "source.mp3", true);

    assertThat(again.stage()).isEqualTo(JobStage.COMPLETED);
    assertThat(orchestrator.activeRuns()).isZero();
    verify(transcription, times(1)).transcribe(any());
    verify(speech, never()).synthesize(any(), any());
  }

  @Test
  void observedStages_shouldNeverMoveBackwards() throws Exception {
    when(transcription.transcribe(any()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(30);
              return new TranscriptionResult("en", 6.0, THREE_TURNS);
            });
    when(summarization.summarize(anyList()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(30);
              return TEST_SUMMARY;
            });
    when(speech.synthesize(any(), any()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(30);
              return new byte[] {1};
            });

    PipelineOrchestrator orchestrator = defaultOrchestrator();
    orchestrator.launch(JOB_ID, "source.mp3", true);

    List<JobStage> observed = new ArrayList<>();
    long deadline = System.nanoTime() + WAIT.toNanos();
    JobStage stage;
    do {
      stage = registry.snapshot(JOB_ID).stage();
      observed.add(stage);
      Thread.sleep(2);
    } while (!stage.isTerminal() && System.nanoTime() < deadline);

    assertThat(observed).last().isEqualTo(JobStage.COMPLETED);
    assertThat(observed).doesNotContain(JobStage.FAILED);
    for (int i = 1; i < observed.size(); i++) {
      assertThat(observed.get(i).ordinal()).isGreaterThanOrEqualTo(observed.get(i - 1).ordinal());
    }
    assertThat(observed).contains(JobStage.TRANSCRIBING, JobStage.SUMMARIZING);
  }

  @Test
  void launch_shouldRejectUnknownJob() {
    assertThatThrownBy(() -> defaultOrchestrator().launch("nope", "source.mp3", false))
        .isInstanceOf(JobNotFoundException.class);
  }

  @Test
  void saturatedExecutor_shouldFailJobImmediately() {
    Executor rejecting =
        command -> {
          throw new RejectedExecutionException("queue full");
        };
    PipelineOrchestrator orchestrator =
        orchestrator(new RoundRobinDiarizationAdapter(List.of("A")), WAIT, rejecting);

    Job job = orchestrator.launch(JOB_ID, "source.mp3", false);

    assertThat(job.stage()).isEqualTo(JobStage.FAILED);
    assertThat(job.errors()).singleElement().asString().startsWith("Pipeline failed:");
    assertThat(orchestrator.activeRuns()).isZero();
  }
}
