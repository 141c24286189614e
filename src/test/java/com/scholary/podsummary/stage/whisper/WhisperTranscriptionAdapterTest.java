package com.scholary.podsummary.stage.whisper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podsummary.stage.AudioSource;
import com.scholary.podsummary.stage.StageAdapterException;
import com.scholary.podsummary.stage.TranscriptionResult;
import com.scholary.podsummary.transcript.SpeakerTurn;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WhisperTranscriptionAdapterTest {

  private static final AudioSource AUDIO =
      new AudioSource("job1", "source.mp3", "ID3-audio".getBytes(StandardCharsets.UTF_8));

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> response;

  private WhisperTranscriptionAdapter adapter;

  @BeforeEach
  void setUp() {
    adapter =
        new WhisperTranscriptionAdapter(
            httpClient, new WhisperProperties("http://whisper:8000", 5, 60, 1), new ObjectMapper());
  }

  @Test
  void transcribe_shouldMapSegmentsToUnknownSpeakerTurns() throws Exception {
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    when(response.statusCode()).thenReturn(200);
    when(response.body())
        .thenReturn(
            "{\"language\":\"de\",\"duration\":4.5,\"segments\":["
                + "{\"start\":0.0,\"end\":2.0,\"text\":\"  Hallo \"},"
                + "{\"start\":2.0,\"end\":4.5,\"text\":\"Welt\",\"avg_logprob\":-0.2}]}");

    TranscriptionResult result = adapter.transcribe(AUDIO);

    assertThat(result.language()).isEqualTo("de");
    assertThat(result.duration()).isEqualTo(4.5);
    assertThat(result.turns())
        .containsExactly(
            new SpeakerTurn(SpeakerTurn.UNKNOWN_SPEAKER, 0.0, 2.0, "Hallo"),
            new SpeakerTurn(SpeakerTurn.UNKNOWN_SPEAKER, 2.0, 4.5, "Welt"));

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    assertThat(captor.getValue().uri().toString())
        .isEqualTo("http://whisper:8000/api/v1/transcribe");
    assertThat(captor.getValue().headers().firstValue("Content-Type"))
        .hasValueSatisfying(
            value -> assertThat(value).startsWith("multipart/form-data; boundary="));
  }

  @Test
  void transcribe_shouldDefaultLanguageToEnglish() throws Exception {
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    when(response.statusCode()).thenReturn(200);
    when(response.body()).thenReturn("{\"segments\":[{\"start\":0,\"end\":1,\"text\":\"hi\"}]}");

    assertThat(adapter.transcribe(AUDIO).language()).isEqualTo("en");
  }

  @Test
  void transcribe_shouldFailOnEmptySegments() throws Exception {
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    when(response.statusCode()).thenReturn(200);
    when(response.body()).thenReturn("{\"language\":\"en\",\"segments\":[]}");

    assertThatThrownBy(() -> adapter.transcribe(AUDIO))
        .isInstanceOf(StageAdapterException.class)
        .hasMessage("whisper: Whisper returned no segments.");
  }

  @Test
  void transcribe_shouldFailAfterExhaustingAttempts() throws Exception {
    doThrow(new IOException("connection refused"))
        .when(httpClient)
        .send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> adapter.transcribe(AUDIO))
        .isInstanceOf(StageAdapterException.class)
        .hasMessageContaining("failed after 1 attempts")
        .hasMessageContaining("connection refused");
    verify(httpClient, times(1)).send(any(HttpRequest.class), any());
  }

  @Test
  void transcribe_shouldTreatNonOkStatusAsFailure() throws Exception {
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    when(response.statusCode()).thenReturn(503);
    when(response.body()).thenReturn("overloaded");

    assertThatThrownBy(() -> adapter.transcribe(AUDIO))
        .isInstanceOf(StageAdapterException.class)
        .hasMessageContaining("status 503");
  }

  @Test
  void buildMultipartBody_shouldWrapContentInSingleFilePart() {
    String body =
        new String(adapter.buildMultipartBody(AUDIO, "b0undary"), StandardCharsets.UTF_8);

    assertThat(body)
        .startsWith("--b0undary\r\n")
        .contains("Content-Disposition: form-data; name=\"file\"; filename=\"source.mp3\"")
        .contains("ID3-audio")
        .endsWith("\r\n--b0undary--\r\n");
  }
}
