package com.scholary.podsummary.stage.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podsummary.stage.StageAdapterException;
import com.scholary.podsummary.transcript.SpeakerTurn;
import com.scholary.podsummary.transcript.Summary;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OpenAiSummarizationAdapterTest {

  private static final List<SpeakerTurn> TURNS =
      List.of(new SpeakerTurn("Speaker 1", 0, 1, "Welcome to the show"));

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> response;

  private OpenAiSummarizationAdapter adapter(String apiKey) {
    return new OpenAiSummarizationAdapter(
        httpClient,
        new ObjectMapper(),
        "https://api.example.com/v1/",
        apiKey,
        "gpt-4o-mini",
        Duration.ofSeconds(30));
  }

  @Test
  void summarize_shouldParseMessageContent() throws Exception {
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    when(response.statusCode()).thenReturn(200);
    when(response.body())
        .thenReturn(
            "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":"
                + "\"{\\\"overview\\\":\\\"A pilot episode.\\\",\\\"key_points\\\":[\\\"intro\\\"]}\"}}]}");

    Summary summary = adapter("sk-test").summarize(TURNS);

    assertThat(summary.overview()).isEqualTo("A pilot episode.");
    assertThat(summary.keyPoints()).containsExactly("intro");

    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    assertThat(captor.getValue().uri().toString())
        .isEqualTo("https://api.example.com/v1/chat/completions");
    assertThat(captor.getValue().headers().firstValue("Authorization")).hasValue("Bearer sk-test");
  }

  @Test
  void summarize_shouldFailWithoutApiKey() {
    assertThatThrownBy(() -> adapter("").summarize(TURNS))
        .isInstanceOf(StageAdapterException.class)
        .hasMessage("openai: OpenAI API key not configured.");
    verifyNoInteractions(httpClient);
  }

  @Test
  void summarize_shouldFailOnErrorStatus() throws Exception {
    doReturn(response).when(httpClient).send(any(HttpRequest.class), any());
    when(response.statusCode()).thenReturn(429);
    when(response.body()).thenReturn("{\"error\":\"rate limited\"}");

    assertThatThrownBy(() -> adapter("sk-test").summarize(TURNS))
        .isInstanceOf(StageAdapterException.class)
        .hasMessageContaining("429");
  }
}
