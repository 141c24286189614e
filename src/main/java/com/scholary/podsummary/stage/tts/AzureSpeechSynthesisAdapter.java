package com.scholary.podsummary.stage.tts;

import com.scholary.podsummary.stage.SpeechSynthesisAdapter;
import com.scholary.podsummary.stage.StageAdapterException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Speech synthesis through Azure Cognitive Services.
 *
 * <p>Sends SSML and asks for {@code audio-24khz-48kbitrate-mono-mp3}. The text is XML-escaped
 * before it is embedded in the SSML document.
 */
public class AzureSpeechSynthesisAdapter implements SpeechSynthesisAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AzureSpeechSynthesisAdapter.class);

  static final String PROVIDER = "azure";
  static final String OUTPUT_FORMAT = "audio-24khz-48kbitrate-mono-mp3";

  private final HttpClient httpClient;
  private final String subscriptionKey;
  private final String region;
  private final String defaultVoice;
  private final Duration timeout;

  public AzureSpeechSynthesisAdapter(
      String subscriptionKey, String region, String defaultVoice, Duration timeout) {
    this(HttpClient.newHttpClient(), subscriptionKey, region, defaultVoice, timeout);
  }

  AzureSpeechSynthesisAdapter(
      HttpClient httpClient,
      String subscriptionKey,
      String region,
      String defaultVoice,
      Duration timeout) {
    this.httpClient = httpClient;
    this.subscriptionKey = subscriptionKey;
    this.region = region;
    this.defaultVoice = defaultVoice;
    this.timeout = timeout;
  }

  @Override
  public String providerName() {
    return PROVIDER;
  }

  @Override
  public byte[] synthesize(String text, String voice) {
    if (isBlank(subscriptionKey) || isBlank(region)) {
      throw new StageAdapterException(PROVIDER, "Azure Speech credentials are missing.");
    }
    String voiceName = isBlank(voice) ? defaultVoice : voice;
    LOGGER.info("Generating speech for {} chars with voice={}", text.length(), voiceName);

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(
                  URI.create(
                      "https://" + region + ".tts.speech.microsoft.com/cognitiveservices/v1"))
              .timeout(timeout)
              .header("Ocp-Apim-Subscription-Key", subscriptionKey)
              .header("Content-Type", "application/ssml+xml")
              .header("X-Microsoft-OutputFormat", OUTPUT_FORMAT)
              .header("User-Agent", "pod-summary")
              .POST(
                  HttpRequest.BodyPublishers.ofString(
                      ssml(text, voiceName), StandardCharsets.UTF_8))
              .build();

      HttpResponse<byte[]> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
      if (response.statusCode() != 200) {
        throw new StageAdapterException(
            PROVIDER, "Azure TTS returned status " + response.statusCode());
      }
      return response.body();

    } catch (IOException e) {
      throw new StageAdapterException(PROVIDER, "Azure TTS request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StageAdapterException(PROVIDER, "Azure TTS request interrupted", e);
    }
  }

  static String ssml(String text, String voiceName) {
    return "<speak version=\"1.0\" xml:lang=\"en-US\">"
        + "<voice name=\""
        + escapeXml(voiceName)
        + "\">"
        + escapeXml(text)
        + "</voice></speak>";
  }

  private static String escapeXml(String value) {
    return value
        .replace("&", "&amp;")
        .replace("<", "&lt;")
        .replace(">", "&gt;")
        .replace("\"", "&quot;")
        .replace("'", "&apos;");
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
