package com.scholary.dubbing.synthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.error.UpstreamException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the ElevenLabs text-to-speech and voice-cloning API.
 *
 * <p>Synthesis posts JSON and receives mp3 bytes. Cloning posts the speaker sample as
 * multipart/form-data, built by hand because the JDK HttpClient has no multipart support.
 */
@Component
public class ElevenLabsSynthesizer implements SpeechSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(ElevenLabsSynthesizer.class);
  private static final String PROVIDER = "elevenlabs";

  /** Samples smaller than this can't produce a usable clone. */
  static final long MIN_SAMPLE_BYTES = 1024;

  private final HttpClient httpClient;
  private final ElevenLabsProperties properties;
  private final ObjectMapper objectMapper;

  public ElevenLabsSynthesizer(ElevenLabsProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized ElevenLabs client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.modelId());
  }

  @Override
  public byte[] synthesize(String text, String voiceId, VoiceSettings settings) {
    requireApiKey();
    LOGGER.debug("Synthesizing {} chars with voice {}", text.length(), voiceId);

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("text", text);
    payload.put("model_id", properties.modelId());
    payload.put("voice_settings", settings);

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/text-to-speech/" + voiceId))
              .timeout(Duration.ofSeconds(properties.requestTimeout()))
              .header("Accept", "audio/mpeg")
              .header("Content-Type", "application/json")
              .header("xi-api-key", properties.apiKey())
              .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(payload)))
              .build();

      HttpResponse<byte[]> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());

      if (response.statusCode() != 200) {
        throw new UpstreamException(
            PROVIDER,
            String.format(
                "Speech synthesis failed with status %d: %s",
                response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
      }
      return response.body();

    } catch (HttpTimeoutException e) {
      throw new UpstreamException(PROVIDER, "Speech synthesis request timed out", e);
    } catch (IOException e) {
      throw new UpstreamException(PROVIDER, "Speech synthesis failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamException(PROVIDER, "Speech synthesis interrupted", e);
    }
  }

  @Override
  public String cloneVoice(Path sample, String name) {
    requireApiKey();

    try {
      if (!Files.isReadable(sample)) {
        throw new NotFoundException("Voice sample not found: " + sample);
      }
      long size = Files.size(sample);
      if (size < MIN_SAMPLE_BYTES) {
        throw new UpstreamException(
            PROVIDER, String.format("Voice sample too small for cloning: %d bytes", size));
      }

      LOGGER.info("Cloning voice: name={}, sample={} ({} KB)", name, sample.getFileName(), size / 1024);

      String boundary = UUID.randomUUID().toString();
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/voices/add"))
              .timeout(Duration.ofSeconds(properties.requestTimeout()))
              .header("xi-api-key", properties.apiKey())
              .header("Content-Type", "multipart/form-data; boundary=" + boundary)
              .POST(buildCloneBody(sample, name, boundary))
              .build();

      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) {
        throw new UpstreamException(
            PROVIDER,
            String.format(
                "Voice cloning failed with status %d: %s",
                response.statusCode(), response.body()));
      }

      String voiceId = objectMapper.readTree(response.body()).path("voice_id").asText("");
      if (voiceId.isBlank()) {
        throw new UpstreamException(
            PROVIDER, "Voice cloning succeeded but no voice_id in response");
      }

      LOGGER.info("Cloned voice: name={}, voiceId={}", name, voiceId);
      return voiceId;

    } catch (HttpTimeoutException e) {
      throw new UpstreamException(PROVIDER, "Voice cloning request timed out", e);
    } catch (IOException e) {
      throw new UpstreamException(PROVIDER, "Voice cloning failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamException(PROVIDER, "Voice cloning interrupted", e);
    }
  }

  @Override
  public List<VoiceOption> listVoices() {
    requireApiKey();

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/voices"))
              .timeout(Duration.ofSeconds(properties.voiceListTimeout()))
              .header("xi-api-key", properties.apiKey())
              .GET()
              .build();

      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) {
        throw new UpstreamException(
            PROVIDER,
            String.format(
                "Failed to fetch voices with status %d: %s",
                response.statusCode(), response.body()));
      }
      return parseVoices(response.body());

    } catch (HttpTimeoutException e) {
      throw new UpstreamException(PROVIDER, "Voice list request timed out", e);
    } catch (IOException e) {
      throw new UpstreamException(PROVIDER, "Voice list request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamException(PROVIDER, "Voice list request interrupted", e);
    }
  }

  List<VoiceOption> parseVoices(String body) throws IOException {
    List<VoiceOption> voices = new ArrayList<>();
    for (JsonNode voice : objectMapper.readTree(body).path("voices")) {
      JsonNode labels = voice.path("labels");
      voices.add(
          new VoiceOption(
              voice.path("voice_id").asText(),
              voice.path("name").asText(),
              voice.path("description").asText(""),
              voice.path("category").asText(""),
              labels.path("accent").asText(""),
              labels.path("gender").asText(""),
              labels.path("age").asText("")));
    }
    return voices;
  }

  /**
   * Build the multipart/form-data body for a clone request.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="name"
   *
   * voice name
   * --boundary
   * Content-Disposition: form-data; name="description"
   *
   * Voice cloned from original video
   * --boundary
   * Content-Disposition: form-data; name="files"; filename="sample.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildCloneBody(Path sample, String name, String boundary)
      throws IOException {
    byte[] fileBytes = Files.readAllBytes(sample);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"name\"\r\n\r\n");
    sb.append(name).append("\r\n");

    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"description\"\r\n\r\n");
    sb.append("Voice cloned from original video").append("\r\n");

    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"files\"; filename=\"")
        .append(sample.getFileName())
        .append("\"\r\n");
    sb.append("Content-Type: audio/wav\r\n\r\n");

    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);
    byte[] suffix = ("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }

  private void requireApiKey() {
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new UpstreamException(PROVIDER, "ELEVENLABS_API_KEY is not configured");
    }
  }
}
