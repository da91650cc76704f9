package com.scholary.dubbing.transcription;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.error.UpstreamException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for Deepgram's pre-recorded transcription API.
 *
 * <p>Sends the whole audio file as the request body and asks for smart formatting, punctuation,
 * word timing, utterances and paragraphs. Deepgram reports utterances at the top of {@code results}
 * and paragraphs inside the first alternative of the first channel; paragraphs carry their text as
 * a list of sentences, which we join.
 *
 * <p>No retries here: a failed transcription fails the stage and the caller resubmits.
 */
@Component
public class DeepgramTranscriber implements Transcriber {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeepgramTranscriber.class);
  private static final String PROVIDER = "deepgram";

  private static final Map<String, String> MIME_TYPES =
      Map.of(
          ".wav", "audio/wav",
          ".mp3", "audio/mpeg",
          ".m4a", "audio/mp4",
          ".webm", "audio/webm",
          ".opus", "audio/opus",
          ".ogg", "audio/ogg",
          ".flac", "audio/flac");

  private final HttpClient httpClient;
  private final DeepgramProperties properties;
  private final ObjectMapper objectMapper;

  public DeepgramTranscriber(DeepgramProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Deepgram client: baseUrl={}, model={}", properties.baseUrl(), properties.model());
  }

  @Override
  public TranscriptionResult transcribe(Path audioFile) {
    if (!Files.isReadable(audioFile)) {
      throw new NotFoundException("Audio file not found: " + audioFile);
    }
    if (properties.apiKey() == null || properties.apiKey().isBlank()) {
      throw new UpstreamException(PROVIDER, "DEEPGRAM_API_KEY is not configured");
    }

    LOGGER.info("Transcribing audio: file={}", audioFile.getFileName());

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(buildUri())
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Authorization", "Token " + properties.apiKey())
              .header("Content-Type", mimeTypeOf(audioFile))
              .POST(HttpRequest.BodyPublishers.ofFile(audioFile))
              .build();

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());

      if (response.statusCode() != 200) {
        throw new UpstreamException(
            PROVIDER,
            String.format(
                "Deepgram returned status %d: %s", response.statusCode(), response.body()));
      }

      TranscriptionResult result = parse(response.body());
      LOGGER.info(
          "Transcription successful: {} chars, {} words, {} utterances, {} paragraphs",
          result.text().length(),
          result.words().size(),
          result.utterances().size(),
          result.paragraphs().size());
      return result;

    } catch (HttpTimeoutException e) {
      throw new UpstreamException(PROVIDER, "Transcription request timed out", e);
    } catch (IOException e) {
      throw new UpstreamException(PROVIDER, "Transcription request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamException(PROVIDER, "Transcription interrupted", e);
    }
  }

  /** Map a Deepgram response body onto a {@link TranscriptionResult}. */
  TranscriptionResult parse(String body) throws IOException {
    JsonNode results = objectMapper.readTree(body).path("results");
    JsonNode alternative = results.path("channels").path(0).path("alternatives").path(0);

    String text = alternative.path("transcript").asText("");

    List<TranscriptWord> words = new ArrayList<>();
    for (JsonNode word : alternative.path("words")) {
      String value = word.path("punctuated_word").asText(word.path("word").asText(""));
      words.add(new TranscriptWord(value, word.path("start").asDouble(), word.path("end").asDouble()));
    }

    List<TranscriptSegment> utterances = new ArrayList<>();
    for (JsonNode utterance : results.path("utterances")) {
      utterances.add(
          new TranscriptSegment(
              utterance.path("start").asDouble(),
              utterance.path("end").asDouble(),
              utterance.path("transcript").asText("")));
    }

    List<TranscriptSegment> paragraphs = new ArrayList<>();
    for (JsonNode paragraph : alternative.path("paragraphs").path("paragraphs")) {
      List<String> sentences = new ArrayList<>();
      for (JsonNode sentence : paragraph.path("sentences")) {
        sentences.add(sentence.path("text").asText(""));
      }
      paragraphs.add(
          new TranscriptSegment(
              paragraph.path("start").asDouble(),
              paragraph.path("end").asDouble(),
              String.join(" ", sentences).strip()));
    }

    return new TranscriptionResult(text, words, utterances, paragraphs);
  }

  private URI buildUri() {
    return URI.create(
        properties.baseUrl()
            + "/v1/listen?model="
            + properties.model()
            + "&smart_format=true&punctuate=true&utterances=true&paragraphs=true&diarize=true");
  }

  private static String mimeTypeOf(Path audioFile) {
    String name = audioFile.getFileName().toString().toLowerCase(Locale.ROOT);
    int dot = name.lastIndexOf('.');
    return dot < 0 ? "audio/wav" : MIME_TYPES.getOrDefault(name.substring(dot), "audio/wav");
  }
}
