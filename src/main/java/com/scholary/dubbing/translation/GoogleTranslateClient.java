package com.scholary.dubbing.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.error.UpstreamException;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Translator backed by the keyless Google Translate web endpoint.
 *
 * <p>The text travels as a form-encoded POST body so long transcripts don't hit URL length limits.
 * The response is a nested JSON array; the first element holds one {@code [translated, original,
 * ...]} entry per source sentence, which we concatenate.
 */
@Component
public class GoogleTranslateClient implements Translator {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleTranslateClient.class);
  private static final String PROVIDER = "google-translate";

  private final HttpClient httpClient;
  private final TranslationProperties properties;
  private final ObjectMapper objectMapper;

  public GoogleTranslateClient(TranslationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized translation client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String translate(String text, String targetLanguage) {
    SupportedLanguages.require(targetLanguage);
    if (text == null || text.isBlank()) {
      return "";
    }

    LOGGER.debug("Translating {} chars to {}", text.length(), targetLanguage);

    String form =
        "client=gtx&sl=auto&dt=t&tl="
            + URLEncoder.encode(targetLanguage, StandardCharsets.UTF_8)
            + "&q="
            + URLEncoder.encode(text, StandardCharsets.UTF_8);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/translate_a/single"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/x-www-form-urlencoded;charset=UTF-8")
            .POST(HttpRequest.BodyPublishers.ofString(form))
            .build();

    try {
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

      if (response.statusCode() != 200) {
        throw new UpstreamException(
            PROVIDER,
            String.format(
                "Translation service returned status %d: %s",
                response.statusCode(), response.body()));
      }

      return parse(response.body());

    } catch (HttpTimeoutException e) {
      throw new UpstreamException(PROVIDER, "Translation request timed out", e);
    } catch (IOException e) {
      throw new UpstreamException(PROVIDER, "Translation request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamException(PROVIDER, "Translation interrupted", e);
    }
  }

  /** Join the translated sentence fragments of a response body. */
  String parse(String body) throws IOException {
    JsonNode sentences = objectMapper.readTree(body).path(0);
    if (!sentences.isArray()) {
      throw new UpstreamException(PROVIDER, "Unexpected translation response: " + body);
    }

    StringBuilder translated = new StringBuilder();
    for (JsonNode sentence : sentences) {
      JsonNode fragment = sentence.path(0);
      if (fragment.isTextual()) {
        translated.append(fragment.asText());
      }
    }
    return translated.toString().strip();
  }
}
