package com.scholary.dubbing.transcription;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Deepgram transcription client.
 *
 * <p>The API key comes from the environment ({@code DEEPGRAM_API_KEY}).
 */
@ConfigurationProperties(prefix = "deepgram")
@Validated
public record DeepgramProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
