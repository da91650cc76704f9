package com.scholary.dubbing.synthesis;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ElevenLabs client.
 *
 * <p>{@code requestTimeout} bounds synthesis and cloning calls, {@code voiceListTimeout} the voice
 * catalogue lookup. The API key comes from {@code ELEVENLABS_API_KEY}.
 */
@ConfigurationProperties(prefix = "elevenlabs")
@Validated
public record ElevenLabsProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @NotBlank String modelId,
    @Positive int connectTimeout,
    @Positive int requestTimeout,
    @Positive int voiceListTimeout) {}
