package com.scholary.dubbing.translation;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the translation client. */
@ConfigurationProperties(prefix = "translation")
@Validated
public record TranslationProperties(
    @NotBlank String baseUrl, @Positive int connectTimeout, @Positive int readTimeout) {}
