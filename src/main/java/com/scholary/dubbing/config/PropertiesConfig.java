package com.scholary.dubbing.config;

import com.scholary.dubbing.media.FfmpegProperties;
import com.scholary.dubbing.synthesis.ElevenLabsProperties;
import com.scholary.dubbing.transcription.DeepgramProperties;
import com.scholary.dubbing.translation.TranslationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the property records to be loaded from application.yml.
 *
 * <p>Object storage properties are enabled by {@link ObjectStoreConfig}.
 */
@Configuration
@EnableConfigurationProperties({
  DubbingProperties.class,
  FfmpegProperties.class,
  DeepgramProperties.class,
  TranslationProperties.class,
  ElevenLabsProperties.class
})
public class PropertiesConfig {}
