package com.scholary.dubbing.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for dubbing jobs.
 *
 * <p>Controls where session artifacts live, how many jobs and synthesis calls run at once, how
 * long sessions are kept, and the timing reconciler's thresholds.
 *
 * <p>{@code localVideoRoot} is the only directory local video references may point into; left
 * blank, local references are refused.
 */
@ConfigurationProperties(prefix = "dubbing")
@Validated
public record DubbingProperties(
    @NotBlank String workDir,
    String localVideoRoot,
    @Positive int pipelineThreads,
    @Positive int pipelineQueueSize,
    @Valid @NotNull SessionProperties session,
    @Valid @NotNull SynthesisProperties synthesis,
    @Valid @NotNull TimingProperties timing,
    @Valid @NotNull VoiceProperties voice) {

  /** Directory local video references are confined to, if any. */
  public Optional<Path> localVideoRootPath() {
    if (localVideoRoot == null || localVideoRoot.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(Path.of(localVideoRoot));
  }

  public record SessionProperties(
      @Positive int maxSessions, @NotNull Duration retention, @NotNull Duration reapInterval) {}

  public record SynthesisProperties(
      @Positive int concurrency, @Positive int queueSize, @NotNull Duration utteranceTimeout) {}

  public record TimingProperties(
      @Positive double gapThresholdSeconds,
      @Positive double minSilenceSeconds,
      @Positive double driftTolerance) {}

  public record VoiceProperties(
      boolean fallbackOnCloneFailure,
      @NotBlank String defaultVoiceId,
      Map<String, String> languageVoices) {

    public VoiceProperties {
      languageVoices = languageVoices == null ? Map.of() : Map.copyOf(languageVoices);
    }

    /** Stock voice for a target language when the speaker can't be cloned. */
    public String fallbackVoiceFor(String language) {
      return languageVoices.getOrDefault(language, defaultVoiceId);
    }
  }
}
