package com.scholary.dubbing.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>The defaults are tuned for speech: mono 22.05 kHz PCM for transcription and cloning samples,
 * mono 44.1 kHz for the reconstructed track, AAC in the final container.
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int timeoutSeconds,
    @Positive int extractSampleRate,
    @Positive int trackSampleRate,
    @NotBlank String muxAudioCodec) {}
