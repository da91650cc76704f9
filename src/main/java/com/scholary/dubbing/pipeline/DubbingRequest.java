package com.scholary.dubbing.pipeline;

import com.scholary.dubbing.synthesis.VoiceResolver;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * Request to dub one video.
 *
 * @param videoRef {@code s3://bucket/key}, a {@code file:} URI or an absolute path
 * @param targetLanguage ISO 639-1 code of the dubbed speech
 * @param voiceOption {@code "clone"} or a provider voice id
 * @param voiceStyle natural, dramatic, calm or energetic; ignored for cloned voices
 */
public record DubbingRequest(
    @NotBlank @Schema(example = "s3://videos/talk.mp4") String videoRef,
    @NotBlank @Schema(example = "es") String targetLanguage,
    @Schema(defaultValue = "clone") String voiceOption,
    @Schema(defaultValue = "natural") String voiceStyle) {

  public DubbingRequest {
    if (voiceOption == null || voiceOption.isBlank()) {
      voiceOption = VoiceResolver.CLONE_OPTION;
    }
    if (voiceStyle == null || voiceStyle.isBlank()) {
      voiceStyle = "natural";
    }
  }
}
