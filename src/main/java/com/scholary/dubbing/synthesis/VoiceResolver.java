package com.scholary.dubbing.synthesis;

import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.config.DubbingProperties.VoiceProperties;
import com.scholary.dubbing.error.DubbingException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a request's voice option into a concrete provider voice.
 *
 * <p>{@code "clone"} clones the original speaker from the extracted audio and uses {@link
 * VoiceSettings#CLONED}; anything else is taken as a prebuilt voice id spoken with the requested
 * style. When cloning fails and fallback is enabled, the target language's stock voice is used
 * instead of failing the run.
 */
@Component
public class VoiceResolver {

  public static final String CLONE_OPTION = "clone";

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceResolver.class);

  private final SpeechSynthesizer synthesizer;
  private final VoiceProperties properties;

  public VoiceResolver(SpeechSynthesizer synthesizer, DubbingProperties dubbingProperties) {
    this.synthesizer = synthesizer;
    this.properties = dubbingProperties.voice();
  }

  public ResolvedVoice resolve(
      String voiceOption, VoiceStyle style, String targetLanguage, Path speakerSample, String sessionId) {

    if (voiceOption != null && !voiceOption.isBlank() && !CLONE_OPTION.equals(voiceOption)) {
      return new ResolvedVoice(voiceOption, style.settings(), false);
    }

    try {
      String voiceId = synthesizer.cloneVoice(speakerSample, "dub_" + sessionId);
      return new ResolvedVoice(voiceId, VoiceSettings.CLONED, true);
    } catch (DubbingException e) {
      if (!properties.fallbackOnCloneFailure()) {
        throw e;
      }
      String fallback = properties.fallbackVoiceFor(targetLanguage);
      LOGGER.warn(
          "Voice cloning failed, falling back to stock voice {} for language {}: {}",
          fallback,
          targetLanguage,
          e.getMessage());
      return new ResolvedVoice(fallback, VoiceStyle.NATURAL.settings(), false);
    }
  }
}
