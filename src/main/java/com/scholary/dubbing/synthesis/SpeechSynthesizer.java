package com.scholary.dubbing.synthesis;

import java.nio.file.Path;
import java.util.List;

/**
 * Text-to-speech and voice-cloning capability.
 *
 * <p>Implementations talk to one provider. Every method may throw {@link
 * com.scholary.dubbing.error.UpstreamException}.
 */
public interface SpeechSynthesizer {

  /**
   * Synthesize speech for a piece of text.
   *
   * @param text the text to speak
   * @param voiceId provider voice id
   * @param settings expressiveness settings
   * @return encoded audio (mp3)
   */
  byte[] synthesize(String text, String voiceId, VoiceSettings settings);

  /**
   * Create a voice from a sample of the original speaker.
   *
   * @param sample audio sample of the speaker
   * @param name display name for the new voice
   * @return the new voice id
   */
  String cloneVoice(Path sample, String name);

  /** List the prebuilt voices the provider offers. */
  List<VoiceOption> listVoices();
}
