package com.scholary.dubbing.synthesis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Expressiveness versus fidelity knobs sent with every synthesis request.
 *
 * <p>Serialized with the provider's snake_case field names.
 */
public record VoiceSettings(
    @JsonProperty("stability") double stability,
    @JsonProperty("similarity_boost") double similarityBoost,
    @JsonProperty("style") double style,
    @JsonProperty("use_speaker_boost") boolean useSpeakerBoost) {

  /** Settings for a voice cloned from the original speaker: expressive, close to the sample. */
  public static final VoiceSettings CLONED = new VoiceSettings(0.3, 0.95, 0.0, true);

  public VoiceSettings {
    requireUnit("stability", stability);
    requireUnit("similarityBoost", similarityBoost);
    requireUnit("style", style);
  }

  private static void requireUnit(String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(name + " must be between 0 and 1");
    }
  }
}
