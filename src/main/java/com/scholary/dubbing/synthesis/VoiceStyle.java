package com.scholary.dubbing.synthesis;

import java.util.Locale;

/** Named presets for {@link VoiceSettings}. */
public enum VoiceStyle {
  NATURAL(new VoiceSettings(0.5, 0.8, 0.0, true)),
  DRAMATIC(new VoiceSettings(0.3, 0.9, 0.2, true)),
  CALM(new VoiceSettings(0.8, 0.6, 0.0, false)),
  ENERGETIC(new VoiceSettings(0.2, 0.9, 0.3, true));

  private final VoiceSettings settings;

  VoiceStyle(VoiceSettings settings) {
    this.settings = settings;
  }

  public VoiceSettings settings() {
    return settings;
  }

  /** Look up a style by name, case-insensitively; unknown or missing names fall back to natural. */
  public static VoiceStyle fromName(String name) {
    if (name == null || name.isBlank()) {
      return NATURAL;
    }
    try {
      return valueOf(name.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return NATURAL;
    }
  }
}
