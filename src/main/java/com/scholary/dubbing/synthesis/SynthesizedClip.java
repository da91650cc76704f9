package com.scholary.dubbing.synthesis;

import java.nio.file.Path;

/**
 * Synthesized speech for one utterance.
 *
 * <p>The audio lives in the owning session's working directory; the clip is never shared across
 * sessions. {@code durationSeconds} is the clip's natural decoded length, not the original slot.
 */
public record SynthesizedClip(int utteranceIndex, Path audioFile, double durationSeconds) {

  public SynthesizedClip {
    if (durationSeconds < 0) {
      throw new IllegalArgumentException("Clip duration cannot be negative");
    }
  }
}
