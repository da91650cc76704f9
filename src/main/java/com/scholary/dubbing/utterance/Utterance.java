package com.scholary.dubbing.utterance;

import java.util.Comparator;

/**
 * One timestamped span of speech in the original recording.
 *
 * <p>Times are seconds from the start of the source audio. Utterances are ordered by {@code start};
 * overlapping utterances are tolerated.
 */
public record Utterance(double start, double end, String text) {

  /** Start order, with {@code end} breaking ties. */
  public static final Comparator<Utterance> BY_START =
      Comparator.comparingDouble(Utterance::start).thenComparingDouble(Utterance::end);

  public Utterance {
    if (start < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (end <= start) {
      throw new IllegalArgumentException("End time must be after start time");
    }
    if (text == null) {
      throw new IllegalArgumentException("Text cannot be null");
    }
  }

  public double duration() {
    return end - start;
  }
}
