package com.scholary.dubbing.timing;

import java.util.Locale;

/**
 * The rebuilt track runs noticeably longer than the original speech.
 *
 * <p>Informational only: the track is still used, the message ends up in the session diagnostics.
 */
public record DriftDiagnostic(
    double actualDurationSeconds, double expectedDurationSeconds, double tolerance) {

  public double ratio() {
    if (expectedDurationSeconds <= 0) {
      return Double.POSITIVE_INFINITY;
    }
    return actualDurationSeconds / expectedDurationSeconds;
  }

  public String message() {
    return String.format(
        Locale.ROOT,
        "Dubbed track is %.2fs but original speech ends at %.2fs (%.0f%% over, tolerance %.0f%%)",
        actualDurationSeconds,
        expectedDurationSeconds,
        (ratio() - 1) * 100,
        tolerance * 100);
  }
}
