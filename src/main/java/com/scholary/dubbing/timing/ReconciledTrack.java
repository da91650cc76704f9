package com.scholary.dubbing.timing;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Output of the timing reconciler.
 *
 * @param file the rebuilt audio track
 * @param plan the plan it was assembled from
 * @param actualDurationSeconds probed duration, null when the probe failed or was skipped
 * @param drift set when the track overran the original timing beyond tolerance
 */
public record ReconciledTrack(
    Path file, TrackPlan plan, Double actualDurationSeconds, DriftDiagnostic drift) {

  public Optional<Double> actualDuration() {
    return Optional.ofNullable(actualDurationSeconds);
  }

  public Optional<DriftDiagnostic> driftDiagnostic() {
    return Optional.ofNullable(drift);
  }
}
