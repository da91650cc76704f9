package com.scholary.dubbing.timing;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One entry of a {@link TrackPlan}.
 *
 * <p>Clip entries point at the synthesized audio file. Silence entries have no source until the
 * assembler renders them.
 */
public record PlanEntry(EntryKind kind, double durationSeconds, Path source) {

  public PlanEntry {
    Objects.requireNonNull(kind, "kind");
    if (durationSeconds < 0) {
      throw new IllegalArgumentException("Entry duration cannot be negative: " + durationSeconds);
    }
    if (kind == EntryKind.CLIP && source == null) {
      throw new IllegalArgumentException("Clip entry needs a source file");
    }
  }

  public static PlanEntry silence(double durationSeconds) {
    return new PlanEntry(EntryKind.SILENCE, durationSeconds, null);
  }

  public static PlanEntry clip(double durationSeconds, Path source) {
    return new PlanEntry(EntryKind.CLIP, durationSeconds, source);
  }

  public boolean isSilence() {
    return kind == EntryKind.SILENCE;
  }
}
