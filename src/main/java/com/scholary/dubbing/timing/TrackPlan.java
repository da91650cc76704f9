package com.scholary.dubbing.timing;

import java.util.List;

/**
 * Ordered silence and clip entries that make up a rebuilt audio track.
 *
 * @param entries entries in playback order
 * @param expectedDurationSeconds end time of the last utterance in start order
 */
public record TrackPlan(List<PlanEntry> entries, double expectedDurationSeconds) {

  public TrackPlan {
    entries = List.copyOf(entries);
  }

  /** Sum of all entry durations. */
  public double totalDurationSeconds() {
    return entries.stream().mapToDouble(PlanEntry::durationSeconds).sum();
  }

  public long clipCount() {
    return entries.stream().filter(entry -> entry.kind() == EntryKind.CLIP).count();
  }

  public long silenceCount() {
    return entries.stream().filter(PlanEntry::isSilence).count();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
