package com.scholary.dubbing.utterance;

import java.util.List;

/**
 * Outcome of the utterance fallback policy.
 *
 * <p>{@link SegmentationMode#SINGLE_SEGMENT} always carries an empty utterance list; every other
 * mode carries at least one utterance.
 */
public record Segmentation(SegmentationMode mode, List<Utterance> utterances) {

  public Segmentation {
    utterances = List.copyOf(utterances);
    if (mode == SegmentationMode.SINGLE_SEGMENT && !utterances.isEmpty()) {
      throw new IllegalArgumentException("Single-segment mode carries no utterances");
    }
    if (mode != SegmentationMode.SINGLE_SEGMENT && utterances.isEmpty()) {
      throw new IllegalArgumentException("Mode " + mode + " requires at least one utterance");
    }
  }

  public static Segmentation singleSegment() {
    return new Segmentation(SegmentationMode.SINGLE_SEGMENT, List.of());
  }

  public boolean isSingleSegment() {
    return mode == SegmentationMode.SINGLE_SEGMENT;
  }
}
