package com.scholary.dubbing.utterance;

/** Where the utterances of a run came from, in fallback order. */
public enum SegmentationMode {
  /** Utterance-level segments reported by the transcription provider. */
  UTTERANCES,
  /** Paragraph-level segments mapped one-to-one onto utterances. */
  PARAGRAPHS,
  /** Sentences split from the full transcript with synthetic, evenly spaced timing. */
  SENTENCES,
  /** No usable segmentation: the whole transcript is dubbed as one clip without re-timing. */
  SINGLE_SEGMENT
}
