package com.scholary.dubbing.transcription;

import java.util.List;

/**
 * Everything the transcription provider returned for one audio file.
 *
 * <p>Any of the segment lists may be empty; the utterance segmenter decides which one to use.
 */
public record TranscriptionResult(
    String text,
    List<TranscriptWord> words,
    List<TranscriptSegment> utterances,
    List<TranscriptSegment> paragraphs) {

  public TranscriptionResult {
    text = text == null ? "" : text;
    words = words == null ? List.of() : List.copyOf(words);
    utterances = utterances == null ? List.of() : List.copyOf(utterances);
    paragraphs = paragraphs == null ? List.of() : List.copyOf(paragraphs);
  }

  /** True when the provider heard nothing at all. */
  public boolean isEmpty() {
    return text.isBlank() && utterances.isEmpty() && paragraphs.isEmpty();
  }
}
