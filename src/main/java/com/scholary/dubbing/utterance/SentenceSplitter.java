package com.scholary.dubbing.utterance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Splits a raw transcript into sentences and gives each one an equal slice of an estimated
 * duration.
 *
 * <p>Used only when the transcription provider returned neither utterances nor paragraphs. The
 * timing is synthetic: 0.5 seconds per transcribed word, or 30 seconds when the word count is
 * unknown, divided evenly across the sentences.
 */
public final class SentenceSplitter {

  static final double SECONDS_PER_WORD = 0.5;
  static final double UNKNOWN_DURATION_SECONDS = 30.0;

  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?]+");

  private SentenceSplitter() {}

  /**
   * Split text into evenly timed sentence utterances.
   *
   * @param text the full transcript
   * @param wordCount number of words the provider transcribed, 0 if unknown
   * @return the utterances, or empty when the text fragments into zero usable sentences after
   *     filtering (no utterances possible)
   */
  public static Optional<List<Utterance>> split(String text, int wordCount) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }

    List<String> sentences =
        Arrays.stream(SENTENCE_BOUNDARY.split(text))
            .map(String::strip)
            .filter(s -> !s.isEmpty())
            .toList();
    if (sentences.isEmpty()) {
      return Optional.empty();
    }

    double estimatedDuration =
        wordCount > 0 ? wordCount * SECONDS_PER_WORD : UNKNOWN_DURATION_SECONDS;
    double slice = estimatedDuration / sentences.size();

    List<Utterance> utterances = new ArrayList<>(sentences.size());
    for (int i = 0; i < sentences.size(); i++) {
      utterances.add(new Utterance(i * slice, (i + 1) * slice, sentences.get(i)));
    }
    return Optional.of(utterances);
  }
}
