package com.scholary.dubbing.utterance;

import com.scholary.dubbing.transcription.TranscriptSegment;
import com.scholary.dubbing.transcription.TranscriptionResult;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the utterances a run will dub.
 *
 * <p>Fallback order, first non-empty source wins:
 *
 * <ol>
 *   <li>utterance-level segments from the transcription provider
 *   <li>paragraph-level segments, mapped one-to-one
 *   <li>sentences split from the full transcript ({@link SentenceSplitter})
 *   <li>single-segment mode
 * </ol>
 *
 * <p>Segments with blank text or unusable timing are dropped before a source is judged empty.
 */
@Component
public class UtteranceSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(UtteranceSegmenter.class);

  public Segmentation segment(TranscriptionResult transcription) {
    List<Utterance> utterances = toUtterances(transcription.utterances());
    if (!utterances.isEmpty()) {
      return new Segmentation(SegmentationMode.UTTERANCES, utterances);
    }

    List<Utterance> paragraphs = toUtterances(transcription.paragraphs());
    if (!paragraphs.isEmpty()) {
      LOGGER.info("No utterance segments, using {} paragraphs", paragraphs.size());
      return new Segmentation(SegmentationMode.PARAGRAPHS, paragraphs);
    }

    Optional<List<Utterance>> sentences =
        SentenceSplitter.split(transcription.text(), transcription.words().size());
    if (sentences.isPresent()) {
      LOGGER.info(
          "No utterance or paragraph segments, synthesized {} sentence utterances",
          sentences.get().size());
      return new Segmentation(SegmentationMode.SENTENCES, sentences.get());
    }

    LOGGER.warn("No utterances could be produced, degrading to single-segment mode");
    return Segmentation.singleSegment();
  }

  private List<Utterance> toUtterances(List<TranscriptSegment> segments) {
    return segments.stream()
        .filter(s -> s.text() != null && !s.text().isBlank())
        .filter(s -> s.start() >= 0 && s.end() > s.start())
        .map(s -> new Utterance(s.start(), s.end(), s.text().strip()))
        .toList();
  }
}
