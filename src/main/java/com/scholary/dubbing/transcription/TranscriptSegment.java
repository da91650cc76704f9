package com.scholary.dubbing.transcription;

/**
 * A timed span of transcript text as reported by the transcription provider.
 *
 * <p>Used for both utterance-level and paragraph-level segments. Unlike {@code Utterance} this is
 * unvalidated provider data.
 */
public record TranscriptSegment(double start, double end, String text) {}
