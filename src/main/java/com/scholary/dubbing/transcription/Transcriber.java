package com.scholary.dubbing.transcription;

import java.nio.file.Path;

/**
 * Speech-to-text capability.
 *
 * <p>This abstraction allows us to swap transcription providers without changing the pipeline.
 */
public interface Transcriber {

  /**
   * Transcribe an audio file.
   *
   * @param audioFile the audio to transcribe
   * @return transcript text plus whatever word, utterance and paragraph timing the provider has
   * @throws com.scholary.dubbing.error.UpstreamException if the provider call fails
   */
  TranscriptionResult transcribe(Path audioFile);
}
