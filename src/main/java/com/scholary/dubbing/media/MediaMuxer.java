package com.scholary.dubbing.media;

import java.nio.file.Path;

/**
 * Combines a video stream and a finished audio track into one container.
 *
 * <p>The visual stream is copied without re-encoding; the result is trimmed to the shorter input.
 */
public interface MediaMuxer {

  /**
   * Mux a video with a new audio track.
   *
   * @param video the original video
   * @param audio the finished dubbed track
   * @param output where to write the combined file
   * @return {@code output}
   * @throws com.scholary.dubbing.error.NotFoundException if an input is missing or unreadable
   * @throws com.scholary.dubbing.error.ProcessingException if the media tool fails
   * @throws com.scholary.dubbing.error.IntegrityException if the tool succeeded without output
   */
  Path mux(Path video, Path audio, Path output);
}
