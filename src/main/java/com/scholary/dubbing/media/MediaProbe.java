package com.scholary.dubbing.media;

import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.error.ProcessingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/** Reads media durations with ffprobe. */
@Component
public class MediaProbe {

  private final FfmpegRunner runner;

  public MediaProbe(FfmpegRunner runner) {
    this.runner = runner;
  }

  /**
   * Get the decoded duration of a media file.
   *
   * @param file the file to probe
   * @return duration in seconds
   * @throws NotFoundException if the file does not exist
   * @throws ProcessingException if ffprobe fails or prints something that isn't a duration
   */
  public double durationSeconds(Path file) {
    if (!Files.exists(file)) {
      throw new NotFoundException("Media file not found: " + file);
    }

    ProcessResult result =
        runner.ffprobe(
            List.of(
                "-v", "error",
                "-show_entries", "format=duration",
                "-of", "default=noprint_wrappers=1:nokey=1",
                file.toString()),
            "ffprobe duration of " + file.getFileName());

    try {
      return Double.parseDouble(result.output().strip());
    } catch (NumberFormatException e) {
      throw new ProcessingException("Failed to parse duration from ffprobe output", result.output());
    }
  }
}
