package com.scholary.dubbing.media;

import com.scholary.dubbing.error.IntegrityException;
import com.scholary.dubbing.error.NotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * ffmpeg implementation of {@link MediaMuxer}.
 *
 * <p>Takes the first video stream of the original and the first audio stream of the dubbed track:
 *
 * <pre>
 * ffmpeg -y -i video -i audio -map 0:v:0 -map 1:a:0 -c:v copy -c:a aac -shortest output
 * </pre>
 */
@Component
public class FfmpegMediaMuxer implements MediaMuxer {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMediaMuxer.class);

  private final FfmpegRunner runner;
  private final FfmpegProperties properties;

  public FfmpegMediaMuxer(FfmpegRunner runner, FfmpegProperties properties) {
    this.runner = runner;
    this.properties = properties;
  }

  @Override
  public Path mux(Path video, Path audio, Path output) {
    requireReadable(video, "Video");
    requireReadable(audio, "Audio");

    LOGGER.info(
        "Muxing video={} with audio={} into {}",
        video.getFileName(),
        audio.getFileName(),
        output.getFileName());

    runner.ffmpeg(
        List.of(
            "-y",
            "-i", video.toString(),
            "-i", audio.toString(),
            "-map", "0:v:0",
            "-map", "1:a:0",
            "-c:v", "copy",
            "-c:a", properties.muxAudioCodec(),
            "-shortest",
            output.toString()),
        "Video muxing");

    if (!isNonEmptyFile(output)) {
      throw new IntegrityException("Muxing reported success but output file is missing: " + output);
    }

    LOGGER.info("Muxing successful: {}", output);
    return output;
  }

  private static void requireReadable(Path file, String label) {
    if (file == null || !Files.isRegularFile(file) || !Files.isReadable(file)) {
      throw new NotFoundException(label + " file not found: " + file);
    }
  }

  private static boolean isNonEmptyFile(Path file) {
    try {
      return Files.isRegularFile(file) && Files.size(file) > 0;
    } catch (IOException e) {
      LOGGER.warn("Could not inspect mux output {}: {}", file, e.getMessage());
      return false;
    }
  }
}
