package com.scholary.dubbing.media;

import com.scholary.dubbing.error.IntegrityException;
import com.scholary.dubbing.error.NotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pulls the speech track out of a video.
 *
 * <p>The result is uncompressed mono PCM at the configured sample rate. The same file is sent to
 * the transcriber and used as the voice-cloning sample.
 */
@Component
public class AudioExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioExtractor.class);

  private final FfmpegRunner runner;
  private final FfmpegProperties properties;

  public AudioExtractor(FfmpegRunner runner, FfmpegProperties properties) {
    this.runner = runner;
    this.properties = properties;
  }

  public Path extract(Path video, Path output) {
    if (!Files.isReadable(video)) {
      throw new NotFoundException("Video file not found: " + video);
    }

    LOGGER.info("Extracting audio: video={}, output={}", video.getFileName(), output.getFileName());

    runner.ffmpeg(
        List.of(
            "-y",
            "-i", video.toString(),
            "-vn",
            "-acodec", "pcm_s16le",
            "-ar", String.valueOf(properties.extractSampleRate()),
            "-ac", "1",
            output.toString()),
        "Audio extraction");

    if (!Files.exists(output)) {
      throw new IntegrityException("Audio extraction reported success but produced no file: " + output);
    }
    return output;
  }
}
