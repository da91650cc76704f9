package com.scholary.dubbing.timing;

import com.scholary.dubbing.error.IntegrityException;
import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.error.ProcessingException;
import com.scholary.dubbing.media.FfmpegProperties;
import com.scholary.dubbing.media.FfmpegRunner;
import com.scholary.dubbing.session.SessionWorkspace;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link TrackPlan} into one audio file.
 *
 * <p>Silence entries are rendered from ffmpeg's {@code anullsrc} source. A plan with a single
 * entry is copied as is. Anything longer is joined with the {@code concat} audio filter after every
 * input is resampled to a common rate and mono layout, since synthesized mp3 clips and rendered
 * silences don't share a format. The join is written as PCM WAV; the only lossy encode happens in
 * the muxer.
 */
@Component
public class TrackAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrackAssembler.class);

  private final FfmpegRunner runner;
  private final FfmpegProperties properties;

  public TrackAssembler(FfmpegRunner runner, FfmpegProperties properties) {
    this.runner = runner;
    this.properties = properties;
  }

  /**
   * Assemble a plan into the session's track file.
   *
   * @return path of the assembled track
   * @throws NotFoundException if a clip file is missing
   * @throws ProcessingException if ffmpeg fails
   * @throws IntegrityException if ffmpeg succeeded but wrote nothing
   */
  public Path assemble(TrackPlan plan, SessionWorkspace workspace) {
    if (plan.isEmpty()) {
      throw new ProcessingException("Track plan has no entries");
    }

    List<Path> inputs = new ArrayList<>(plan.entries().size());
    int gapIndex = 0;
    for (PlanEntry entry : plan.entries()) {
      if (entry.isSilence()) {
        inputs.add(renderSilence(entry.durationSeconds(), workspace.gap(gapIndex++)));
      } else {
        if (!Files.isReadable(entry.source())) {
          throw new NotFoundException("Clip file not found: " + entry.source());
        }
        inputs.add(entry.source());
      }
    }

    Path output;
    if (inputs.size() == 1) {
      output = workspace.track(extensionOf(inputs.get(0)));
      copy(inputs.get(0), output);
    } else {
      output = workspace.track("wav");
      concat(inputs, output);
    }

    if (!Files.exists(output)) {
      throw new IntegrityException("Track assembly reported success but produced no file: " + output);
    }
    LOGGER.info("Assembled track from {} entries: {}", inputs.size(), output.getFileName());
    return output;
  }

  Path renderSilence(double seconds, Path output) {
    runner.ffmpeg(
        List.of(
            "-y",
            "-f", "lavfi",
            "-i", "anullsrc=channel_layout=mono:sample_rate=" + properties.trackSampleRate(),
            "-t", String.format(Locale.ROOT, "%.3f", seconds),
            "-c:a", "pcm_s16le",
            output.toString()),
        "Silence rendering");
    return output;
  }

  private void concat(List<Path> inputs, Path output) {
    List<String> args = new ArrayList<>();
    args.add("-y");
    for (Path input : inputs) {
      args.add("-i");
      args.add(input.toString());
    }
    args.add("-filter_complex");
    args.add(concatFilter(inputs.size(), properties.trackSampleRate()));
    args.add("-map");
    args.add("[out]");
    args.add("-c:a");
    args.add("pcm_s16le");
    args.add(output.toString());

    runner.ffmpeg(args, "Track concatenation");
  }

  /**
   * Build the filter graph, e.g. for two inputs at 44.1 kHz:
   *
   * <pre>
   * [0:a]aresample=44100,aformat=channel_layouts=mono[a0];
   * [1:a]aresample=44100,aformat=channel_layouts=mono[a1];
   * [a0][a1]concat=n=2:v=0:a=1[out]
   * </pre>
   */
  static String concatFilter(int inputCount, int sampleRate) {
    StringBuilder filter = new StringBuilder();
    for (int i = 0; i < inputCount; i++) {
      filter
          .append('[').append(i).append(":a]aresample=")
          .append(sampleRate)
          .append(",aformat=channel_layouts=mono[a").append(i).append("];");
    }
    for (int i = 0; i < inputCount; i++) {
      filter.append("[a").append(i).append(']');
    }
    filter.append("concat=n=").append(inputCount).append(":v=0:a=1[out]");
    return filter.toString();
  }

  private static void copy(Path source, Path target) {
    try {
      Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new ProcessingException("Failed to copy " + source.getFileName() + " to track", e);
    }
  }

  static String extensionOf(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot < 0 || dot == name.length() - 1 ? "wav" : name.substring(dot + 1);
  }
}
