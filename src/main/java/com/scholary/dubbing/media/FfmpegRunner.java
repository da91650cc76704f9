package com.scholary.dubbing.media;

import com.scholary.dubbing.error.ProcessingException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs ffmpeg and ffprobe as external processes.
 *
 * <p>Every process gets the configured timeout and is killed when it runs over. Output (stdout and
 * stderr merged) goes to a temp file instead of a pipe, so a chatty ffmpeg can never block on a
 * full pipe buffer while we wait for it.
 */
@Component
public class FfmpegRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegRunner.class);

  /** Tool output kept in error messages; ffmpeg puts the actual error at the end. */
  static final int MAX_DIAGNOSTIC_CHARS = 4000;

  private final FfmpegProperties properties;

  public FfmpegRunner(FfmpegProperties properties) {
    this.properties = properties;
  }

  /**
   * Run ffmpeg with the given arguments, failing on a non-zero exit.
   *
   * @param args arguments after the binary name
   * @param description what the call does, for logs and errors
   * @return the finished process
   * @throws ProcessingException on non-zero exit, timeout or launch failure
   */
  public ProcessResult ffmpeg(List<String> args, String description) {
    return runChecked(prepend(properties.ffmpegPath(), args), description);
  }

  /** Run ffprobe with the given arguments, failing on a non-zero exit. */
  public ProcessResult ffprobe(List<String> args, String description) {
    return runChecked(prepend(properties.ffprobePath(), args), description);
  }

  ProcessResult runChecked(List<String> command, String description) {
    ProcessResult result = run(command, description);
    if (!result.succeeded()) {
      LOGGER.error("{} failed with exit code {}: {}", description, result.exitCode(), result.output());
      throw new ProcessingException(
          String.format("%s failed with exit code %d", description, result.exitCode()),
          tail(result.output()));
    }
    return result;
  }

  /**
   * Run a command to completion or until the timeout expires.
   *
   * @return exit code and output, whatever the exit code
   * @throws ProcessingException on timeout or launch failure
   */
  ProcessResult run(List<String> command, String description) {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Path log = null;
    Process process = null;
    try {
      log = Files.createTempFile("ffmpeg-", ".log");
      process =
          new ProcessBuilder(command)
              .redirectErrorStream(true)
              .redirectOutput(log.toFile())
              .start();

      boolean finished = process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS);
      if (!finished) {
        process.destroyForcibly();
        throw new ProcessingException(
            String.format("%s timed out after %d seconds", description, properties.timeoutSeconds()));
      }

      String output = Files.readString(log, StandardCharsets.UTF_8).strip();
      return new ProcessResult(process.exitValue(), output);

    } catch (IOException e) {
      throw new ProcessingException(description + " could not be run: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (process != null) {
        process.destroyForcibly();
      }
      throw new ProcessingException(description + " interrupted", e);
    } finally {
      deleteQuietly(log);
    }
  }

  private static List<String> prepend(String binary, List<String> args) {
    List<String> command = new ArrayList<>(args.size() + 1);
    command.add(binary);
    command.addAll(args);
    return command;
  }

  static String tail(String output) {
    if (output == null || output.length() <= MAX_DIAGNOSTIC_CHARS) {
      return output;
    }
    return "..." + output.substring(output.length() - MAX_DIAGNOSTIC_CHARS);
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete process log {}: {}", file, e.getMessage());
    }
  }
}
