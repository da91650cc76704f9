package com.scholary.dubbing.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.dubbing.error.ProcessingException;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

/** Runs real processes through {@code sh}, standing in for ffmpeg. */
@EnabledOnOs({OS.LINUX, OS.MAC})
class FfmpegRunnerTest {

  private final FfmpegRunner runner =
      new FfmpegRunner(new FfmpegProperties("ffmpeg", "ffprobe", 2, 22050, 44100, "aac"));

  @Test
  void run_shouldCaptureMergedOutput() {
    ProcessResult result =
        runner.run(List.of("sh", "-c", "echo out; echo err 1>&2"), "echo test");

    assertThat(result.succeeded()).isTrue();
    assertThat(result.output()).contains("out", "err");
  }

  @Test
  void runChecked_shouldFailOnNonZeroExitWithToolOutput() {
    assertThatThrownBy(
            () -> runner.runChecked(List.of("sh", "-c", "echo broken input; exit 3"), "Probe"))
        .isInstanceOf(ProcessingException.class)
        .hasMessageContaining("exit code 3")
        .hasMessageContaining("broken input");
  }

  @Test
  void run_shouldKillProcessOnTimeout() {
    assertThatThrownBy(() -> runner.run(List.of("sh", "-c", "sleep 10"), "Slow task"))
        .isInstanceOf(ProcessingException.class)
        .hasMessageContaining("timed out after 2 seconds");
  }

  @Test
  void run_shouldFailWhenBinaryMissing() {
    assertThatThrownBy(() -> runner.run(List.of("/nonexistent/ffmpeg-binary"), "Missing"))
        .isInstanceOf(ProcessingException.class)
        .hasMessageContaining("could not be run");
  }

  @Test
  void tail_shouldKeepEndOfLongOutput() {
    String output = "x".repeat(FfmpegRunner.MAX_DIAGNOSTIC_CHARS) + "the actual error";

    assertThat(FfmpegRunner.tail(output)).endsWith("the actual error").startsWith("...");
  }
}
