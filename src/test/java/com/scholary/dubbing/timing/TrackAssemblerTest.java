package com.scholary.dubbing.timing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.dubbing.config.TestProperties;
import com.scholary.dubbing.error.IntegrityException;
import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.media.FfmpegRunner;
import com.scholary.dubbing.media.ProcessResult;
import com.scholary.dubbing.session.SessionWorkspace;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TrackAssemblerTest {

  @Mock private FfmpegRunner runner;

  @TempDir Path tempDir;

  private TrackAssembler assembler;
  private SessionWorkspace workspace;

  @BeforeEach
  void setUp() {
    assembler = new TrackAssembler(runner, TestProperties.ffmpeg());
    workspace = SessionWorkspace.create(tempDir, "session-1");
  }

  @Test
  void assemble_shouldCopySingleClip() throws Exception {
    Path clip = writeClip(0);

    Path track = assembler.assemble(new TrackPlan(List.of(PlanEntry.clip(1.5, clip)), 1.5), workspace);

    assertThat(track).isEqualTo(workspace.track("mp3"));
    assertThat(Files.readAllBytes(track)).isEqualTo(Files.readAllBytes(clip));
    verify(runner, never()).ffmpeg(anyList(), anyString());
  }

  @Test
  void assemble_shouldRenderSilenceAndConcatenate() throws Exception {
    Path first = writeClip(0);
    Path second = writeClip(1);
    when(runner.ffmpeg(anyList(), anyString()))
        .thenAnswer(
            invocation -> {
              List<String> args = invocation.getArgument(0);
              Files.writeString(Path.of(args.get(args.size() - 1)), "audio");
              return new ProcessResult(0, "");
            });

    TrackPlan plan =
        new TrackPlan(
            List.of(
                PlanEntry.clip(1.8, first), PlanEntry.silence(3.0), PlanEntry.clip(1.9, second)),
            7.0);

    Path track = assembler.assemble(plan, workspace);

    assertThat(track).isEqualTo(workspace.track("wav"));
    assertThat(workspace.gap(0)).exists();

    ArgumentCaptor<List<String>> args = ArgumentCaptor.forClass(List.class);
    verify(runner).ffmpeg(args.capture(), eq("Silence rendering"));
    assertThat(args.getValue()).contains("anullsrc=channel_layout=mono:sample_rate=44100", "3.000");

    verify(runner).ffmpeg(args.capture(), eq("Track concatenation"));
    assertThat(args.getValue())
        .containsSubsequence(
            "-i", first.toString(), "-i", workspace.gap(0).toString(), "-i", second.toString())
        .contains("[out]", "pcm_s16le");
  }

  @Test
  void assemble_shouldFailWhenClipFileMissing() {
    TrackPlan plan =
        new TrackPlan(List.of(PlanEntry.clip(1.0, tempDir.resolve("missing.mp3"))), 1.0);

    assertThatThrownBy(() -> assembler.assemble(plan, workspace))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void assemble_shouldFailWhenFfmpegWritesNothing() throws Exception {
    Path first = writeClip(0);
    Path second = writeClip(1);
    when(runner.ffmpeg(anyList(), anyString())).thenReturn(new ProcessResult(0, ""));

    TrackPlan plan =
        new TrackPlan(List.of(PlanEntry.clip(1.0, first), PlanEntry.clip(1.0, second)), 2.0);

    assertThatThrownBy(() -> assembler.assemble(plan, workspace))
        .isInstanceOf(IntegrityException.class);
  }

  @Test
  void concatFilter_shouldNormalizeEveryInput() {
    assertThat(TrackAssembler.concatFilter(2, 44100))
        .isEqualTo(
            "[0:a]aresample=44100,aformat=channel_layouts=mono[a0];"
                + "[1:a]aresample=44100,aformat=channel_layouts=mono[a1];"
                + "[a0][a1]concat=n=2:v=0:a=1[out]");
  }

  private Path writeClip(int index) throws Exception {
    return Files.write(workspace.utteranceClip(index), new byte[] {1, 2, 3, (byte) index});
  }
}
