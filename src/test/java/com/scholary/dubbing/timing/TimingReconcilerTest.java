package com.scholary.dubbing.timing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.scholary.dubbing.config.TestProperties;
import com.scholary.dubbing.error.ProcessingException;
import com.scholary.dubbing.media.MediaProbe;
import com.scholary.dubbing.session.SessionWorkspace;
import com.scholary.dubbing.synthesis.SynthesizedClip;
import com.scholary.dubbing.utterance.Utterance;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TimingReconcilerTest {

  @Mock private TrackAssembler assembler;
  @Mock private MediaProbe probe;

  @TempDir Path tempDir;

  private TimingReconciler reconciler;
  private SessionWorkspace workspace;
  private Path track;

  @BeforeEach
  void setUp() {
    reconciler =
        new TimingReconciler(
            new TrackPlanner(0.1, 0.1), assembler, probe, TestProperties.dubbing(tempDir));
    workspace = SessionWorkspace.create(tempDir, "session-1");
    track = workspace.track("wav");
  }

  @Test
  void reconcile_shouldReportDriftBeyondTolerance() {
    when(assembler.assemble(any(), any())).thenReturn(track);
    when(probe.durationSeconds(track)).thenReturn(11.0);

    ReconciledTrack result = reconciler.reconcile(clipsEndingAt(7.0), workspace);

    assertThat(result.file()).isEqualTo(track);
    assertThat(result.driftDiagnostic()).isPresent();
    assertThat(result.driftDiagnostic().get().expectedDurationSeconds()).isEqualTo(7.0);
    assertThat(result.driftDiagnostic().get().message()).contains("11.00s", "7.00s");
  }

  @Test
  void reconcile_shouldNotReportDriftWithinTolerance() {
    when(assembler.assemble(any(), any())).thenReturn(track);
    when(probe.durationSeconds(track)).thenReturn(10.5);

    ReconciledTrack result = reconciler.reconcile(clipsEndingAt(7.0), workspace);

    assertThat(result.driftDiagnostic()).isEmpty();
    assertThat(result.actualDuration()).contains(10.5);
  }

  @Test
  void reconcile_shouldSkipDriftCheckWhenProbeFails() {
    when(assembler.assemble(any(), any())).thenReturn(track);
    when(probe.durationSeconds(track)).thenThrow(new ProcessingException("ffprobe failed"));

    ReconciledTrack result = reconciler.reconcile(clipsEndingAt(7.0), workspace);

    assertThat(result.file()).isEqualTo(track);
    assertThat(result.actualDuration()).isEmpty();
    assertThat(result.driftDiagnostic()).isEmpty();
  }

  @Test
  void passThrough_shouldUseClipAsWholeTrack() {
    SynthesizedClip clip = new SynthesizedClip(0, workspace.utteranceClip(0), 42.0);
    when(assembler.assemble(any(), any())).thenReturn(workspace.track("mp3"));

    ReconciledTrack result = reconciler.passThrough(clip, workspace);

    assertThat(result.file()).isEqualTo(workspace.track("mp3"));
    assertThat(result.plan().entries()).containsExactly(PlanEntry.clip(42.0, clip.audioFile()));
    assertThat(result.driftDiagnostic()).isEmpty();
  }

  private List<TimedClip> clipsEndingAt(double end) {
    return List.of(
        new TimedClip(
            new Utterance(0.0, 2.0, "first"),
            new SynthesizedClip(0, workspace.utteranceClip(0), 1.8)),
        new TimedClip(
            new Utterance(5.0, end, "second"),
            new SynthesizedClip(1, workspace.utteranceClip(1), 1.9)));
  }
}
