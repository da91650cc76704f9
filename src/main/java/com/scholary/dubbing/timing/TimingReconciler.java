package com.scholary.dubbing.timing;

import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.error.DubbingException;
import com.scholary.dubbing.logging.StructuredLogger;
import com.scholary.dubbing.media.MediaProbe;
import com.scholary.dubbing.session.SessionWorkspace;
import com.scholary.dubbing.synthesis.SynthesizedClip;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rebuilds a single audio track whose utterances start where the original speech did.
 *
 * <p>Plans the layout, assembles it, then compares the probed length against the end of the last
 * original utterance. Overrunning by more than the drift tolerance yields a {@link
 * DriftDiagnostic}; it is never an error, and a failed probe only skips the check.
 */
@Component
public class TimingReconciler {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimingReconciler.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final TrackPlanner planner;
  private final TrackAssembler assembler;
  private final MediaProbe probe;
  private final double driftTolerance;

  public TimingReconciler(
      TrackPlanner planner,
      TrackAssembler assembler,
      MediaProbe probe,
      DubbingProperties properties) {
    this.planner = planner;
    this.assembler = assembler;
    this.probe = probe;
    this.driftTolerance = properties.timing().driftTolerance();
  }

  public ReconciledTrack reconcile(List<TimedClip> clips, SessionWorkspace workspace) {
    TrackPlan plan = planner.plan(clips);
    STRUCTURED_LOGGER.logTrackPlanned(
        (int) plan.clipCount(),
        (int) plan.silenceCount(),
        plan.totalDurationSeconds(),
        plan.expectedDurationSeconds());

    Path track = assembler.assemble(plan, workspace);

    Double actual = probeQuietly(track);
    DriftDiagnostic drift = null;
    if (actual != null && actual > plan.expectedDurationSeconds() * (1 + driftTolerance)) {
      drift = new DriftDiagnostic(actual, plan.expectedDurationSeconds(), driftTolerance);
      STRUCTURED_LOGGER.logDurationDrift(actual, plan.expectedDurationSeconds(), drift.ratio());
    }
    return new ReconciledTrack(track, plan, actual, drift);
  }

  /** Use one clip as the whole track, for runs without utterance timing. */
  public ReconciledTrack passThrough(SynthesizedClip clip, SessionWorkspace workspace) {
    TrackPlan plan =
        new TrackPlan(
            List.of(PlanEntry.clip(clip.durationSeconds(), clip.audioFile())),
            clip.durationSeconds());
    Path track = assembler.assemble(plan, workspace);
    LOGGER.info("Single-segment track, no timing reconciliation: {}", track.getFileName());
    return new ReconciledTrack(track, plan, clip.durationSeconds(), null);
  }

  private Double probeQuietly(Path track) {
    try {
      return probe.durationSeconds(track);
    } catch (DubbingException e) {
      LOGGER.warn("Could not probe track duration, skipping drift check: {}", e.getMessage());
      return null;
    }
  }
}
