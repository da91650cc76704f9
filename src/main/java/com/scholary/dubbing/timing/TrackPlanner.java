package com.scholary.dubbing.timing;

import com.scholary.dubbing.config.DubbingProperties;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Lays synthesized clips out on the original timeline.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Sort clips by original start (then end, then utterance index)
 *   <li>Keep a cursor at the end of the previous utterance, starting at 0
 *   <li>If the next utterance starts more than the gap threshold after the cursor, insert silence
 *       for the gap, never shorter than the minimum silence
 *   <li>Append the clip at its natural length
 *   <li>Move the cursor to the utterance's original end, not the clip's end
 * </ol>
 *
 * <p>Clips are never stretched or cut. A clip that runs past its slot pushes everything after it
 * back, and the delay is not recovered; the drift check reports it.
 */
@Component
public class TrackPlanner {

  private final double gapThresholdSeconds;
  private final double minSilenceSeconds;

  @Autowired
  public TrackPlanner(DubbingProperties properties) {
    this(
        properties.timing().gapThresholdSeconds(), properties.timing().minSilenceSeconds());
  }

  public TrackPlanner(double gapThresholdSeconds, double minSilenceSeconds) {
    this.gapThresholdSeconds = gapThresholdSeconds;
    this.minSilenceSeconds = minSilenceSeconds;
  }

  public TrackPlan plan(List<TimedClip> clips) {
    List<TimedClip> sorted = new ArrayList<>(clips);
    sorted.sort(TimedClip.PLAYBACK_ORDER);

    List<PlanEntry> entries = new ArrayList<>(sorted.size() * 2);
    double cursor = 0.0;
    for (TimedClip timed : sorted) {
      double gap = timed.utterance().start() - cursor;
      if (gap > gapThresholdSeconds) {
        entries.add(PlanEntry.silence(Math.max(minSilenceSeconds, gap)));
      }
      entries.add(PlanEntry.clip(timed.clip().durationSeconds(), timed.clip().audioFile()));
      cursor = timed.utterance().end();
    }

    double expected = sorted.isEmpty() ? 0.0 : sorted.get(sorted.size() - 1).utterance().end();
    return new TrackPlan(entries, expected);
  }
}
