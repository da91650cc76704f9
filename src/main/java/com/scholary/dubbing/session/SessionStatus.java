package com.scholary.dubbing.session;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle of a dubbing session.
 *
 * <p>{@code created → transcribing → translating → generating_voice → combining_video →
 * completed}, with {@code failed} reachable from any non-terminal state. Each working status
 * carries the progress checkpoint assigned when its stage starts; polling clients rely on these
 * exact values.
 */
public enum SessionStatus {
  CREATED(0, "Setup"),
  TRANSCRIBING(10, "Transcription"),
  TRANSLATING(30, "Translation"),
  GENERATING_VOICE(50, "Voice generation"),
  COMBINING_VIDEO(80, "Video combination"),
  COMPLETED(100, "Completion"),
  FAILED(-1, "Failure");

  private final int checkpoint;
  private final String stageLabel;

  SessionStatus(int checkpoint, String stageLabel) {
    this.checkpoint = checkpoint;
    this.stageLabel = stageLabel;
  }

  /** Progress assigned on entering this status; {@code -1} for failed, which freezes progress. */
  public int checkpoint() {
    return checkpoint;
  }

  /** Human-readable stage name used in failure messages. */
  public String stageLabel() {
    return stageLabel;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
