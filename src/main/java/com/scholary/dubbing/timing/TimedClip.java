package com.scholary.dubbing.timing;

import com.scholary.dubbing.synthesis.SynthesizedClip;
import com.scholary.dubbing.utterance.Utterance;
import java.util.Comparator;
import java.util.Objects;

/** A synthesized clip paired with the original utterance whose slot it fills. */
public record TimedClip(Utterance utterance, SynthesizedClip clip) {

  /** Original start, then original end, then utterance index. */
  public static final Comparator<TimedClip> PLAYBACK_ORDER =
      Comparator.comparingDouble((TimedClip timed) -> timed.utterance().start())
          .thenComparingDouble(timed -> timed.utterance().end())
          .thenComparingInt(timed -> timed.clip().utteranceIndex());

  public TimedClip {
    Objects.requireNonNull(utterance, "utterance");
    Objects.requireNonNull(clip, "clip");
  }
}
