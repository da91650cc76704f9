package com.scholary.dubbing.timing;

/** What a track plan entry contributes to the rebuilt track. */
public enum EntryKind {
  SILENCE,
  CLIP
}
