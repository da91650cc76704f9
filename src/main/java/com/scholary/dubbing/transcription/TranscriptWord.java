package com.scholary.dubbing.transcription;

/** A single transcribed word with its timing. */
public record TranscriptWord(String word, double start, double end) {}
