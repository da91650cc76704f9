package com.scholary.dubbing.synthesis;

/** A prebuilt voice offered by the synthesis provider. */
public record VoiceOption(
    String id,
    String name,
    String description,
    String category,
    String accent,
    String gender,
    String age) {}
