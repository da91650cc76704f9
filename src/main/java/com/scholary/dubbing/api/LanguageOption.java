package com.scholary.dubbing.api;

/** A supported target language. */
public record LanguageOption(String code, String name) {}
