package com.scholary.dubbing.synthesis;

/** The voice a run will speak with, and the settings to use for it. */
public record ResolvedVoice(String voiceId, VoiceSettings settings, boolean cloned) {}
