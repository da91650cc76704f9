package com.scholary.dubbing.translation;

/**
 * Machine-translation capability.
 *
 * <p>One abstract contract, concrete adapters per provider. The adapter is picked by
 * configuration, not at runtime.
 */
public interface Translator {

  /**
   * Translate text into the target language.
   *
   * @param text source text, language auto-detected
   * @param targetLanguage a code from {@link SupportedLanguages}
   * @return the translated text
   * @throws com.scholary.dubbing.error.UnsupportedLanguageException for unknown codes
   * @throws com.scholary.dubbing.error.UpstreamException if the provider call fails
   */
  String translate(String text, String targetLanguage);
}
