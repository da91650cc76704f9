package com.scholary.dubbing.error;

/** The requested target language code is not one the translator knows. */
public class UnsupportedLanguageException extends DubbingException {

  private final String languageCode;

  public UnsupportedLanguageException(String languageCode) {
    super(String.format("Unsupported target language: %s", languageCode));
    this.languageCode = languageCode;
  }

  public String getLanguageCode() {
    return languageCode;
  }
}
