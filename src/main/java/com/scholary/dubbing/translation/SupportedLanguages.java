package com.scholary.dubbing.translation;

import com.scholary.dubbing.error.UnsupportedLanguageException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Target languages the dubbing pipeline accepts, keyed by ISO 639-1 code. */
public final class SupportedLanguages {

  private static final Map<String, String> LANGUAGES;

  static {
    Map<String, String> languages = new LinkedHashMap<>();
    languages.put("es", "Spanish");
    languages.put("fr", "French");
    languages.put("de", "German");
    languages.put("it", "Italian");
    languages.put("pt", "Portuguese");
    languages.put("ru", "Russian");
    languages.put("ja", "Japanese");
    languages.put("ko", "Korean");
    languages.put("zh", "Chinese");
    languages.put("ar", "Arabic");
    languages.put("hi", "Hindi");
    languages.put("nl", "Dutch");
    languages.put("sv", "Swedish");
    languages.put("no", "Norwegian");
    languages.put("da", "Danish");
    languages.put("fi", "Finnish");
    languages.put("pl", "Polish");
    languages.put("tr", "Turkish");
    languages.put("he", "Hebrew");
    languages.put("th", "Thai");
    languages.put("vi", "Vietnamese");
    LANGUAGES = Collections.unmodifiableMap(languages);
  }

  private SupportedLanguages() {}

  /** Code to display name, in a stable order. */
  public static Map<String, String> all() {
    return LANGUAGES;
  }

  public static boolean isSupported(String code) {
    return code != null && LANGUAGES.containsKey(code);
  }

  /**
   * Check a language code.
   *
   * @throws UnsupportedLanguageException if the code is unknown
   */
  public static String require(String code) {
    if (!isSupported(code)) {
      throw new UnsupportedLanguageException(code);
    }
    return code;
  }
}
