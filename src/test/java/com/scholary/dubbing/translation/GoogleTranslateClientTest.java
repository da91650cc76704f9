package com.scholary.dubbing.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.error.UnsupportedLanguageException;
import com.scholary.dubbing.error.UpstreamException;
import org.junit.jupiter.api.Test;

class GoogleTranslateClientTest {

  private final GoogleTranslateClient client =
      new GoogleTranslateClient(
          new TranslationProperties("http://localhost:1", 1, 1), new ObjectMapper());

  @Test
  void parse_shouldJoinTranslatedSentences() throws Exception {
    String body =
        "[[[\"Hola a todos. \",\"Hello everyone. \",null,null,10],"
            + "[\"Hasta pronto.\",\"See you soon.\",null,null,10]],null,\"en\"]";

    assertThat(client.parse(body)).isEqualTo("Hola a todos. Hasta pronto.");
  }

  @Test
  void parse_shouldRejectUnexpectedShape() {
    assertThatThrownBy(() -> client.parse("{\"error\":\"nope\"}"))
        .isInstanceOf(UpstreamException.class);
  }

  @Test
  void translate_shouldRejectUnsupportedLanguage() {
    assertThatThrownBy(() -> client.translate("Hello", "xx"))
        .isInstanceOf(UnsupportedLanguageException.class)
        .hasMessage("Unsupported target language: xx");
  }

  @Test
  void translate_shouldReturnEmptyForBlankText() {
    assertThat(client.translate("   ", "es")).isEmpty();
  }

  @Test
  void supportedLanguages_shouldListTwentyOneCodes() {
    assertThat(SupportedLanguages.all()).hasSize(21).containsEntry("hi", "Hindi");
    assertThat(SupportedLanguages.isSupported("en")).isFalse();
  }
}
