package com.scholary.dubbing.transcription;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.error.UpstreamException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DeepgramTranscriberTest {

  @TempDir Path tempDir;

  private DeepgramTranscriber transcriber(String apiKey) {
    return new DeepgramTranscriber(
        new DeepgramProperties("http://localhost:1", apiKey, "nova-2", 1, 1), new ObjectMapper());
  }

  @Test
  void parse_shouldMapUtterancesParagraphsAndWords() throws Exception {
    TranscriptionResult result = transcriber("key").parse(fixture("deepgram-response.json"));

    assertThat(result.text()).isEqualTo("Hello there. See you soon.");
    assertThat(result.words()).hasSize(5);
    assertThat(result.words().get(1).word()).isEqualTo("there.");
    // falls back to the bare word when no punctuated form is given
    assertThat(result.words().get(3).word()).isEqualTo("you");
    assertThat(result.utterances())
        .containsExactly(
            new TranscriptSegment(0.08, 0.9, "Hello there."),
            new TranscriptSegment(5.1, 6.0, "See you soon."));
    assertThat(result.paragraphs())
        .containsExactly(new TranscriptSegment(0.08, 6.0, "Hello there. See you soon."));
  }

  @Test
  void parse_shouldTolerateMissingSections() throws Exception {
    TranscriptionResult result = transcriber("key").parse("{\"results\":{}}");

    assertThat(result.isEmpty()).isTrue();
  }

  @Test
  void transcribe_shouldRejectMissingAudioFile() {
    assertThatThrownBy(() -> transcriber("key").transcribe(tempDir.resolve("missing.wav")))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void transcribe_shouldFailWithoutApiKey() throws Exception {
    Path audio = Files.writeString(tempDir.resolve("audio.wav"), "RIFF");

    assertThatThrownBy(() -> transcriber("").transcribe(audio))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("DEEPGRAM_API_KEY");
  }

  private static String fixture(String name) throws Exception {
    try (InputStream in = DeepgramTranscriberTest.class.getResourceAsStream("/fixtures/" + name)) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
