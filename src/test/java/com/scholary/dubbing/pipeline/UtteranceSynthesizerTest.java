package com.scholary.dubbing.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.dubbing.config.TestProperties;
import com.scholary.dubbing.error.ProcessingException;
import com.scholary.dubbing.error.UpstreamException;
import com.scholary.dubbing.media.MediaProbe;
import com.scholary.dubbing.session.SessionWorkspace;
import com.scholary.dubbing.synthesis.ResolvedVoice;
import com.scholary.dubbing.synthesis.SpeechSynthesizer;
import com.scholary.dubbing.synthesis.VoiceStyle;
import com.scholary.dubbing.timing.TimedClip;
import com.scholary.dubbing.translation.Translator;
import com.scholary.dubbing.utterance.Utterance;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UtteranceSynthesizerTest {

  private static final ResolvedVoice VOICE =
      new ResolvedVoice("voice-1", VoiceStyle.NATURAL.settings(), false);

  @Mock private Translator translator;
  @Mock private SpeechSynthesizer synthesizer;
  @Mock private MediaProbe probe;

  @TempDir Path tempDir;

  private ExecutorService executor;
  private UtteranceSynthesizer utteranceSynthesizer;
  private SessionWorkspace workspace;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(3);
    utteranceSynthesizer =
        new UtteranceSynthesizer(
            translator, synthesizer, probe, executor, TestProperties.dubbing(tempDir));
    workspace = SessionWorkspace.create(tempDir, "session-1");
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void synthesizeAll_shouldReturnClipsInUtteranceOrder() {
    List<Utterance> utterances =
        List.of(
            new Utterance(0.0, 1.0, "one"),
            new Utterance(2.0, 3.0, "two"),
            new Utterance(4.0, 5.0, "three"));
    when(translator.translate(anyString(), eq("es"))).thenAnswer(i -> "es:" + i.getArgument(0));
    when(synthesizer.synthesize(anyString(), eq("voice-1"), any())).thenReturn(new byte[] {1, 2});
    when(probe.durationSeconds(any())).thenReturn(0.9);

    List<TimedClip> clips = utteranceSynthesizer.synthesizeAll(utterances, "es", VOICE, workspace);

    assertThat(clips).extracting(clip -> clip.utterance().text())
        .containsExactly("one", "two", "three");
    assertThat(clips).extracting(clip -> clip.clip().utteranceIndex()).containsExactly(0, 1, 2);
    assertThat(workspace.utteranceClip(1)).exists();
    verify(synthesizer).synthesize(eq("es:two"), eq("voice-1"), any());
  }

  @Test
  void synthesizeAll_shouldSkipUtterancesTranslatedToBlank() {
    List<Utterance> utterances =
        List.of(new Utterance(0.0, 1.0, "hmm"), new Utterance(2.0, 3.0, "hello"));
    when(translator.translate("hmm", "fr")).thenReturn("  ");
    when(translator.translate("hello", "fr")).thenReturn("bonjour");
    when(synthesizer.synthesize(eq("bonjour"), anyString(), any())).thenReturn(new byte[] {1});
    when(probe.durationSeconds(any())).thenReturn(0.5);

    List<TimedClip> clips = utteranceSynthesizer.synthesizeAll(utterances, "fr", VOICE, workspace);

    assertThat(clips).hasSize(1);
    assertThat(clips.get(0).clip().utteranceIndex()).isEqualTo(1);
    verify(synthesizer, never()).synthesize(eq("  "), anyString(), any());
  }

  @Test
  void synthesizeAll_shouldFailWithFirstProviderError() {
    List<Utterance> utterances =
        List.of(new Utterance(0.0, 1.0, "one"), new Utterance(2.0, 3.0, "two"));
    lenient().when(translator.translate(anyString(), anyString())).thenReturn("uno");
    lenient()
        .when(synthesizer.synthesize(anyString(), anyString(), any()))
        .thenThrow(new UpstreamException("elevenlabs", "quota exceeded"));

    assertThatThrownBy(() -> utteranceSynthesizer.synthesizeAll(utterances, "es", VOICE, workspace))
        .isInstanceOf(UpstreamException.class)
        .hasMessage("quota exceeded");
  }

  @Test
  void synthesizeAll_shouldTimeOutSlowUtterances() {
    // utterance timeout is 5s in the test properties
    when(translator.translate(anyString(), anyString()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(10_000);
              return "late";
            });

    assertThatThrownBy(
            () ->
                utteranceSynthesizer.synthesizeAll(
                    List.of(new Utterance(0.0, 1.0, "slow")), "es", VOICE, workspace))
        .isInstanceOf(UpstreamException.class)
        .hasMessageContaining("timed out");
  }

  @Test
  void synthesizeAll_shouldStartTimeoutWhenTaskRuns() {
    // one worker, 5s timeout: the queue takes 6s in total but each task only 2s
    ExecutorService singleWorker = Executors.newSingleThreadExecutor();
    try {
      UtteranceSynthesizer serial =
          new UtteranceSynthesizer(
              translator, synthesizer, probe, singleWorker, TestProperties.dubbing(tempDir));
      when(translator.translate(anyString(), anyString()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(2_000);
                return "ok";
              });
      when(synthesizer.synthesize(anyString(), anyString(), any())).thenReturn(new byte[] {1});
      when(probe.durationSeconds(any())).thenReturn(0.5);
      List<Utterance> utterances =
          List.of(
              new Utterance(0.0, 1.0, "one"),
              new Utterance(2.0, 3.0, "two"),
              new Utterance(4.0, 5.0, "three"));

      List<TimedClip> clips = serial.synthesizeAll(utterances, "es", VOICE, workspace);

      assertThat(clips).hasSize(3);
    } finally {
      singleWorker.shutdownNow();
    }
  }

  @Test
  void synthesizeAll_shouldCancelQueuedWorkWhenPoolRejects() throws Exception {
    ThreadPoolExecutor saturated =
        new ThreadPoolExecutor(1, 1, 0, TimeUnit.SECONDS, new ArrayBlockingQueue<>(2));
    CountDownLatch release = new CountDownLatch(1);
    try {
      UtteranceSynthesizer bounded =
          new UtteranceSynthesizer(
              translator, synthesizer, probe, saturated, TestProperties.dubbing(tempDir));
      lenient()
          .when(translator.translate(anyString(), anyString()))
          .thenAnswer(
              invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return "";
              });
      List<Utterance> utterances =
          List.of(
              new Utterance(0.0, 1.0, "one"),
              new Utterance(1.0, 2.0, "two"),
              new Utterance(2.0, 3.0, "three"),
              new Utterance(3.0, 4.0, "four"),
              new Utterance(4.0, 5.0, "five"),
              new Utterance(5.0, 6.0, "six"));

      assertThatThrownBy(() -> bounded.synthesizeAll(utterances, "es", VOICE, workspace))
          .isInstanceOf(ProcessingException.class)
          .hasMessage("Synthesis queue is full after 3 of 6 utterances, try again later");

      release.countDown();
      saturated.shutdown();
      assertThat(saturated.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
      // only the task already running when the pool filled up may reach the provider
      verify(translator, atMost(1)).translate(anyString(), anyString());
    } finally {
      release.countDown();
      saturated.shutdownNow();
    }
  }

  @Test
  void synthesizeText_shouldWriteClipIntoWorkspace() throws Exception {
    when(synthesizer.synthesize("hola", "voice-1", VOICE.settings())).thenReturn(new byte[] {7, 8});
    when(probe.durationSeconds(workspace.utteranceClip(0))).thenReturn(1.25);

    var clip = utteranceSynthesizer.synthesizeText(0, "hola", VOICE, workspace);

    assertThat(clip.durationSeconds()).isEqualTo(1.25);
    assertThat(Files.readAllBytes(clip.audioFile())).containsExactly(7, 8);
  }
}
