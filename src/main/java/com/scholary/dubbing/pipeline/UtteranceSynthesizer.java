package com.scholary.dubbing.pipeline;

import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.error.DubbingException;
import com.scholary.dubbing.error.IntegrityException;
import com.scholary.dubbing.error.ProcessingException;
import com.scholary.dubbing.error.UpstreamException;
import com.scholary.dubbing.logging.StructuredLogger;
import com.scholary.dubbing.media.MediaProbe;
import com.scholary.dubbing.session.SessionWorkspace;
import com.scholary.dubbing.synthesis.ResolvedVoice;
import com.scholary.dubbing.synthesis.SpeechSynthesizer;
import com.scholary.dubbing.synthesis.SynthesizedClip;
import com.scholary.dubbing.timing.TimedClip;
import com.scholary.dubbing.translation.Translator;
import com.scholary.dubbing.utterance.Utterance;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Translates and synthesizes utterances concurrently.
 *
 * <p>Each utterance is one task on the synthesis pool, bounded by the per-utterance timeout from
 * the moment it starts running. The first failure, or a full pool queue, fails the whole batch and
 * cancels the tasks still waiting; results come back in utterance order. Utterances that
 * translate to blank text get no clip.
 */
@Component
public class UtteranceSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(UtteranceSynthesizer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Translator translator;
  private final SpeechSynthesizer synthesizer;
  private final MediaProbe probe;
  private final Executor executor;
  private final Duration utteranceTimeout;

  public UtteranceSynthesizer(
      Translator translator,
      SpeechSynthesizer synthesizer,
      MediaProbe probe,
      @Qualifier("synthesisExecutor") Executor executor,
      DubbingProperties properties) {
    this.translator = translator;
    this.synthesizer = synthesizer;
    this.probe = probe;
    this.executor = executor;
    this.utteranceTimeout = properties.synthesis().utteranceTimeout();
  }

  /**
   * Translate and synthesize every utterance.
   *
   * @return one clip per utterance with non-blank translation, in utterance order
   */
  public List<TimedClip> synthesizeAll(
      List<Utterance> utterances,
      String targetLanguage,
      ResolvedVoice voice,
      SessionWorkspace workspace) {

    List<CompletableFuture<Optional<TimedClip>>> tasks = new ArrayList<>(utterances.size());
    List<TimedClip> clips = new ArrayList<>(utterances.size());
    try {
      for (int i = 0; i < utterances.size(); i++) {
        tasks.add(submit(i, utterances.get(i), targetLanguage, voice, workspace));
      }
      for (CompletableFuture<Optional<TimedClip>> task : tasks) {
        task.join().ifPresent(clips::add);
      }
    } catch (RejectedExecutionException e) {
      tasks.forEach(task -> task.cancel(true));
      throw new ProcessingException(
          String.format(
              "Synthesis queue is full after %d of %d utterances, try again later",
              tasks.size(), utterances.size()),
          e);
    } catch (CompletionException e) {
      tasks.forEach(task -> task.cancel(true));
      throw unwrap(e);
    }

    LOGGER.info("Synthesized {} of {} utterances", clips.size(), utterances.size());
    return clips;
  }

  /**
   * Queue one utterance on the synthesis pool.
   *
   * <p>The timeout starts when a worker picks the task up, not when it is queued. A task whose
   * future is already done when it starts (cancelled after a sibling failed) does nothing.
   */
  private CompletableFuture<Optional<TimedClip>> submit(
      int index,
      Utterance utterance,
      String targetLanguage,
      ResolvedVoice voice,
      SessionWorkspace workspace) {

    CompletableFuture<Optional<TimedClip>> result = new CompletableFuture<>();
    executor.execute(
        () -> {
          if (result.isDone()) {
            return;
          }
          result.orTimeout(utteranceTimeout.toMillis(), TimeUnit.MILLISECONDS);
          try {
            result.complete(synthesizeOne(index, utterance, targetLanguage, voice, workspace));
          } catch (RuntimeException e) {
            result.completeExceptionally(e);
          }
        });
    return result;
  }

  /** Synthesize already translated text into the clip slot {@code index}. */
  public SynthesizedClip synthesizeText(
      int index, String text, ResolvedVoice voice, SessionWorkspace workspace) {
    byte[] audio = synthesizer.synthesize(text, voice.voiceId(), voice.settings());
    if (audio == null || audio.length == 0) {
      throw new IntegrityException("Synthesizer returned no audio for utterance " + index);
    }

    Path file = workspace.utteranceClip(index);
    try {
      Files.write(file, audio);
    } catch (IOException e) {
      throw new ProcessingException("Failed to write clip " + file.getFileName(), e);
    }
    return new SynthesizedClip(index, file, probe.durationSeconds(file));
  }

  private Optional<TimedClip> synthesizeOne(
      int index,
      Utterance utterance,
      String targetLanguage,
      ResolvedVoice voice,
      SessionWorkspace workspace) {

    long started = System.currentTimeMillis();
    String translated = translator.translate(utterance.text(), targetLanguage);
    if (translated == null || translated.isBlank()) {
      LOGGER.warn("Utterance {} translated to blank text, skipping", index);
      return Optional.empty();
    }

    SynthesizedClip clip = synthesizeText(index, translated, voice, workspace);
    STRUCTURED_LOGGER.logClipSynthesized(
        index,
        utterance.start(),
        utterance.end(),
        clip.durationSeconds(),
        System.currentTimeMillis() - started);
    return Optional.of(new TimedClip(utterance, clip));
  }

  private RuntimeException unwrap(CompletionException e) {
    Throwable cause = e.getCause() == null ? e : e.getCause();
    if (cause instanceof TimeoutException) {
      return new UpstreamException(
          "synthesis", "Utterance synthesis timed out after " + utteranceTimeout, cause);
    }
    if (cause instanceof RuntimeException) {
      return (RuntimeException) cause;
    }
    return new DubbingException("Utterance synthesis failed: " + cause.getMessage(), cause);
  }
}
