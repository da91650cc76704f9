package com.scholary.dubbing.pipeline;

import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.error.ProcessingException;
import com.scholary.dubbing.logging.StructuredLogger;
import com.scholary.dubbing.media.AudioExtractor;
import com.scholary.dubbing.media.MediaMuxer;
import com.scholary.dubbing.session.DubbingSession;
import com.scholary.dubbing.session.SessionRegistry;
import com.scholary.dubbing.session.SessionStatus;
import com.scholary.dubbing.session.SessionWorkspace;
import com.scholary.dubbing.source.VideoSources;
import com.scholary.dubbing.synthesis.ResolvedVoice;
import com.scholary.dubbing.synthesis.SynthesizedClip;
import com.scholary.dubbing.synthesis.VoiceResolver;
import com.scholary.dubbing.synthesis.VoiceStyle;
import com.scholary.dubbing.timing.ReconciledTrack;
import com.scholary.dubbing.timing.TimedClip;
import com.scholary.dubbing.timing.TimingReconciler;
import com.scholary.dubbing.transcription.Transcriber;
import com.scholary.dubbing.transcription.TranscriptionResult;
import com.scholary.dubbing.translation.SupportedLanguages;
import com.scholary.dubbing.translation.Translator;
import com.scholary.dubbing.utterance.Segmentation;
import com.scholary.dubbing.utterance.UtteranceSegmenter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives a dubbing job through its stages.
 *
 * <p>Stages and the progress set on entering them:
 *
 * <ol>
 *   <li>transcribing (10): fetch the video, extract its speech, transcribe
 *   <li>translating (30): pick utterances; without any, translate the whole transcript
 *   <li>generating_voice (50): resolve the voice, synthesize every utterance, rebuild the track
 *   <li>combining_video (80): mux the track against the original video stream
 *   <li>completed (100)
 * </ol>
 *
 * <p>Each job runs as one task on the pipeline pool. The first exception fails the session with
 * a message naming the stage; nothing is retried. Files written by earlier stages stay on disk,
 * so a muxing failure still leaves the rebuilt track for download.
 */
@Service
public class DubbingOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(DubbingOrchestrator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final SessionRegistry registry;
  private final VideoSources videoSources;
  private final AudioExtractor audioExtractor;
  private final Transcriber transcriber;
  private final UtteranceSegmenter segmenter;
  private final Translator translator;
  private final VoiceResolver voiceResolver;
  private final UtteranceSynthesizer utteranceSynthesizer;
  private final TimingReconciler reconciler;
  private final MediaMuxer muxer;
  private final Executor executor;
  private final Path workDir;

  private final Map<String, CompletableFuture<Void>> runs = new ConcurrentHashMap<>();

  public DubbingOrchestrator(
      SessionRegistry registry,
      VideoSources videoSources,
      AudioExtractor audioExtractor,
      Transcriber transcriber,
      UtteranceSegmenter segmenter,
      Translator translator,
      VoiceResolver voiceResolver,
      UtteranceSynthesizer utteranceSynthesizer,
      TimingReconciler reconciler,
      MediaMuxer muxer,
      @Qualifier("pipelineExecutor") Executor executor,
      DubbingProperties properties) {
    this.registry = registry;
    this.videoSources = videoSources;
    this.audioExtractor = audioExtractor;
    this.transcriber = transcriber;
    this.segmenter = segmenter;
    this.translator = translator;
    this.voiceResolver = voiceResolver;
    this.utteranceSynthesizer = utteranceSynthesizer;
    this.reconciler = reconciler;
    this.muxer = muxer;
    this.executor = executor;
    this.workDir = Path.of(properties.workDir());
  }

  /**
   * Create a session and schedule its run.
   *
   * <p>Returns immediately. If the pipeline pool is saturated the session is created already
   * failed, so the caller still gets an id to poll.
   *
   * @return the new session id
   */
  public String submit(DubbingRequest request) {
    String sessionId = UUID.randomUUID().toString();
    SessionWorkspace workspace = SessionWorkspace.create(workDir, sessionId);
    registry.create(sessionId, workspace.root());
    LOGGER.info(
        "Created dubbing session {}: video={}, language={}, voice={}, style={}",
        sessionId,
        request.videoRef(),
        request.targetLanguage(),
        request.voiceOption(),
        request.voiceStyle());

    CompletableFuture<Void> run;
    try {
      run = CompletableFuture.runAsync(() -> execute(sessionId, request, workspace), executor);
    } catch (RejectedExecutionException e) {
      LOGGER.warn("Pipeline queue full, rejecting session {}", sessionId);
      markFailed(sessionId, SessionStatus.CREATED, "pipeline is at capacity, try again later");
      return sessionId;
    }

    runs.put(sessionId, run);
    run.whenComplete(
        (ignored, error) -> {
          runs.remove(sessionId);
          if (error != null) {
            Throwable cause = error instanceof CompletionException ? error.getCause() : error;
            LOGGER.error("Dubbing run {} ended abnormally", sessionId, cause);
            markFailed(sessionId, SessionStatus.CREATED, describe(cause));
          }
        });
    return sessionId;
  }

  /**
   * Current status of a session.
   *
   * @throws NotFoundException if the session does not exist
   */
  public DubbingStatus status(String sessionId) {
    return DubbingStatus.of(registry.get(sessionId));
  }

  /**
   * The dubbed video of a completed session.
   *
   * @throws NotFoundException if the session does not exist, has not completed, or its file is gone
   */
  public Path resultVideo(String sessionId) {
    DubbingSession session = registry.get(sessionId);
    Path video = session.resultPaths().video();
    if (session.status() != SessionStatus.COMPLETED || video == null) {
      throw new NotFoundException("Dubbed video not ready for session " + sessionId);
    }
    if (!Files.isReadable(video)) {
      throw new NotFoundException("Dubbed video file is missing for session " + sessionId);
    }
    return video;
  }

  /** Number of runs still in flight. */
  public int activeRuns() {
    return runs.size();
  }

  void execute(String sessionId, DubbingRequest request, SessionWorkspace workspace) {
    StructuredLogger.setSessionContext(sessionId, request.targetLanguage());
    RunState run = new RunState(sessionId, request, workspace);
    try {
      runStage(run, SessionStatus.TRANSCRIBING, () -> transcribe(run));
      runStage(run, SessionStatus.TRANSLATING, () -> translate(run));
      runStage(run, SessionStatus.GENERATING_VOICE, () -> generateVoice(run));
      runStage(run, SessionStatus.COMBINING_VIDEO, () -> combineVideo(run));

      registry.complete(sessionId, run.dubbedVideo);
      LOGGER.info("Dubbing session {} completed: {}", sessionId, run.dubbedVideo);

    } catch (RuntimeException e) {
      STRUCTURED_LOGGER.logStageFailed(
          sessionId, run.stage.wireName(), e.getClass().getSimpleName(), e.getMessage());
      LOGGER.debug("Stage failure detail", e);
      markFailed(sessionId, run.stage, describe(e));
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }

  private void runStage(RunState run, SessionStatus stage, Runnable work) {
    run.stage = stage;
    registry.advance(run.sessionId, stage, stage.checkpoint());
    StructuredLogger.setStage(stage.wireName());
    STRUCTURED_LOGGER.logStageStarted(run.sessionId, stage.wireName(), stage.checkpoint());

    long started = System.currentTimeMillis();
    work.run();
    STRUCTURED_LOGGER.logStageFinished(
        run.sessionId, stage.wireName(), System.currentTimeMillis() - started);
  }

  private void transcribe(RunState run) {
    run.sourceVideo = videoSources.fetch(run.request.videoRef(), run.workspace.sourceDir());
    run.extractedAudio = audioExtractor.extract(run.sourceVideo, run.workspace.extractedAudio());

    TranscriptionResult transcript = transcriber.transcribe(run.extractedAudio);
    if (transcript.isEmpty()) {
      throw new ProcessingException("No speech detected in video");
    }
    run.transcript = transcript;
  }

  private void translate(RunState run) {
    SupportedLanguages.require(run.request.targetLanguage());
    run.segmentation = segmenter.segment(run.transcript);
    LOGGER.info(
        "Segmentation: mode={}, utterances={}",
        run.segmentation.mode(),
        run.segmentation.utterances().size());

    if (run.segmentation.isSingleSegment()) {
      String translated = translator.translate(run.transcript.text(), run.request.targetLanguage());
      if (translated == null || translated.isBlank()) {
        throw new ProcessingException("Translation produced no text");
      }
      run.fullTranslation = translated;
    }
  }

  private void generateVoice(RunState run) {
    ResolvedVoice voice =
        voiceResolver.resolve(
            run.request.voiceOption(),
            VoiceStyle.fromName(run.request.voiceStyle()),
            run.request.targetLanguage(),
            run.extractedAudio,
            run.sessionId);
    LOGGER.info("Using voice {} (cloned={})", voice.voiceId(), voice.cloned());

    ReconciledTrack track;
    if (run.segmentation.isSingleSegment()) {
      SynthesizedClip clip =
          utteranceSynthesizer.synthesizeText(0, run.fullTranslation, voice, run.workspace);
      track = reconciler.passThrough(clip, run.workspace);
    } else {
      List<TimedClip> clips =
          utteranceSynthesizer.synthesizeAll(
              run.segmentation.utterances(), run.request.targetLanguage(), voice, run.workspace);
      if (clips.isEmpty()) {
        throw new ProcessingException("No utterance produced any speech");
      }
      track = reconciler.reconcile(clips, run.workspace);
    }

    run.track = track;
    registry.recordAudio(run.sessionId, track.file());
    track.driftDiagnostic()
        .ifPresent(drift -> registry.addDiagnostic(run.sessionId, drift.message()));
  }

  private void combineVideo(RunState run) {
    run.dubbedVideo =
        muxer.mux(run.sourceVideo, run.track.file(), run.workspace.dubbedVideo());
  }

  private void markFailed(String sessionId, SessionStatus stage, String message) {
    try {
      registry.fail(sessionId, stage.stageLabel() + " failed: " + message);
    } catch (NotFoundException e) {
      LOGGER.warn("Session {} no longer exists, dropping failure: {}", sessionId, message);
    } catch (IllegalStateException e) {
      LOGGER.warn("Session {} already ended, dropping failure: {}", sessionId, message);
    }
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }

  /** Stage outputs of one run; only the run's own thread touches it. */
  private static final class RunState {
    private final String sessionId;
    private final DubbingRequest request;
    private final SessionWorkspace workspace;

    private SessionStatus stage = SessionStatus.CREATED;
    private Path sourceVideo;
    private Path extractedAudio;
    private TranscriptionResult transcript;
    private Segmentation segmentation;
    private String fullTranslation;
    private ReconciledTrack track;
    private Path dubbedVideo;

    private RunState(String sessionId, DubbingRequest request, SessionWorkspace workspace) {
      this.sessionId = sessionId;
      this.request = request;
      this.workspace = workspace;
    }
  }
}
