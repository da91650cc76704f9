package com.scholary.dubbing.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields in MDC for the duration of one log call so they can be queried in
 * the log store. Session id, target language and current stage stay in MDC for the whole run.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String sessionId, String stage, int progress) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("progress", String.valueOf(progress));

      logger.info("Stage started: session={}, stage={}, progress={}%", sessionId, stage, progress);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String sessionId, String stage, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Stage finished: session={}, stage={}, elapsed={}ms", sessionId, stage, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage failure event. */
  public void logStageFailed(String sessionId, String stage, String errorType, String message) {
    try {
      MDC.put("event_type", "stage_failed");
      MDC.put("errorType", errorType);

      logger.error(
          "Stage failed: session={}, stage={}, error={}, message={}",
          sessionId,
          stage,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log one utterance synthesized. */
  public void logClipSynthesized(
      int utteranceIndex, double start, double end, double clipSeconds, long synthesizeMs) {
    try {
      MDC.put("event_type", "clip_synthesized");
      MDC.put("utterance_index", String.valueOf(utteranceIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("clipSeconds", String.valueOf(clipSeconds));
      MDC.put("synthesizeMs", String.valueOf(synthesizeMs));

      logger.debug(
          "Clip synthesized: utterance={}, slot=[{}-{}], clip={}s, took={}ms",
          utteranceIndex,
          start,
          end,
          clipSeconds,
          synthesizeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log track plan built. */
  public void logTrackPlanned(int clips, int silences, double plannedSeconds, double expectedSeconds) {
    try {
      MDC.put("event_type", "track_planned");
      MDC.put("clips", String.valueOf(clips));
      MDC.put("silences", String.valueOf(silences));
      MDC.put("plannedSeconds", String.valueOf(plannedSeconds));
      MDC.put("expectedSeconds", String.valueOf(expectedSeconds));

      logger.info(
          "Track planned: clips={}, silences={}, planned={}s, expected={}s",
          clips,
          silences,
          plannedSeconds,
          expectedSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log duration drift between the rebuilt track and the original timing. */
  public void logDurationDrift(double actualSeconds, double expectedSeconds, double ratio) {
    try {
      MDC.put("event_type", "duration_drift");
      MDC.put("actualSeconds", String.valueOf(actualSeconds));
      MDC.put("expectedSeconds", String.valueOf(expectedSeconds));
      MDC.put("ratio", String.valueOf(ratio));

      logger.warn(
          "Duration drift: actual={}s, expected={}s, ratio={}",
          actualSeconds,
          expectedSeconds,
          ratio);
    } finally {
      clearEventFields();
    }
  }

  /** Set session context in MDC. */
  public static void setSessionContext(String sessionId, String targetLanguage) {
    MDC.put("sessionId", sessionId);
    MDC.put("targetLanguage", targetLanguage);
  }

  /** Set the running stage in MDC; it stays until the next stage or the end of the run. */
  public static void setStage(String stage) {
    MDC.put("stage", stage);
  }

  /** Clear session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("sessionId");
    MDC.remove("targetLanguage");
    MDC.remove("stage");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("progress");
    MDC.remove("elapsedMs");
    MDC.remove("errorType");
    MDC.remove("utterance_index");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("clipSeconds");
    MDC.remove("synthesizeMs");
    MDC.remove("clips");
    MDC.remove("silences");
    MDC.remove("plannedSeconds");
    MDC.remove("expectedSeconds");
    MDC.remove("actualSeconds");
    MDC.remove("ratio");
  }
}
