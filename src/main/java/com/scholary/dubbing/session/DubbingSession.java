package com.scholary.dubbing.session;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of one dubbing job.
 *
 * <p>Immutable: the registry swaps in a new value on every transition, so whatever a poller holds
 * is a consistent copy that later transitions cannot change.
 */
public record DubbingSession(
    String id,
    SessionStatus status,
    int progress,
    ResultPaths resultPaths,
    String error,
    List<String> diagnostics,
    Instant createdAt,
    Path workDir) {

  public DubbingSession {
    diagnostics = List.copyOf(diagnostics);
  }

  static DubbingSession created(String id, Path workDir, Instant createdAt) {
    return new DubbingSession(
        id, SessionStatus.CREATED, 0, ResultPaths.NONE, null, List.of(), createdAt, workDir);
  }

  DubbingSession advance(SessionStatus newStatus, int newProgress) {
    return new DubbingSession(
        id, newStatus, newProgress, resultPaths, error, diagnostics, createdAt, workDir);
  }

  DubbingSession fail(String message) {
    return new DubbingSession(
        id, SessionStatus.FAILED, progress, resultPaths, message, diagnostics, createdAt, workDir);
  }

  DubbingSession complete(Path videoPath) {
    return new DubbingSession(
        id,
        SessionStatus.COMPLETED,
        SessionStatus.COMPLETED.checkpoint(),
        resultPaths.withVideo(videoPath),
        null,
        diagnostics,
        createdAt,
        workDir);
  }

  DubbingSession withAudio(Path audioPath) {
    return new DubbingSession(
        id, status, progress, resultPaths.withAudio(audioPath), error, diagnostics, createdAt, workDir);
  }

  DubbingSession withDiagnostic(String diagnostic) {
    List<String> updated = new ArrayList<>(diagnostics);
    updated.add(diagnostic);
    return new DubbingSession(
        id, status, progress, resultPaths, error, updated, createdAt, workDir);
  }
}
