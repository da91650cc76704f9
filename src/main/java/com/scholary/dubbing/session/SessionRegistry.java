package com.scholary.dubbing.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.error.NotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of dubbing sessions, the only shared mutable state in the service.
 *
 * <p>Backed by a bounded Caffeine cache used as a concurrent key-value store. Every mutation goes
 * through {@code asMap().compute}, so a key is updated atomically and readers always see a whole
 * {@link DubbingSession} value. Each session has one writer, the orchestrator run that owns it;
 * the registry does not re-validate progress ordering but refuses any transition out of a
 * terminal state.
 *
 * <p>Sessions leave the registry through {@link #reap(Duration)} or, once more than {@code
 * maxSessions} finished sessions are held, through Caffeine eviction. Only completed and failed
 * sessions count towards that bound; a running session weighs nothing and is never evicted. Either
 * way their files are deleted best-effort.
 */
@Repository
public class SessionRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

  private final Cache<String, DubbingSession> cache;
  private final Clock clock;

  @Autowired
  public SessionRegistry(DubbingProperties properties) {
    this(properties.session().maxSessions(), Clock.systemUTC());
  }

  SessionRegistry(int maxSessions, Clock clock) {
    this.clock = clock;
    this.cache =
        Caffeine.newBuilder()
            .maximumWeight(maxSessions)
            .weigher((String id, DubbingSession session) -> session.status().isTerminal() ? 1 : 0)
            .evictionListener(
                (String id, DubbingSession session, RemovalCause cause) -> {
                  if (session != null) {
                    LOGGER.warn("Session {} evicted ({}), deleting its files", id, cause);
                    deleteArtifacts(session);
                  }
                })
            .build();
  }

  /** Register a new session in status {@code created} with progress 0. */
  public DubbingSession create(String id, Path workDir) {
    DubbingSession session = DubbingSession.created(id, workDir, clock.instant());
    DubbingSession existing = cache.asMap().putIfAbsent(id, session);
    if (existing != null) {
      throw new IllegalStateException("Session already exists: " + id);
    }
    return session;
  }

  /**
   * Move a session to a new status and progress.
   *
   * @throws NotFoundException if the session does not exist
   * @throws IllegalStateException if the session is already completed or failed
   */
  public DubbingSession advance(String id, SessionStatus status, int progress) {
    if (progress < 0 || progress > 100) {
      throw new IllegalArgumentException("Progress must be between 0 and 100: " + progress);
    }
    if (status.isTerminal()) {
      throw new IllegalArgumentException("Use complete() or fail() to end a session");
    }
    return update(id, session -> session.advance(status, progress));
  }

  /** Mark a session failed, keeping its last progress. */
  public DubbingSession fail(String id, String error) {
    return update(id, session -> session.fail(error));
  }

  /** Mark a session completed with progress 100 and the final video path. */
  public DubbingSession complete(String id, Path videoPath) {
    return update(id, session -> session.complete(videoPath));
  }

  /** Record the reconciled audio track, kept for download and diagnostics. */
  public DubbingSession recordAudio(String id, Path audioPath) {
    return update(id, session -> session.withAudio(audioPath));
  }

  /** Attach a non-fatal diagnostic message. */
  public DubbingSession addDiagnostic(String id, String diagnostic) {
    return update(id, session -> session.withDiagnostic(diagnostic));
  }

  /**
   * Get a session snapshot.
   *
   * @throws NotFoundException if the session does not exist
   */
  public DubbingSession get(String id) {
    return find(id).orElseThrow(() -> new NotFoundException("Session not found: " + id));
  }

  public Optional<DubbingSession> find(String id) {
    return Optional.ofNullable(cache.getIfPresent(id));
  }

  /**
   * Remove sessions created more than {@code maxAge} ago and delete their files.
   *
   * <p>File deletion is best-effort: failures are logged, never thrown, so one bad file can't stop
   * a reap pass.
   *
   * @return the number of sessions removed
   */
  public int reap(Duration maxAge) {
    Instant cutoff = clock.instant().minus(maxAge);
    List<String> expired =
        cache.asMap().values().stream()
            .filter(session -> session.createdAt().isBefore(cutoff))
            .map(DubbingSession::id)
            .toList();

    int removed = 0;
    for (String id : expired) {
      DubbingSession session = cache.asMap().remove(id);
      if (session != null) {
        deleteArtifacts(session);
        removed++;
      }
    }

    if (removed > 0) {
      LOGGER.info("Reaped {} sessions older than {}", removed, maxAge);
    }
    return removed;
  }

  public long size() {
    return cache.estimatedSize();
  }

  /** Run pending cache maintenance, including eviction, now. */
  void cleanUp() {
    cache.cleanUp();
  }

  private DubbingSession update(String id, UnaryOperator<DubbingSession> transition) {
    DubbingSession updated =
        cache
            .asMap()
            .computeIfPresent(
                id,
                (key, session) -> {
                  if (session.status().isTerminal()) {
                    throw new IllegalStateException(
                        String.format("Session %s is already %s", key, session.status().wireName()));
                  }
                  return transition.apply(session);
                });
    if (updated == null) {
      throw new NotFoundException("Session not found: " + id);
    }
    return updated;
  }

  private static void deleteArtifacts(DubbingSession session) {
    for (Path path : session.resultPaths().all()) {
      try {
        Files.deleteIfExists(path);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete {} of session {}: {}", path, session.id(), e.getMessage());
      }
    }
    if (session.workDir() != null) {
      try {
        SessionWorkspace.deleteRecursively(session.workDir());
      } catch (IOException e) {
        LOGGER.warn(
            "Failed to delete working directory {} of session {}: {}",
            session.workDir(),
            session.id(),
            e.getMessage());
      }
    }
  }
}
