package com.scholary.dubbing.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.dubbing.session.DubbingSession;
import com.scholary.dubbing.session.SessionStatus;
import java.util.List;

/**
 * What a polling client sees of a session.
 *
 * <p>{@code videoRef} and {@code downloadRef} are only set once the session completed, {@code
 * error} only once it failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DubbingStatus(
    String sessionId,
    SessionStatus status,
    int progress,
    String videoRef,
    String downloadRef,
    String error,
    List<String> diagnostics) {

  public static DubbingStatus of(DubbingSession session) {
    boolean completed = session.status() == SessionStatus.COMPLETED;
    boolean failed = session.status() == SessionStatus.FAILED;
    return new DubbingStatus(
        session.id(),
        session.status(),
        session.progress(),
        completed ? "/api/dub/" + session.id() + "/video" : null,
        completed ? "/api/dub/" + session.id() + "/download" : null,
        failed ? session.error() : null,
        session.diagnostics());
  }
}
