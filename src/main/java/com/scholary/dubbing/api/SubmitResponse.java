package com.scholary.dubbing.api;

import com.scholary.dubbing.pipeline.DubbingStatus;
import com.scholary.dubbing.session.SessionStatus;

/** Response for an accepted dubbing job. Poll {@code /api/dub/{sessionId}} for progress. */
public record SubmitResponse(String sessionId, SessionStatus status, int progress) {

  static SubmitResponse of(DubbingStatus status) {
    return new SubmitResponse(status.sessionId(), status.status(), status.progress());
  }
}
