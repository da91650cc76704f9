package com.scholary.dubbing.error;

/**
 * Base class for every failure the dubbing pipeline reports.
 *
 * <p>Unchecked, like the rest of the collaborator exceptions: a stage either succeeds or the
 * orchestrator turns the exception into a failed session.
 */
public class DubbingException extends RuntimeException {

  public DubbingException(String message) {
    super(message);
  }

  public DubbingException(String message, Throwable cause) {
    super(message, cause);
  }
}
