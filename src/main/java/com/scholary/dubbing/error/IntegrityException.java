package com.scholary.dubbing.error;

/**
 * A postcondition was violated: a step reported success but its artifact is missing.
 *
 * <p>Always fatal. This points at a bug or a broken environment, never at bad input.
 */
public class IntegrityException extends DubbingException {

  public IntegrityException(String message) {
    super(message);
  }
}
