package com.scholary.dubbing.error;

/** A session or an input file does not exist. */
public class NotFoundException extends DubbingException {

  public NotFoundException(String message) {
    super(message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
