package com.scholary.dubbing.error;

/**
 * A local media tool (ffmpeg, ffprobe) failed.
 *
 * <p>Carries the tool's combined output so the failure can be diagnosed from the session error
 * and the logs.
 */
public class ProcessingException extends DubbingException {

  private final String toolOutput;

  public ProcessingException(String message) {
    this(message, (String) null);
  }

  public ProcessingException(String message, String toolOutput) {
    super(toolOutput == null || toolOutput.isBlank() ? message : message + ": " + toolOutput);
    this.toolOutput = toolOutput;
  }

  public ProcessingException(String message, Throwable cause) {
    super(message, cause);
    this.toolOutput = null;
  }

  public String getToolOutput() {
    return toolOutput;
  }
}
