package com.scholary.dubbing.media;

/** Exit code and combined stdout/stderr of a finished external process. */
public record ProcessResult(int exitCode, String output) {

  public boolean succeeded() {
    return exitCode == 0;
  }
}
