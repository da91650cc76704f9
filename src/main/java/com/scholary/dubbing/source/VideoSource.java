package com.scholary.dubbing.source;

import java.nio.file.Path;

/** Brings a referenced source video into a session's working directory. */
public interface VideoSource {

  /** Whether this source understands the reference format. */
  boolean supports(String videoRef);

  /**
   * Copy the referenced video into {@code targetDir}.
   *
   * @return path of the local copy
   * @throws com.scholary.dubbing.error.NotFoundException if the video does not exist
   */
  Path fetch(String videoRef, Path targetDir);
}
