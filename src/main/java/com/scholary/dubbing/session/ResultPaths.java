package com.scholary.dubbing.session;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Output files a session has produced so far; either may be null. */
public record ResultPaths(Path video, Path audio) {

  public static final ResultPaths NONE = new ResultPaths(null, null);

  public ResultPaths withVideo(Path video) {
    return new ResultPaths(video, audio);
  }

  public ResultPaths withAudio(Path audio) {
    return new ResultPaths(video, audio);
  }

  /** The non-null paths. */
  public List<Path> all() {
    List<Path> paths = new ArrayList<>(2);
    if (video != null) {
      paths.add(video);
    }
    if (audio != null) {
      paths.add(audio);
    }
    return paths;
  }
}
