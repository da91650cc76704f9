package com.scholary.dubbing.source;

import com.scholary.dubbing.error.NotFoundException;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/** Dispatches a video reference to the first {@link VideoSource} that accepts it. */
@Component
public class VideoSources {

  private final List<VideoSource> sources;

  public VideoSources(List<VideoSource> sources) {
    this.sources = List.copyOf(sources);
  }

  public Path fetch(String videoRef, Path targetDir) {
    return sources.stream()
        .filter(source -> source.supports(videoRef))
        .findFirst()
        .orElseThrow(() -> new NotFoundException("Unsupported video reference: " + videoRef))
        .fetch(videoRef, targetDir);
  }
}
