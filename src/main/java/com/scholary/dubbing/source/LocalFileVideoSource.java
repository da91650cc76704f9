package com.scholary.dubbing.source;

import com.scholary.dubbing.config.DubbingProperties;
import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.error.ProcessingException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Videos on the local file system, given as {@code file:} URIs or absolute paths.
 *
 * <p>Only files under {@code dubbing.localVideoRoot} are served, after resolving symlinks and
 * {@code ..} segments. Without a configured root every local reference is refused.
 */
@Component
public class LocalFileVideoSource implements VideoSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileVideoSource.class);

  private final Optional<Path> root;

  public LocalFileVideoSource(DubbingProperties properties) {
    this.root = properties.localVideoRootPath();
    LOGGER.info("Local video references {}", root.map(r -> "allowed under " + r).orElse("disabled"));
  }

  @Override
  public boolean supports(String videoRef) {
    if (videoRef.startsWith("file:")) {
      return true;
    }
    try {
      return Path.of(videoRef).isAbsolute();
    } catch (InvalidPathException e) {
      return false;
    }
  }

  @Override
  public Path fetch(String videoRef, Path targetDir) {
    Path allowedRoot =
        root.orElseThrow(() -> new NotFoundException("Local video references are disabled"));
    Path source = resolveUnder(allowedRoot, toPath(videoRef));
    if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
      throw new NotFoundException("Video file not found: " + source);
    }

    Path target = targetDir.resolve(source.getFileName().toString());
    try {
      Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new ProcessingException("Failed to copy video " + source + ": " + e.getMessage(), e);
    }
    LOGGER.info("Copied local video {} into {}", source, target);
    return target;
  }

  private static Path resolveUnder(Path allowedRoot, Path requested) {
    Path real;
    Path realRoot;
    try {
      real = requested.toRealPath();
      realRoot = allowedRoot.toRealPath();
    } catch (IOException e) {
      throw new NotFoundException("Video file not found: " + requested, e);
    }
    if (!real.startsWith(realRoot)) {
      LOGGER.warn("Refused local video outside {}: {}", realRoot, requested);
      throw new NotFoundException("Video file not found: " + requested);
    }
    return real;
  }

  private static Path toPath(String videoRef) {
    if (videoRef.startsWith("file:")) {
      try {
        return Path.of(URI.create(videoRef));
      } catch (IllegalArgumentException e) {
        throw new NotFoundException("Malformed file reference: " + videoRef, e);
      }
    }
    return Path.of(videoRef);
  }
}
