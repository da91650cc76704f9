package com.scholary.dubbing.session;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * A session's private working directory.
 *
 * <p>Layout under {@code <workDir>/<sessionId>/}:
 *
 * <pre>
 * source/                 fetched original video
 * extracted_audio.wav     speech track for transcription and voice cloning
 * utterance_&lt;i&gt;.mp3       one synthesized clip per utterance
 * gap_&lt;i&gt;.wav             rendered silence entries
 * dubbed_track.&lt;ext&gt;      reconciled audio track
 * dubbed_video.mp4        final output
 * </pre>
 */
public final class SessionWorkspace {

  private final Path root;

  private SessionWorkspace(Path root) {
    this.root = root;
  }

  /** Create (or reuse) the directory for a session. */
  public static SessionWorkspace create(Path baseDir, String sessionId) {
    Path root = baseDir.resolve(sessionId);
    try {
      Files.createDirectories(root.resolve("source"));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create session directory: " + root, e);
    }
    return new SessionWorkspace(root);
  }

  /** Wrap an existing session directory. */
  public static SessionWorkspace of(Path root) {
    return new SessionWorkspace(root);
  }

  public Path root() {
    return root;
  }

  public Path sourceDir() {
    return root.resolve("source");
  }

  public Path extractedAudio() {
    return root.resolve("extracted_audio.wav");
  }

  public Path utteranceClip(int index) {
    return root.resolve("utterance_" + index + ".mp3");
  }

  public Path gap(int index) {
    return root.resolve("gap_" + index + ".wav");
  }

  public Path track(String extension) {
    return root.resolve("dubbed_track." + extension);
  }

  public Path dubbedVideo() {
    return root.resolve("dubbed_video.mp4");
  }

  /**
   * Delete a directory tree.
   *
   * @throws IOException on the first file that cannot be deleted
   */
  public static void deleteRecursively(Path dir) throws IOException {
    if (!Files.exists(dir)) {
      return;
    }
    List<Path> paths;
    try (Stream<Path> walk = Files.walk(dir)) {
      paths = walk.sorted(Comparator.reverseOrder()).toList();
    }
    for (Path path : paths) {
      Files.deleteIfExists(path);
    }
  }
}
