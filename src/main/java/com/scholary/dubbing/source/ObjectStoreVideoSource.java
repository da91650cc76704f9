package com.scholary.dubbing.source;

import com.scholary.dubbing.error.NotFoundException;
import com.scholary.dubbing.objectstore.ObjectStoreClient;
import com.scholary.dubbing.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.dubbing.objectstore.ObjectStoreException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Videos in S3-compatible object storage, referenced as {@code s3://bucket/key}.
 *
 * <p>Registered by {@link com.scholary.dubbing.config.ObjectStoreConfig} when the object store is
 * enabled.
 */
public class ObjectStoreVideoSource implements VideoSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreVideoSource.class);
  private static final String SCHEME = "s3://";

  private final ObjectStoreClient client;

  public ObjectStoreVideoSource(ObjectStoreClient client) {
    this.client = client;
  }

  @Override
  public boolean supports(String videoRef) {
    return videoRef.startsWith(SCHEME);
  }

  @Override
  public Path fetch(String videoRef, Path targetDir) {
    String location = videoRef.substring(SCHEME.length());
    int slash = location.indexOf('/');
    if (slash <= 0 || slash == location.length() - 1) {
      throw new NotFoundException("Object reference needs a bucket and a key: " + videoRef);
    }
    String bucket = location.substring(0, slash);
    String key = location.substring(slash + 1);

    try {
      ObjectMetadata metadata = client.getObjectMetadata(bucket, key);
      LOGGER.info(
          "Downloading video: bucket={}, key={}, size={} bytes",
          bucket,
          key,
          metadata.contentLength());

      Path target = targetDir.resolve(Path.of(key).getFileName().toString());
      try (InputStream stream = client.getObjectStream(bucket, key)) {
        Files.copy(stream, target, StandardCopyOption.REPLACE_EXISTING);
      }
      return target;

    } catch (ObjectStoreException e) {
      if (e.isNotFound()) {
        throw new NotFoundException("Video not found: " + videoRef, e);
      }
      throw e;
    } catch (IOException e) {
      throw new ObjectStoreException("Failed to download " + videoRef + ": " + e.getMessage(), e);
    }
  }
}
