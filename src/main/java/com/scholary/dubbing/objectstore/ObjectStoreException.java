package com.scholary.dubbing.objectstore;

import com.scholary.dubbing.error.UpstreamException;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>The object store is just another upstream provider to the pipeline: a missing object or bad
 * credentials fail the stage that needed it.
 */
public class ObjectStoreException extends UpstreamException {

  private static final String PROVIDER = "objectstore";

  private final boolean notFound;

  public ObjectStoreException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public ObjectStoreException(String message, Throwable cause, boolean notFound) {
    super(PROVIDER, message, cause);
    this.notFound = notFound;
  }

  /** Whether the bucket or key does not exist. */
  public boolean isNotFound() {
    return notFound;
  }
}
