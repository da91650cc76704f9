package com.scholary.dubbing.objectstore;

import java.io.InputStream;

/**
 * Abstraction for object storage operations.
 *
 * <p>Decouples video acquisition from the storage backend (S3, MinIO) and lets tests mock it.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream.
   *
   * <p>Source videos can be large, so they are streamed to disk rather than loaded into memory.
   * The caller is responsible for closing the stream.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return an input stream for reading the object
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Get object metadata without downloading the content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return object metadata
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
