package com.scholary.oralhistory.objectstore;

import java.io.InputStream;
import java.net.URL;
import java.time.Duration;

/**
 * Abstraction for the archive's blob storage.
 *
 * <p>Alignment JSON is read from here and caption files are written back next to it.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller closes the stream.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);

  /**
   * Store {@code content} unless an object with the same MD5 checksum is already there.
   *
   * @return true if the object was written, false if the stored copy was already identical
   * @throws ObjectStoreException if the checksum lookup or the upload fails
   */
  boolean putObjectIfChanged(String bucket, String key, byte[] content, String contentType);

  /**
   * Generate a presigned URL for temporary read access.
   *
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);

  /**
   * Get object metadata without downloading the content.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /**
   * Object metadata returned by getObjectMetadata.
   *
   * @param eTag entity tag without quotes; for single-part uploads this is the content's MD5 in hex
   */
  record ObjectMetadata(long contentLength, String contentType, String eTag) {}
}
