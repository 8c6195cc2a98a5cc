package com.flamingo.ai.manualkb.service.collaborator;

import java.io.IOException;

/** Hash-keyed object storage for extracted images. */
public interface ObjectStorageClient {

  boolean exists(String bucket, String key) throws IOException;

  /**
   * Stores an object, replacing any object under the same key.
   *
   * @return public or internal URL of the stored object
   */
  String upload(String bucket, String key, byte[] data, String contentType) throws IOException;

  String urlFor(String bucket, String key);
}
