package com.task4ge.api.infra.s3;

import java.io.InputStream;

/**
 * Object storage holding uploaded image bytes.
 */
public interface BlobStore {

  /**
   * Stores the stream under a fresh unique key.
   *
   * @throws BlobStoreException when the store rejects or cannot be reached
   */
  StoredBlob upload(InputStream content, long contentLength, String contentType);

  /**
   * @throws BlobStoreException when the store rejects or cannot be reached
   */
  void delete(String key);

  record StoredBlob(String key, String url) {
  }
}
