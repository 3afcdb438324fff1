package com.task4ge.api.image;

import java.util.List;

/**
 * Outcome of resolving attachments against the registry.
 *
 * @param images one record per distinct fingerprint, in submission order
 * @param created records whose blobs were uploaded by this resolution
 */
public record ResolvedImages(List<ImageRecord> images, List<ImageRecord> created) {

  public List<String> createdKeys() {
    return created.stream().map(ImageRecord::storageKey).toList();
  }

  public List<String> urls() {
    return images.stream().map(ImageRecord::url).toList();
  }
}
