package com.task4ge.api.support;

import com.task4ge.api.infra.s3.BlobStore;
import com.task4ge.api.infra.s3.BlobStoreException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class RecordingBlobStore implements BlobStore {

  private final Map<String, byte[]> objects = new LinkedHashMap<>();
  public final List<String> uploadedKeys = new ArrayList<>();
  public final List<String> deletedKeys = new ArrayList<>();
  public boolean failUploads;
  public boolean failDeletes;
  public final Set<String> failingDeleteKeys = new HashSet<>();
  private int sequence;

  @Override
  public StoredBlob upload(InputStream content, long contentLength, String contentType) {
    if (failUploads) {
      throw new BlobStoreException("upload refused", new IllegalStateException("store down"));
    }
    String key = "blob-" + (++sequence);
    try {
      objects.put(key, content.readAllBytes());
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    uploadedKeys.add(key);
    return new StoredBlob(key, "https://blobs.test/" + key);
  }

  @Override
  public void delete(String key) {
    if (failDeletes || failingDeleteKeys.contains(key)) {
      throw new BlobStoreException("delete refused", new IllegalStateException("store down"));
    }
    objects.remove(key);
    deletedKeys.add(key);
  }

  public int objectCount() {
    return objects.size();
  }

  public boolean contains(String key) {
    return objects.containsKey(key);
  }
}
