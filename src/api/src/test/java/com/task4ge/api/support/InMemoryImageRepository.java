package com.task4ge.api.support;

import com.task4ge.api.image.ImageRecord;
import com.task4ge.api.image.ImageRepository;
import org.springframework.dao.DuplicateKeyException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InMemoryImageRepository implements ImageRepository {

  private final Map<String, ImageRecord> rows = new LinkedHashMap<>();
  public int writes;

  @Override
  public void insert(ImageRecord image) {
    writes++;
    boolean hashTaken = rows.values().stream().anyMatch(r -> r.hash().equals(image.hash()));
    if (hashTaken) {
      throw new DuplicateKeyException("uk_image_hash " + image.hash());
    }
    rows.put(image.id(), image);
  }

  @Override
  public void delete(String id) {
    writes++;
    rows.remove(id);
  }

  @Override
  public List<ImageRecord> findByIds(Collection<String> ids) {
    List<ImageRecord> out = new ArrayList<>();
    for (ImageRecord r : rows.values()) {
      if (ids.contains(r.id())) {
        out.add(r);
      }
    }
    return out;
  }

  @Override
  public List<ImageRecord> findByHashes(Collection<String> hashes) {
    List<ImageRecord> out = new ArrayList<>();
    for (ImageRecord r : rows.values()) {
      if (hashes.contains(r.hash())) {
        out.add(r);
      }
    }
    return out;
  }

  public List<ImageRecord> all() {
    return new ArrayList<>(rows.values());
  }
}
