package com.task4ge.api.image;

import java.util.Collection;
import java.util.List;

public interface ImageRepository {

  void insert(ImageRecord image);

  void delete(String id);

  List<ImageRecord> findByIds(Collection<String> ids);

  List<ImageRecord> findByHashes(Collection<String> hashes);
}
