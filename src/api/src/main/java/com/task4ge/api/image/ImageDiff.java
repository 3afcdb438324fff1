package com.task4ge.api.image;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Difference between a task's stored images and a newly submitted set, computed on fingerprints
 * only. Ids never take part, so resubmitting the same bytes in any order changes nothing.
 */
public final class ImageDiff {

  private final List<FingerprintedImage> submitted;
  private final List<ImageRecord> toDelete;
  private final List<FingerprintedImage> toAdd;
  private final List<ImageRecord> retained;

  private ImageDiff(List<FingerprintedImage> submitted,
                    List<ImageRecord> toDelete,
                    List<FingerprintedImage> toAdd,
                    List<ImageRecord> retained) {
    this.submitted = submitted;
    this.toDelete = toDelete;
    this.toAdd = toAdd;
    this.retained = retained;
  }

  public static ImageDiff compute(List<ImageRecord> previous, List<FingerprintedImage> submitted) {
    Set<String> submittedHashes = new LinkedHashSet<>();
    for (FingerprintedImage f : submitted) {
      submittedHashes.add(f.fingerprint());
    }
    Set<String> previousHashes = new LinkedHashSet<>();
    List<ImageRecord> toDelete = new ArrayList<>();
    List<ImageRecord> retained = new ArrayList<>();
    for (ImageRecord image : previous) {
      if (!previousHashes.add(image.hash())) {
        continue;
      }
      if (submittedHashes.contains(image.hash())) {
        retained.add(image);
      } else {
        toDelete.add(image);
      }
    }
    List<FingerprintedImage> toAdd = submitted.stream()
        .filter(f -> !previousHashes.contains(f.fingerprint()))
        .toList();
    return new ImageDiff(List.copyOf(submitted), List.copyOf(toDelete), toAdd, List.copyOf(retained));
  }

  public List<ImageRecord> toDelete() {
    return toDelete;
  }

  public List<FingerprintedImage> toAdd() {
    return toAdd;
  }

  public List<ImageRecord> retained() {
    return retained;
  }

  /**
   * Final image set of the task: retained plus the records resolved for {@link #toAdd()}, in
   * submission order.
   */
  public List<ImageRecord> merge(List<ImageRecord> added) {
    Map<String, ImageRecord> byHash = new LinkedHashMap<>();
    retained.forEach(image -> byHash.putIfAbsent(image.hash(), image));
    added.forEach(image -> byHash.putIfAbsent(image.hash(), image));
    return submitted.stream()
        .map(f -> byHash.get(f.fingerprint()))
        .filter(Objects::nonNull)
        .toList();
  }
}
