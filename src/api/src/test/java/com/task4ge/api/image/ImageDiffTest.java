package com.task4ge.api.image;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ImageDiffTest {

  private static final List<String> UNIVERSE = List.of("a", "b", "c", "d");
  private static final OffsetDateTime T = OffsetDateTime.of(2026, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

  @Test
  void partitionsEverySubsetPair() {
    for (List<String> previous : subsets()) {
      for (List<String> submitted : subsets()) {
        ImageDiff diff = ImageDiff.compute(records(previous), fingerprints(submitted));

        assertThat(hashesOf(diff.toDelete())).isEqualTo(minus(previous, submitted));
        assertThat(diff.toAdd()).extracting(FingerprintedImage::fingerprint)
            .containsExactlyInAnyOrderElementsOf(minus(submitted, previous));
        assertThat(hashesOf(diff.retained())).isEqualTo(intersect(previous, submitted));
      }
    }
  }

  @Test
  void resubmittingSameSetInOtherOrderIsNoOp() {
    ImageDiff diff = ImageDiff.compute(records(List.of("a", "b")), fingerprints(List.of("b", "a")));

    assertThat(diff.toAdd()).isEmpty();
    assertThat(diff.toDelete()).isEmpty();
    assertThat(diff.merge(List.of())).extracting(ImageRecord::hash).containsExactly("b", "a");
  }

  @Test
  void mergeFollowsSubmissionOrder() {
    ImageDiff diff = ImageDiff.compute(records(List.of("a", "b")), fingerprints(List.of("c", "a")));
    List<ImageRecord> added = records(List.of("c"));

    assertThat(diff.merge(added)).extracting(ImageRecord::hash).containsExactly("c", "a");
    assertThat(hashesOf(diff.toDelete())).containsExactly("b");
  }

  @Test
  void emptySubmissionDeletesEverything() {
    ImageDiff diff = ImageDiff.compute(records(List.of("a", "b")), List.of());

    assertThat(hashesOf(diff.toDelete())).containsExactlyInAnyOrder("a", "b");
    assertThat(diff.merge(List.of())).isEmpty();
  }

  private static List<List<String>> subsets() {
    List<List<String>> out = new ArrayList<>();
    for (int mask = 0; mask < 1 << UNIVERSE.size(); mask++) {
      List<String> subset = new ArrayList<>();
      for (int i = 0; i < UNIVERSE.size(); i++) {
        if ((mask & (1 << i)) != 0) {
          subset.add(UNIVERSE.get(i));
        }
      }
      out.add(subset);
    }
    return out;
  }

  private static List<ImageRecord> records(List<String> hashes) {
    return hashes.stream()
        .map(h -> new ImageRecord("id-" + h, h, "key-" + h, "https://blobs.test/key-" + h, T, T))
        .toList();
  }

  private static List<FingerprintedImage> fingerprints(List<String> hashes) {
    return hashes.stream()
        .map(h -> new FingerprintedImage(h, new ImageUpload(h.getBytes(), "image/jpeg")))
        .toList();
  }

  private static Set<String> hashesOf(List<ImageRecord> records) {
    Set<String> out = new HashSet<>();
    records.forEach(r -> out.add(r.hash()));
    return out;
  }

  private static Set<String> minus(List<String> left, List<String> right) {
    Set<String> out = new HashSet<>(left);
    right.forEach(out::remove);
    return out;
  }

  private static Set<String> intersect(List<String> left, List<String> right) {
    Set<String> out = new HashSet<>(left);
    out.retainAll(right);
    return out;
  }
}
