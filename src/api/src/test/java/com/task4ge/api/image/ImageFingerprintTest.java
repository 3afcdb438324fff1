package com.task4ge.api.image;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImageFingerprintTest {

  @Test
  void fingerprintIsBase64Md5() {
    assertThat(ImageFingerprint.of("hello".getBytes(StandardCharsets.UTF_8))).isEqualTo("XUFAKrxLKna5cZ2REBfFkg==");
  }

  @Test
  void distinctDropsEmptyAndKeepsFirstOccurrenceInOrder() {
    ImageUpload b = upload("B", "image/png");
    ImageUpload a = upload("A", "image/jpeg");
    ImageUpload aAgain = upload("A", "image/gif");

    List<FingerprintedImage> distinct = ImageFingerprint.distinct(List.of(
        new ImageUpload(new byte[0], "image/jpeg"), b, a, aAgain));

    assertThat(distinct).extracting(FingerprintedImage::upload).containsExactly(b, a);
    assertThat(distinct.get(1).upload().contentType()).isEqualTo("image/jpeg");
  }

  private static ImageUpload upload(String content, String contentType) {
    return new ImageUpload(content.getBytes(StandardCharsets.UTF_8), contentType);
  }
}
