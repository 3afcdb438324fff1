package com.task4ge.api.image;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Content fingerprints used as the dedup key of the image registry.
 *
 * <p>MD5 is used for speed, not for collision resistance.
 */
public final class ImageFingerprint {

  private ImageFingerprint() {
  }

  public static String of(byte[] content) {
    try {
      MessageDigest md5 = MessageDigest.getInstance("MD5");
      return Base64.getEncoder().encodeToString(md5.digest(content));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("MD5 not available", e);
    }
  }

  /**
   * Drops empty attachments and collapses attachments with identical bytes, keeping the first
   * occurrence and the submission order.
   */
  public static List<FingerprintedImage> distinct(List<ImageUpload> uploads) {
    Map<String, FingerprintedImage> byFingerprint = new LinkedHashMap<>();
    for (ImageUpload upload : uploads) {
      if (upload.isEmpty()) {
        continue;
      }
      String fingerprint = of(upload.content());
      byFingerprint.putIfAbsent(fingerprint, new FingerprintedImage(fingerprint, upload));
    }
    return new ArrayList<>(byFingerprint.values());
  }
}
