package com.task4ge.api.image;

public record FingerprintedImage(String fingerprint, ImageUpload upload) {
}
