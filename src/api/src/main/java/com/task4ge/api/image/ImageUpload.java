package com.task4ge.api.image;

import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * One attachment of an inbound request, fully buffered.
 */
public record ImageUpload(byte[] content, String contentType) {

  public boolean isEmpty() {
    return content == null || content.length == 0;
  }

  public static List<ImageUpload> fromFiles(List<MultipartFile> files) {
    List<ImageUpload> uploads = new ArrayList<>();
    if (files == null) {
      return uploads;
    }
    for (MultipartFile file : files) {
      if (file == null || file.isEmpty()) {
        continue;
      }
      try {
        uploads.add(new ImageUpload(file.getBytes(), file.getContentType()));
      } catch (IOException e) {
        throw new UncheckedIOException("Could not read uploaded file " + file.getOriginalFilename(), e);
      }
    }
    return uploads;
  }
}
