package com.task4ge.api.image;

import com.task4ge.api.audit.AuditActor;
import com.task4ge.api.audit.AuditLogger;
import com.task4ge.api.audit.LogType;
import com.task4ge.api.infra.s3.BlobStore;
import com.task4ge.api.infra.s3.BlobStoreException;
import com.task4ge.api.infra.tx.UnitOfWork;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Deduplicating front of the blob store: bytes already registered under the same fingerprint are
 * reused, only new fingerprints are uploaded.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImageRegistry {

  public static final String MODEL = "Image";

  private final ImageRepository images;
  private final BlobStore blobStore;
  private final AuditLogger audit;
  private final Clock clock;

  /**
   * Uploads the fingerprints the registry does not know yet and queues their records and Insert
   * logs on {@code uow}. Blobs are uploaded immediately; an upload failure aborts the resolution.
   */
  public ResolvedImages resolve(List<FingerprintedImage> submitted, AuditActor actor, UnitOfWork uow) {
    if (submitted.isEmpty()) {
      return new ResolvedImages(List.of(), List.of());
    }

    Map<String, ImageRecord> known = new HashMap<>();
    for (ImageRecord existing : images.findByHashes(submitted.stream().map(FingerprintedImage::fingerprint).toList())) {
      known.putIfAbsent(existing.hash(), existing);
    }

    List<ImageRecord> resolved = new ArrayList<>();
    List<ImageRecord> created = new ArrayList<>();
    for (FingerprintedImage image : submitted) {
      ImageRecord record = known.get(image.fingerprint());
      if (record == null) {
        record = upload(image, created);
        known.put(record.hash(), record);
        created.add(record);
        ImageRecord inserted = record;
        uow.add(() -> images.insert(inserted));
        audit.record(uow, actor, LogType.INSERT, MODEL, null, inserted);
      }
      resolved.add(record);
    }
    return new ResolvedImages(resolved, created);
  }

  /**
   * Queues removal of the registry record and its Delete log. The blob is removed separately by
   * {@link #deleteBlobs(List)} once the unit of work has committed.
   */
  public void delete(ImageRecord image, AuditActor actor, UnitOfWork uow) {
    uow.add(() -> images.delete(image.id()));
    audit.record(uow, actor, LogType.DELETE, MODEL, image, null);
  }

  /**
   * Removes the blobs of already deleted records. Every key is attempted; failures are logged one by
   * one and reported together afterwards.
   */
  public void deleteBlobs(List<ImageRecord> removed) {
    List<String> orphaned = new ArrayList<>();
    BlobStoreException first = null;
    for (ImageRecord image : removed) {
      try {
        blobStore.delete(image.storageKey());
      } catch (BlobStoreException e) {
        log.error("Blob {} of deleted image {} could not be removed and is now orphaned", image.storageKey(), image.id(), e);
        orphaned.add(image.storageKey());
        if (first == null) {
          first = e;
        } else {
          first.addSuppressed(e);
        }
      }
    }
    if (first != null) {
      throw new BlobStoreException("Failed to delete blobs " + orphaned, first);
    }
  }

  private ImageRecord upload(FingerprintedImage image, List<ImageRecord> uploadedSoFar) {
    byte[] content = image.upload().content();
    BlobStore.StoredBlob blob;
    try {
      blob = blobStore.upload(new ByteArrayInputStream(content), content.length, image.upload().contentType());
    } catch (BlobStoreException e) {
      if (!uploadedSoFar.isEmpty()) {
        log.error("Image upload failed; blobs {} uploaded earlier in this request are orphaned",
            uploadedSoFar.stream().map(ImageRecord::storageKey).toList());
      }
      throw e;
    }
    OffsetDateTime now = OffsetDateTime.now(clock);
    return new ImageRecord(UUID.randomUUID().toString(), image.fingerprint(), blob.key(), blob.url(), now, now);
  }
}
