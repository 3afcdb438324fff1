package com.task4ge.api.image;

import java.time.OffsetDateTime;

/**
 * Registry entry mapping a content fingerprint to the stored blob. Shared by every task that
 * submitted the same bytes.
 */
public record ImageRecord(
    String id,
    String hash,
    String storageKey,
    String url,
    OffsetDateTime createdAt,
    OffsetDateTime updatedAt
) {
}
