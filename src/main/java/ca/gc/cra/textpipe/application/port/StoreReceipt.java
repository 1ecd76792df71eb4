package ca.gc.cra.textpipe.application.port;

import java.time.Instant;
import java.util.Objects;

/**
 * Identifier and timestamp a store assigned to one written record.
 *
 * @param storageId non-blank identifier the record is retrievable under
 * @param storedAt timestamp persisted with the record
 * @since 0.1.0
 */
public record StoreReceipt(String storageId, Instant storedAt) {
  /** Validates the receipt. */
  public StoreReceipt {
    Objects.requireNonNull(storageId, "storageId");
    if (storageId.isBlank()) {
      throw new IllegalArgumentException("storageId must not be blank");
    }
    Objects.requireNonNull(storedAt, "storedAt");
  }
}
