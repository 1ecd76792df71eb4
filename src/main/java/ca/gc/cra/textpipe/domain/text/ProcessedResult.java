package ca.gc.cra.textpipe.domain.text;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Analyzed text that has been durably stored.
 *
 * @param content cleaned text
 * @param originalContent payload exactly as submitted
 * @param source origin label
 * @param traceId correlation token
 * @param sentiment sentiment class
 * @param sentimentScore score in {@code [-1.0, 1.0]}
 * @param confidence evidence weight in {@code [0.0, 1.0]}
 * @param metadata attributes carried from the raw record
 * @param storageId opaque identifier assigned by the store; retrieves the record later
 * @param storedAt commit instant
 * @since 0.1.0
 */
public record ProcessedResult(
    String content,
    String originalContent,
    String source,
    String traceId,
    Sentiment sentiment,
    double sentimentScore,
    double confidence,
    Map<String, String> metadata,
    String storageId,
    Instant storedAt) {

  public ProcessedResult {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(originalContent, "originalContent");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(traceId, "traceId");
    Objects.requireNonNull(sentiment, "sentiment");
    Objects.requireNonNull(storedAt, "storedAt");
    if (storageId == null || storageId.isBlank()) {
      throw new IllegalArgumentException("storageId must not be blank");
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Builds the stored form of an analyzed record.
   *
   * @param analyzed record that was written
   * @param storageId identifier assigned by the store
   * @param storedAt commit instant
   * @return processed result carrying every analyzed field
   */
  public static ProcessedResult from(AnalyzedText analyzed, String storageId, Instant storedAt) {
    Objects.requireNonNull(analyzed, "analyzed");
    return new ProcessedResult(
        analyzed.content(),
        analyzed.originalContent(),
        analyzed.source(),
        analyzed.traceId(),
        analyzed.sentiment(),
        analyzed.sentimentScore(),
        analyzed.confidence(),
        analyzed.metadata(),
        storageId,
        storedAt);
  }
}
