package ca.gc.cra.textpipe.domain.text;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Unvalidated text submitted to the pipeline.
 * <p><strong>Why:</strong> Captures the caller's payload, its origin label, and the trace identifier that
 * correlates every log line, metric, and error raised while the submission is processed.</p>
 * <p><strong>Role:</strong> Domain input record consumed by the cleaning stage.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; metadata is copied on construction.</p>
 * <p><strong>Performance:</strong> One map copy per instance.</p>
 * <p><strong>Observability:</strong> {@link #traceId()} is placed in the logging MDC for the whole run.</p>
 *
 * @param content raw text; may be empty or contain markup, {@code null} is rejected by the cleaning stage
 * @param source origin label (e.g., {@code review}); blank values become {@link #UNSPECIFIED_SOURCE}
 * @param receivedAt instant the caller received the text; {@code null} defaults to now
 * @param traceId correlation token; blank values are replaced by a random UUID
 * @param metadata free-form attributes carried through to storage; {@code null} becomes empty
 * @since 0.1.0
 */
public record RawText(
    String content,
    String source,
    Instant receivedAt,
    String traceId,
    Map<String, String> metadata) {

  /** Source label used when the caller does not supply one. */
  public static final String UNSPECIFIED_SOURCE = "unspecified";

  public RawText {
    source = (source == null || source.isBlank()) ? UNSPECIFIED_SOURCE : source.trim();
    receivedAt = Objects.requireNonNullElseGet(receivedAt, Instant::now);
    traceId = (traceId == null || traceId.isBlank()) ? newTraceId() : traceId.trim();
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Creates raw text received now with a fresh trace identifier and no metadata.
   *
   * @param content raw text
   * @param source origin label
   * @return new raw text record
   */
  public static RawText of(String content, String source) {
    return new RawText(content, source, Instant.now(), null, Map.of());
  }

  /**
   * Returns a copy of this record tagged with the supplied trace identifier.
   *
   * @param traceId caller-supplied correlation token
   * @return new record with the same payload
   */
  public RawText withTraceId(String traceId) {
    return new RawText(content, source, receivedAt, traceId, metadata);
  }

  private static String newTraceId() {
    return UUID.randomUUID().toString();
  }
}
