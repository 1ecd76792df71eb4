package ca.gc.cra.textpipe.domain.text;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Text produced by the cleaning stage.
 *
 * <p>{@code content} carries no leading or trailing whitespace, no HTML tags, no zero-width characters, and is
 * NFKC-normalized. The original payload, source, trace identifier, and metadata travel unchanged.</p>
 *
 * @param content normalized text; empty when the input had no visible content
 * @param originalContent payload exactly as submitted
 * @param source origin label copied from {@link RawText#source()}
 * @param traceId correlation token copied from {@link RawText#traceId()}
 * @param cleanedAt instant the cleaning stage produced this record
 * @param operations names of the cleaning steps applied, in order
 * @param metadata attributes copied from the raw record
 * @since 0.1.0
 */
public record CleanedText(
    String content,
    String originalContent,
    String source,
    String traceId,
    Instant cleanedAt,
    List<String> operations,
    Map<String, String> metadata) {

  public CleanedText {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(originalContent, "originalContent");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(traceId, "traceId");
    Objects.requireNonNull(cleanedAt, "cleanedAt");
    operations = operations == null ? List.of() : List.copyOf(operations);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
