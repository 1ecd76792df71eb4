package ca.gc.cra.textpipe.domain.text;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Cleaned text annotated with a sentiment score and class.
 * <p><strong>Why:</strong> Couples the score with its derived label so sinks never persist an inconsistent pair.</p>
 * <p><strong>Role:</strong> Domain record produced by the sentiment stage and consumed by the storage stage.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 * <p><strong>Performance:</strong> Constant-time validation plus one metadata copy.</p>
 * <p><strong>Observability:</strong> Score and label are logged at INFO by the sentiment stage.</p>
 *
 * @param content cleaned text that was scored
 * @param originalContent payload exactly as submitted
 * @param source origin label
 * @param traceId correlation token
 * @param sentiment class derived from {@code sentimentScore} via {@link Sentiment#fromScore(double)}
 * @param sentimentScore score in {@code [-1.0, 1.0]}
 * @param confidence evidence weight in {@code [0.0, 1.0]}
 * @param analyzedAt instant the sentiment stage produced this record
 * @param metadata attributes copied from earlier stages
 * @throws IllegalArgumentException if the score or confidence is out of range, or the label disagrees with the score
 * @since 0.1.0
 */
public record AnalyzedText(
    String content,
    String originalContent,
    String source,
    String traceId,
    Sentiment sentiment,
    double sentimentScore,
    double confidence,
    Instant analyzedAt,
    Map<String, String> metadata) {

  public AnalyzedText {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(originalContent, "originalContent");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(traceId, "traceId");
    Objects.requireNonNull(sentiment, "sentiment");
    Objects.requireNonNull(analyzedAt, "analyzedAt");
    if (!(sentimentScore >= -1.0 && sentimentScore <= 1.0)) {
      throw new IllegalArgumentException("sentimentScore must be within [-1.0, 1.0] (was " + sentimentScore + ")");
    }
    if (!(confidence >= 0.0 && confidence <= 1.0)) {
      throw new IllegalArgumentException("confidence must be within [0.0, 1.0] (was " + confidence + ")");
    }
    if (sentiment != Sentiment.fromScore(sentimentScore)) {
      throw new IllegalArgumentException(
          "sentiment " + sentiment + " does not match score " + sentimentScore);
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
