package ca.gc.cra.textpipe.domain.sentiment;

import ca.gc.cra.textpipe.domain.text.Sentiment;

/**
 * Result of counting lexicon markers in one text.
 *
 * <p>The score is {@code (P - N) / max(1, P + N)}, which stays within {@code [-1.0, 1.0]} for any counts.</p>
 *
 * @param positiveCount occurrences of positive markers (P)
 * @param negativeCount occurrences of negative markers (N)
 * @param tokenCount number of tokens inspected
 * @since 0.1.0
 */
public record SentimentScore(int positiveCount, int negativeCount, int tokenCount) {
  private static final double FULL_CONFIDENCE_MARKERS = 5.0;
  private static final double NO_EVIDENCE_CONFIDENCE = 0.5;

  public SentimentScore {
    if (positiveCount < 0 || negativeCount < 0 || tokenCount < 0) {
      throw new IllegalArgumentException("counts must not be negative");
    }
  }

  /**
   * Returns the bounded score.
   *
   * @return {@code 0.0} without evidence, otherwise the marker balance in {@code [-1.0, 1.0]}
   */
  public double score() {
    int total = positiveCount + negativeCount;
    return (double) (positiveCount - negativeCount) / Math.max(1, total);
  }

  /**
   * Returns how much evidence backs the score.
   *
   * <p>Empty text is certainly neutral (1.0); text without markers gets 0.5; otherwise confidence grows with the
   * number of markers and saturates at five.</p>
   *
   * @return confidence in {@code [0.0, 1.0]}
   */
  public double confidence() {
    if (tokenCount == 0) {
      return 1.0;
    }
    int total = positiveCount + negativeCount;
    if (total == 0) {
      return NO_EVIDENCE_CONFIDENCE;
    }
    return Math.min(1.0, total / FULL_CONFIDENCE_MARKERS);
  }

  /**
   * Classifies {@link #score()} with the fixed thresholds.
   *
   * @return sentiment class
   */
  public Sentiment sentiment() {
    return Sentiment.fromScore(score());
  }
}
