package ca.gc.cra.textpipe.domain.text;

/**
 * <strong>What:</strong> Sentiment class assigned to analyzed text.
 * <p><strong>Why:</strong> Gives sinks and callers a coarse label that is a pure function of the numeric score.</p>
 * <p><strong>Role:</strong> Domain enumeration produced by the sentiment stage and persisted by the storage stage.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 * <p><strong>Performance:</strong> Constant-time classification.</p>
 * <p><strong>Observability:</strong> Label values appear in logs and the {@code sentiment} store column.</p>
 *
 * @since 0.1.0
 */
public enum Sentiment {
  /** Score strictly above {@link #POSITIVE_THRESHOLD}. */
  POSITIVE,
  /** Score within the closed band {@code [-0.1, 0.1]}. */
  NEUTRAL,
  /** Score strictly below {@link #NEGATIVE_THRESHOLD}. */
  NEGATIVE;

  /** Scores above this value classify as {@link #POSITIVE}. */
  public static final double POSITIVE_THRESHOLD = 0.1;
  /** Scores below this value classify as {@link #NEGATIVE}. */
  public static final double NEGATIVE_THRESHOLD = -0.1;

  /**
   * Classifies a sentiment score using the fixed thresholds.
   *
   * @param score sentiment score in {@code [-1.0, 1.0]}
   * @return classification for the score
   * @throws IllegalArgumentException if {@code score} is NaN
   */
  public static Sentiment fromScore(double score) {
    if (Double.isNaN(score)) {
      throw new IllegalArgumentException("score must not be NaN");
    }
    if (score > POSITIVE_THRESHOLD) {
      return POSITIVE;
    }
    if (score < NEGATIVE_THRESHOLD) {
      return NEGATIVE;
    }
    return NEUTRAL;
  }
}
