package ca.gc.cra.textpipe.domain.sentiment;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Two disjoint sets of case-insensitive marker words used for lexicon scoring.
 * <p><strong>Why:</strong> Keeps the word lists a replaceable configuration detail while the scoring formula stays fixed.</p>
 * <p><strong>Role:</strong> Domain value loaded once per sentiment stage and shared read-only across submissions.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent lookups.</p>
 * <p><strong>Performance:</strong> Hash-set membership checks.</p>
 * <p><strong>Observability:</strong> Set sizes are logged when a lexicon is loaded.</p>
 *
 * @param positive lower-cased positive markers
 * @param negative lower-cased negative markers
 * @since 0.1.0
 */
public record SentimentLexicon(Set<String> positive, Set<String> negative) {

  /**
   * Normalizes the word sets and enforces disjointness.
   *
   * @throws IllegalArgumentException if either set is empty, contains blank words, or the sets overlap
   */
  public SentimentLexicon {
    positive = normalize("positive", positive);
    negative = normalize("negative", negative);
    Set<String> overlap = new TreeSet<>(positive);
    overlap.retainAll(negative);
    if (!overlap.isEmpty()) {
      throw new IllegalArgumentException("lexicon marker sets overlap: " + overlap);
    }
  }

  /**
   * Tests whether a token is a positive marker.
   *
   * @param token lower-cased token
   * @return {@code true} when the token is listed as positive
   */
  public boolean isPositive(String token) {
    return positive.contains(token);
  }

  /**
   * Tests whether a token is a negative marker.
   *
   * @param token lower-cased token
   * @return {@code true} when the token is listed as negative
   */
  public boolean isNegative(String token) {
    return negative.contains(token);
  }

  private static Set<String> normalize(String name, Set<String> words) {
    Objects.requireNonNull(words, name);
    if (words.isEmpty()) {
      throw new IllegalArgumentException(name + " markers must not be empty");
    }
    Set<String> normalized = new LinkedHashSet<>();
    for (String word : words) {
      if (word == null || word.isBlank()) {
        throw new IllegalArgumentException(name + " markers must not contain blank words");
      }
      normalized.add(word.trim().toLowerCase(Locale.ROOT));
    }
    return Set.copyOf(normalized);
  }
}
