package ca.gc.cra.textpipe.application.stage;

import ca.gc.cra.textpipe.application.port.Stage;
import ca.gc.cra.textpipe.application.port.StageContext;
import ca.gc.cra.textpipe.domain.sentiment.SentimentLexicon;
import ca.gc.cra.textpipe.domain.sentiment.SentimentScore;
import ca.gc.cra.textpipe.domain.text.AnalyzedText;
import ca.gc.cra.textpipe.domain.text.CleanedText;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Second pipeline stage; scores cleaned text against a fixed sentiment lexicon.
 * <p><strong>Why:</strong> Provides a deterministic, explainable polarity estimate without model dependencies.</p>
 * <p><strong>Role:</strong> Pure {@link Stage} from {@link CleanedText} to {@link AnalyzedText}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Tokenize on word boundaries and count positive and negative markers.</li>
 *   <li>Derive a bounded score, its label, and a confidence from the counts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The lexicon is immutable and loaded before construction.</p>
 * <p><strong>Performance:</strong> One regex scan and O(1) set lookups per token.</p>
 * <p><strong>Observability:</strong> DEBUG line with counts and score.</p>
 *
 * @since 0.1.0
 * @see LexiconLoader
 */
public final class LexiconSentimentStage implements Stage<CleanedText, AnalyzedText> {
  private static final Logger log = LoggerFactory.getLogger(LexiconSentimentStage.class);

  /** Stage label used in logs, metrics, and errors. */
  public static final String NAME = "SentimentAnalyzer";

  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}']+");

  private final SentimentLexicon lexicon;

  /**
   * Creates the stage.
   *
   * @param lexicon marker sets; see {@link LexiconLoader}
   */
  public LexiconSentimentStage(SentimentLexicon lexicon) {
    this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Class<CleanedText> inputType() {
    return CleanedText.class;
  }

  @Override
  public Class<AnalyzedText> outputType() {
    return AnalyzedText.class;
  }

  @Override
  public AnalyzedText process(CleanedText input, StageContext context) {
    SentimentScore score = score(input.content());
    log.debug("Scored {} tokens: positive={}, negative={}, score={}, sentiment={}",
        score.tokenCount(), score.positiveCount(), score.negativeCount(), score.score(), score.sentiment());
    return new AnalyzedText(
        input.content(),
        input.originalContent(),
        input.source(),
        input.traceId(),
        score.sentiment(),
        score.score(),
        score.confidence(),
        context.clock().now(),
        input.metadata());
  }

  /**
   * Counts lexicon markers in the supplied text.
   *
   * @param text cleaned text
   * @return marker and token counts
   */
  public SentimentScore score(String text) {
    int positive = 0;
    int negative = 0;
    int tokens = 0;
    Matcher matcher = TOKEN.matcher(text);
    while (matcher.find()) {
      String token = matcher.group().toLowerCase(Locale.ROOT);
      tokens++;
      if (lexicon.isPositive(token)) {
        positive++;
      } else if (lexicon.isNegative(token)) {
        negative++;
      }
    }
    return new SentimentScore(positive, negative, tokens);
  }
}
