package ca.gc.cra.textpipe.application.stage;

import ca.gc.cra.textpipe.application.error.CleaningException;
import ca.gc.cra.textpipe.application.port.Stage;
import ca.gc.cra.textpipe.application.port.StageContext;
import ca.gc.cra.textpipe.domain.text.CleanedText;
import ca.gc.cra.textpipe.domain.text.RawText;
import ca.gc.cra.textpipe.logging.Logs;
import java.text.Normalizer;
import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> First pipeline stage; normalizes raw text into {@link CleanedText}.
 * <p><strong>Why:</strong> Sentiment scoring and storage expect markup-free, single-spaced, canonically composed
 * text.</p>
 * <p><strong>Role:</strong> Pure {@link Stage} from {@link RawText} to {@link CleanedText}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply, in order: tag stripping, whitespace collapse, trim, NFKC normalization, zero-width removal.</li>
 *   <li>Repeat that pass until the text is stable so cleaning twice equals cleaning once.</li>
 *   <li>Reject absent content and markup that cannot be stripped safely.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; compiled patterns are shared.</p>
 * <p><strong>Performance:</strong> Linear in input length per pass; ordinary inputs stabilize within two or three passes,
 * deeply nested markup needs one pass per level.</p>
 * <p><strong>Observability:</strong> DEBUG line per cleaned record with a bounded preview.</p>
 *
 * @since 0.1.0
 */
public final class TextCleaningStage implements Stage<RawText, CleanedText> {
  private static final Logger log = LoggerFactory.getLogger(TextCleaningStage.class);

  /** Stage label used in logs, metrics, and errors. */
  public static final String NAME = "TextCleaner";

  static final List<String> OPERATIONS = List.of(
      "html_stripping", "whitespace_collapse", "trim", "unicode_normalization", "zero_width_removal");

  private static final Pattern TAG = Pattern.compile("<[A-Za-z/!?][^<>]*>");
  private static final Pattern TAG_OPENER = Pattern.compile("<[A-Za-z/!?]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern ZERO_WIDTH = Pattern.compile("[\\u200B\\u200C\\u200D\\u2060\\uFEFF]");

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Class<RawText> inputType() {
    return RawText.class;
  }

  @Override
  public Class<CleanedText> outputType() {
    return CleanedText.class;
  }

  @Override
  public CleanedText process(RawText input, StageContext context) throws CleaningException {
    String original = input.content();
    if (original == null) {
      throw new CleaningException(NAME, context.traceId(), "content must not be null", null);
    }

    String cleaned = clean(original, context.traceId());
    if (TAG_OPENER.matcher(cleaned).find()) {
      throw new CleaningException(NAME, context.traceId(), "unterminated markup remains after stripping", original);
    }

    if (log.isDebugEnabled()) {
      log.debug("Cleaned {} chars to {} chars: \"{}\"", original.length(), cleaned.length(), Logs.preview(cleaned));
    }
    return new CleanedText(
        cleaned,
        original,
        input.source(),
        input.traceId(),
        context.clock().now(),
        OPERATIONS,
        input.metadata());
  }

  private static String clean(String text, String traceId) throws CleaningException {
    // Every pass that strips a tag shortens the text, so input length bounds the nesting depth.
    int maxPasses = text.length() + 2;
    String current = text;
    for (int pass = 0; pass < maxPasses; pass++) {
      String next = singlePass(current);
      if (next.equals(current)) {
        return next;
      }
      current = next;
    }
    throw new CleaningException(NAME, traceId, "text did not reach a stable form after " + maxPasses + " passes",
        text);
  }

  private static String singlePass(String text) {
    String stripped = TAG.matcher(text).replaceAll("");
    String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ");
    String trimmed = trimSpaces(collapsed);
    String normalized = Normalizer.normalize(trimmed, Normalizer.Form.NFKC);
    return ZERO_WIDTH.matcher(normalized).replaceAll("");
  }

  private static String trimSpaces(String text) {
    int start = 0;
    int end = text.length();
    while (start < end && text.charAt(start) == ' ') {
      start++;
    }
    while (end > start && text.charAt(end - 1) == ' ') {
      end--;
    }
    return text.substring(start, end);
  }
}
