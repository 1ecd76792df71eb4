package ca.gc.cra.textpipe.application.stage;

import ca.gc.cra.textpipe.application.error.AnalysisException;
import ca.gc.cra.textpipe.domain.sentiment.SentimentLexicon;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a {@link SentimentLexicon} from a YAML document of the form
 *
 * <pre>
 * positive: [good, great]
 * negative: [bad, awful]
 * </pre>
 *
 * <p>Read failures are retryable {@link AnalysisException}s; malformed documents and overlapping lists are not.
 * Errors raised here are reported under the {@value #LOAD_TRACE_ID} trace id because no submission exists yet.</p>
 *
 * @since 0.1.0
 */
public final class LexiconLoader {
  private static final Logger log = LoggerFactory.getLogger(LexiconLoader.class);

  /** Classpath location of the bundled lexicon. */
  public static final String DEFAULT_RESOURCE = "/lexicon/default-lexicon.yml";

  /** Trace id attached to load failures. */
  public static final String LOAD_TRACE_ID = "lexicon-load";

  private LexiconLoader() {}

  /**
   * Loads the bundled lexicon.
   *
   * @return default lexicon
   * @throws AnalysisException if the resource is missing or malformed
   */
  public static SentimentLexicon loadDefault() throws AnalysisException {
    InputStream in = LexiconLoader.class.getResourceAsStream(DEFAULT_RESOURCE);
    if (in == null) {
      throw failure("lexicon resource not found on classpath: " + DEFAULT_RESOURCE, null, false);
    }
    return read(in, "classpath:" + DEFAULT_RESOURCE);
  }

  /**
   * Loads a lexicon from a file.
   *
   * @param file YAML document
   * @return lexicon parsed from the file
   * @throws AnalysisException retryable when the file cannot be read, non-retryable when its content is invalid
   */
  public static SentimentLexicon load(Path file) throws AnalysisException {
    Objects.requireNonNull(file, "file");
    InputStream in;
    try {
      in = Files.newInputStream(file);
    } catch (IOException ex) {
      throw failure("unable to read lexicon " + file + ": " + ex.getMessage(), ex, true);
    }
    return read(in, file.toString());
  }

  static SentimentLexicon read(InputStream in, String origin) throws AnalysisException {
    Object document;
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (IOException ex) {
      throw failure("unable to read lexicon " + origin + ": " + ex.getMessage(), ex, true);
    } catch (YAMLException ex) {
      throw failure("lexicon " + origin + " is not valid YAML", ex, false);
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw failure("lexicon " + origin + " must be a mapping with 'positive' and 'negative' lists", null, false);
    }
    try {
      SentimentLexicon lexicon = new SentimentLexicon(
          words(root, "positive", origin), words(root, "negative", origin));
      log.debug("Loaded lexicon from {} ({} positive, {} negative markers)",
          origin, lexicon.positive().size(), lexicon.negative().size());
      return lexicon;
    } catch (IllegalArgumentException ex) {
      throw failure("lexicon " + origin + " is invalid: " + ex.getMessage(), ex, false);
    }
  }

  private static Set<String> words(Map<?, ?> root, String key, String origin) {
    Object node = root.get(key);
    if (!(node instanceof Iterable<?> list)) {
      throw new IllegalArgumentException("'" + key + "' must be a list in " + origin);
    }
    Set<String> words = new LinkedHashSet<>();
    for (Object item : list) {
      if (item == null) {
        throw new IllegalArgumentException("'" + key + "' contains an empty entry");
      }
      words.add(item.toString());
    }
    return words;
  }

  private static AnalysisException failure(String message, Throwable cause, boolean retryable) {
    return new AnalysisException(LexiconSentimentStage.NAME, LOAD_TRACE_ID, message, cause, retryable);
  }
}
