package ca.gc.cra.textpipe.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.textpipe.application.error.CleaningException;
import ca.gc.cra.textpipe.application.error.PipelineConfigurationException;
import ca.gc.cra.textpipe.application.error.StorageException;
import ca.gc.cra.textpipe.application.error.StorageFailureKind;
import ca.gc.cra.textpipe.application.port.Stage;
import ca.gc.cra.textpipe.application.port.StageContext;
import ca.gc.cra.textpipe.application.stage.LexiconSentimentStage;
import ca.gc.cra.textpipe.application.stage.TextCleaningStage;
import ca.gc.cra.textpipe.application.stage.TransactionalStorageStage;
import ca.gc.cra.textpipe.domain.sentiment.SentimentLexicon;
import ca.gc.cra.textpipe.domain.text.AnalyzedText;
import ca.gc.cra.textpipe.domain.text.CleanedText;
import ca.gc.cra.textpipe.domain.text.ProcessedResult;
import ca.gc.cra.textpipe.domain.text.RawText;
import ca.gc.cra.textpipe.domain.text.Sentiment;
import ca.gc.cra.textpipe.infrastructure.persistence.memory.InMemoryStoreConnector;
import ca.gc.cra.textpipe.testutil.ManualClock;
import ca.gc.cra.textpipe.testutil.RecordingMetricsPort;
import ca.gc.cra.textpipe.testutil.TextFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class TextPipelineTest {
  private final ManualClock clock = new ManualClock(TextFixtures.EPOCH);
  private final InMemoryStoreConnector store = new InMemoryStoreConnector(clock);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(TextPipeline.class);
    appender = new ListAppender<>() {
      @Override
      protected void append(ILoggingEvent event) {
        event.prepareForDeferredProcessing();
        super.append(event);
      }
    };
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
  }

  @Test
  void submissionRunsAllStagesAndStoresResult() throws Exception {
    TextPipeline pipeline = TextFixtures.pipeline(store, metrics, clock);
    RawText raw = new RawText("  <b>I love it</b>,\n\tgreat  ", "web", TextFixtures.EPOCH, "trace-ok",
        Map.of("lang", "en"));

    ProcessedResult result = pipeline.process(raw);

    assertEquals("I love it, great", result.content());
    assertEquals("  <b>I love it</b>,\n\tgreat  ", result.originalContent());
    assertEquals(Sentiment.POSITIVE, result.sentiment());
    assertEquals(1.0, result.sentimentScore(), 1e-9);
    assertEquals("trace-ok", result.traceId());
    assertEquals(Map.of("lang", "en"), result.metadata());
    assertEquals(result.content(), store.findById(result.storageId()).orElseThrow().content());
    assertEquals(List.of("TextCleaner", "SentimentAnalyzer", "DatabaseStorer"), pipeline.stageNames());

    assertEquals(1, metrics.count("pipeline.submission.started"));
    assertEquals(1, metrics.count("pipeline.submission.completed"));
    assertEquals(1, metrics.observed("pipeline.stage.TextCleaner.latencyNanos").size());
    assertEquals(1, metrics.observed("pipeline.stage.DatabaseStorer.latencyNanos").size());
  }

  @Test
  void neutralAndEmptyTextsAreStored() throws Exception {
    TextPipeline pipeline = TextFixtures.pipeline(store, metrics, clock);

    ProcessedResult plain = pipeline.process(RawText.of("The meeting is on Monday", "web"));
    ProcessedResult empty = pipeline.process(RawText.of("   <br/>  ", "web"));

    assertEquals(Sentiment.NEUTRAL, plain.sentiment());
    assertEquals(0.5, plain.confidence(), 1e-9);
    assertEquals("", empty.content());
    assertEquals(Sentiment.NEUTRAL, empty.sentiment());
    assertEquals(2, store.findBySource("web").size());
  }

  @Test
  void firstFailureStopsLaterStages() {
    TextPipeline pipeline = TextFixtures.pipeline(store, metrics, clock);

    CleaningException ex = assertThrows(CleaningException.class,
        () -> pipeline.process(RawText.of("broken <b markup", "web")));

    assertEquals(TextCleaningStage.NAME, ex.stageName());
    assertEquals(0, store.size());
    assertEquals(0, store.commitCount());
    assertEquals(1, metrics.count("pipeline.stage.TextCleaner.failed"));
    assertEquals(1, metrics.count("pipeline.submission.failed"));
    assertFalse(metrics.hasCounter("pipeline.submission.completed"));
    assertTrue(metrics.observed("pipeline.stage.SentimentAnalyzer.latencyNanos").isEmpty());
    assertTrue(metrics.observed("pipeline.stage.DatabaseStorer.latencyNanos").isEmpty());
  }

  @Test
  void storageFailureIsReportedAsOutcome() {
    store.failNextCommits(StorageFailureKind.TRANSIENT, 1);
    TextPipeline pipeline = TextFixtures.pipeline(store, metrics, clock);

    SubmissionOutcome outcome = pipeline.submit(RawText.of("good", "web"));

    assertFalse(outcome.succeeded());
    StorageException error = assertInstanceOf(StorageException.class, ((SubmissionOutcome.Failed) outcome).error());
    assertTrue(error.retryable());
    assertEquals(TransactionalStorageStage.NAME, error.stageName());
    assertEquals(0, store.size());
  }

  @Test
  void uncheckedStoreFailureIsReportedAsTypedOutcome() {
    IllegalStateException boom = new IllegalStateException("serialization blew up");
    store.setWriteInterceptor((record, timeout) -> {
      throw boom;
    });
    TextPipeline pipeline = TextFixtures.pipeline(store, metrics, clock);

    SubmissionOutcome outcome = pipeline.submit(RawText.of("good", "review"));

    StorageException error = assertInstanceOf(StorageException.class, ((SubmissionOutcome.Failed) outcome).error());
    assertEquals(StorageFailureKind.PERMANENT, error.kind());
    assertFalse(error.retryable());
    assertSame(boom, error.getCause());
    assertEquals("review", error.source());
    assertEquals(1, metrics.count("pipeline.submission.failed"));
    assertEquals(1, metrics.count("pipeline.stage.DatabaseStorer.failed"));
    assertEquals(0, store.size());
  }

  @Test
  void swappingSentimentStageChangesOnlySentimentFields() throws Exception {
    RawText raw = new RawText("<p>good  but awful</p>", "web", TextFixtures.EPOCH, "trace-swap", Map.of("k", "v"));
    SentimentLexicon positiveOnly = new SentimentLexicon(Set.of("good"), Set.of("terrible"));
    List<Object> firstSeen = new ArrayList<>();
    List<Object> secondSeen = new ArrayList<>();

    ProcessedResult first = withSentimentStage(TextFixtures.smallLexicon(), firstSeen).process(raw);
    ProcessedResult second = withSentimentStage(positiveOnly, secondSeen).process(raw);

    assertEquals(1, firstSeen.size());
    assertEquals(firstSeen, secondSeen);
    assertEquals(first.content(), second.content());
    assertEquals(first.originalContent(), second.originalContent());
    assertEquals(first.source(), second.source());
    assertEquals(first.traceId(), second.traceId());
    assertEquals(first.metadata(), second.metadata());
    assertEquals(first.storedAt(), second.storedAt());
    assertNotEquals(first.sentiment(), second.sentiment());
    assertNotEquals(first.sentimentScore(), second.sentimentScore());
    assertNotEquals(first.confidence(), second.confidence());
  }

  @Test
  void traceIdIsInMdcWhileProcessingAndRestoredAfter() throws Exception {
    MDC.put(TextPipeline.MDC_TRACE_ID, "outer");
    try {
      TextFixtures.pipeline(store, metrics, clock).process(RawText.of("good", "web").withTraceId("trace-mdc"));

      assertEquals("outer", MDC.get(TextPipeline.MDC_TRACE_ID));
      assertNull(MDC.get(TextPipeline.MDC_STAGE));
    } finally {
      MDC.remove(TextPipeline.MDC_TRACE_ID);
    }
    ILoggingEvent completed = appender.list.stream()
        .filter(event -> event.getLevel() == Level.INFO)
        .findFirst()
        .orElseThrow();
    assertEquals("trace-mdc", completed.getMDCPropertyMap().get(TextPipeline.MDC_TRACE_ID));
  }

  @Test
  void failureIsLoggedWithStageName() {
    TextFixtures.pipeline(store, metrics, clock).submit(RawText.of("<a unterminated", "web"));

    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("Submission failed in TextCleaner")));
  }

  @Test
  void eachStageSeesOnlyItsPredecessorOutput() throws Exception {
    List<Object> inputs = new ArrayList<>();
    TextCleaningStage cleaner = new TextCleaningStage();
    LexiconSentimentStage analyzer = new LexiconSentimentStage(TextFixtures.smallLexicon());
    Stage<CleanedText, CleanedText> spy = new PassThrough<>("Spy", CleanedText.class, inputs);
    TextPipeline pipeline = new TextPipeline(
        List.of(cleaner, spy, analyzer, new TransactionalStorageStage(store, Duration.ofSeconds(5))),
        metrics,
        clock);

    pipeline.process(RawText.of(" <i>bad</i> ", "web"));

    assertEquals(1, inputs.size());
    CleanedText seen = assertInstanceOf(CleanedText.class, inputs.get(0));
    assertEquals("bad", seen.content());
  }

  @Test
  void emptyStageListIsRejected() {
    assertThrows(PipelineConfigurationException.class, () -> new TextPipeline(List.of(), metrics, clock));
  }

  @Test
  void mismatchedStageOrderIsRejected() {
    PipelineConfigurationException ex = assertThrows(PipelineConfigurationException.class,
        () -> new TextPipeline(
            List.of(
                new LexiconSentimentStage(TextFixtures.smallLexicon()),
                new TextCleaningStage(),
                new TransactionalStorageStage(store, Duration.ofSeconds(1))),
            metrics,
            clock));

    assertTrue(ex.getMessage().contains("accepts CleanedText but receives RawText"));
  }

  @Test
  void chainMustEndInProcessedResult() {
    assertThrows(PipelineConfigurationException.class,
        () -> new TextPipeline(
            List.of(new TextCleaningStage(), new LexiconSentimentStage(TextFixtures.smallLexicon())),
            metrics,
            clock));
  }

  @Test
  void nullStageOutputIsAProgrammingError() {
    Stage<AnalyzedText, ProcessedResult> broken = new Stage<>() {
      @Override
      public String name() {
        return "Broken";
      }

      @Override
      public Class<AnalyzedText> inputType() {
        return AnalyzedText.class;
      }

      @Override
      public Class<ProcessedResult> outputType() {
        return ProcessedResult.class;
      }

      @Override
      public ProcessedResult process(AnalyzedText input, StageContext context) {
        return null;
      }
    };
    TextPipeline pipeline = new TextPipeline(
        List.of(new TextCleaningStage(), new LexiconSentimentStage(TextFixtures.smallLexicon()), broken),
        metrics,
        clock);

    assertThrows(IllegalStateException.class, () -> pipeline.process(RawText.of("good", "web")));
  }

  private TextPipeline withSentimentStage(SentimentLexicon lexicon, List<Object> cleanedSeen) {
    return new TextPipeline(
        List.of(
            new TextCleaningStage(),
            new PassThrough<>("Spy", CleanedText.class, cleanedSeen),
            new LexiconSentimentStage(lexicon),
            new TransactionalStorageStage(new InMemoryStoreConnector(clock), Duration.ofSeconds(5))),
        metrics,
        clock);
  }

  private static final class PassThrough<T> implements Stage<T, T> {
    private final String name;
    private final Class<T> type;
    private final List<Object> inputs;

    PassThrough(String name, Class<T> type, List<Object> inputs) {
      this.name = name;
      this.type = type;
      this.inputs = inputs;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Class<T> inputType() {
      return type;
    }

    @Override
    public Class<T> outputType() {
      return type;
    }

    @Override
    public T process(T input, StageContext context) {
      inputs.add(input);
      return input;
    }
  }
}
