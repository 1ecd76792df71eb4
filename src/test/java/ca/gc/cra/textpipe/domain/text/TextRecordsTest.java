package ca.gc.cra.textpipe.domain.text;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TextRecordsTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @Test
  void rawTextFillsSourceAndTraceId() {
    RawText raw = new RawText("hello", "  ", NOW, null, null);

    assertEquals(RawText.UNSPECIFIED_SOURCE, raw.source());
    assertFalse(raw.traceId().isBlank());
    assertEquals(Map.of(), raw.metadata());
    assertNotEquals(raw.traceId(), RawText.of("hello", null).traceId());
  }

  @Test
  void rawTextCopiesMetadata() {
    Map<String, String> metadata = new HashMap<>();
    metadata.put("lang", "en");
    RawText raw = new RawText("hello", "web", NOW, "t-1", metadata);
    metadata.put("lang", "fr");

    assertEquals("en", raw.metadata().get("lang"));
    assertEquals("t-2", raw.withTraceId("t-2").traceId());
  }

  @Test
  void analyzedTextRejectsScoreOutsideRange() {
    assertThrows(IllegalArgumentException.class, () -> new AnalyzedText(
        "x", "x", "s", "t", Sentiment.POSITIVE, 1.5, 0.5, NOW, Map.of()));
    assertThrows(IllegalArgumentException.class, () -> new AnalyzedText(
        "x", "x", "s", "t", Sentiment.NEUTRAL, 0.0, -0.1, NOW, Map.of()));
  }

  @Test
  void analyzedTextRejectsLabelThatDisagreesWithScore() {
    assertThrows(IllegalArgumentException.class, () -> new AnalyzedText(
        "x", "x", "s", "t", Sentiment.NEGATIVE, 0.8, 0.5, NOW, Map.of()));
    assertDoesNotThrow(() -> new AnalyzedText(
        "x", "x", "s", "t", Sentiment.NEGATIVE, -0.8, 0.5, NOW, Map.of()));
  }

  @Test
  void processedResultRequiresStorageId() {
    AnalyzedText analyzed = new AnalyzedText("x", "x", "s", "t", Sentiment.NEUTRAL, 0.0, 0.5, NOW, Map.of());

    assertThrows(IllegalArgumentException.class, () -> ProcessedResult.from(analyzed, " ", NOW));
    ProcessedResult stored = ProcessedResult.from(analyzed, "id-1", NOW);
    assertEquals("id-1", stored.storageId());
    assertEquals(Sentiment.NEUTRAL, stored.sentiment());
  }
}
