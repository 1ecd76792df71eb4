package ca.gc.cra.textpipe.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("hello", Logs.truncate("hello", 10));
    assertEquals("<null>", Logs.preview(null));
  }

  @Test
  void longValuesAreTruncatedOnCharacterBoundary() {
    String truncated = Logs.truncate("\u00E9\u00E9\u00E9\u00E9\u00E9", 5);

    assertTrue(truncated.startsWith("\u00E9\u00E9..."), truncated);
    assertTrue(truncated.endsWith("(truncated, 5 of 10 bytes)"));
  }

  @Test
  void previewEscapesLineBreaks() {
    assertEquals("a\\nb\\tc", Logs.preview("a\nb\tc"));
  }
}
