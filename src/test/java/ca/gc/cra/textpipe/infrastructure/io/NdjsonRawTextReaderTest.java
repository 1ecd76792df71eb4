package ca.gc.cra.textpipe.infrastructure.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.textpipe.domain.text.RawText;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonRawTextReaderTest {
  @TempDir Path tempDir;

  private final NdjsonRawTextReader reader = new NdjsonRawTextReader();

  @Test
  void readsOneSubmissionPerLineSkippingBlankLines() throws Exception {
    Path file = tempDir.resolve("in.ndjson");
    Files.writeString(file, String.join("\n",
        "{\"content\":\"<b>good</b>\",\"source\":\"web\",\"traceId\":\"t-1\",\"metadata\":{\"lang\":\"en\",\"n\":3}}",
        "",
        "{\"content\":\"plain\",\"receivedAt\":\"2024-05-01T12:00:00Z\"}",
        ""));

    List<RawText> submissions = reader.read(file);

    assertEquals(2, submissions.size());
    RawText first = submissions.get(0);
    assertEquals("<b>good</b>", first.content());
    assertEquals("web", first.source());
    assertEquals("t-1", first.traceId());
    assertEquals(Map.of("lang", "en", "n", "3"), first.metadata());
    RawText second = submissions.get(1);
    assertEquals(RawText.UNSPECIFIED_SOURCE, second.source());
    assertEquals(Instant.parse("2024-05-01T12:00:00Z"), second.receivedAt());
  }

  @Test
  void nullContentIsPassedThroughForTheCleanerToReject() {
    RawText raw = reader.parseLine("{\"content\":null}", 1);

    assertNull(raw.content());
  }

  @Test
  void malformedLinesReportLineNumber() {
    IllegalArgumentException json = assertThrows(IllegalArgumentException.class,
        () -> reader.parseLine("{\"content\":", 4));
    IllegalArgumentException missing = assertThrows(IllegalArgumentException.class,
        () -> reader.parseLine("{\"source\":\"web\"}", 5));
    IllegalArgumentException nested = assertThrows(IllegalArgumentException.class,
        () -> reader.parseLine("{\"content\":\"x\",\"metadata\":{\"a\":{\"b\":1}}}", 6));
    IllegalArgumentException array = assertThrows(IllegalArgumentException.class,
        () -> reader.parseLine("[1,2]", 7));

    assertTrue(json.getMessage().startsWith("line 4:"));
    assertTrue(missing.getMessage().contains("missing 'content'"));
    assertTrue(nested.getMessage().contains("must be a scalar"));
    assertTrue(array.getMessage().startsWith("line 7:"));
  }

  @Test
  void invalidTimestampIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> reader.parseLine("{\"content\":\"x\",\"receivedAt\":\"yesterday\"}", 1));
  }
}
