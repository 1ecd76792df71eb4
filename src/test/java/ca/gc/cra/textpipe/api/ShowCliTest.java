package ca.gc.cra.textpipe.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ShowCliTest {
  private static final Pattern STORED = Pattern.compile("Stored (\\S+)");

  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void storedRecordCanBeShownByIdAndSource() {
    String db = "db=" + tempDir.resolve("show.db");
    assertEquals(ExitCode.SUCCESS, ProcessCli.run(new String[] {
        "content=<p>terrible   wait</p>", "source=desk", "traceId=show-1", db}));
    Matcher matcher = STORED.matcher(buffer.toString());
    assertTrue(matcher.find());
    String id = matcher.group(1);
    buffer.getBuffer().setLength(0);

    assertEquals(ExitCode.SUCCESS, ShowCli.run(new String[] {"id=" + id, db}));
    String byId = buffer.toString();
    assertTrue(byId.contains("Trace id   : show-1"), byId);
    assertTrue(byId.contains("NEGATIVE"), byId);
    assertTrue(byId.contains("Original   : <p>terrible   wait</p>"), byId);

    buffer.getBuffer().setLength(0);
    assertEquals(ExitCode.SUCCESS, ShowCli.run(new String[] {"source=desk", db}));
    assertTrue(buffer.toString().contains(id));
  }

  @Test
  void unknownIdIsNotFound() {
    ExitCode code = ShowCli.run(new String[] {"id=missing", "db=" + tempDir.resolve("empty.db")});

    assertEquals(ExitCode.STAGE_FAILURE, code);
    assertTrue(buffer.toString().contains("Record missing not found"));
  }

  @Test
  void exactlyOneSelectorIsRequired() {
    assertEquals(ExitCode.INVALID_ARGS, ShowCli.run(new String[] {"store=MEMORY"}));
    assertEquals(ExitCode.INVALID_ARGS, ShowCli.run(new String[] {"id=a", "source=b", "store=MEMORY"}));
  }
}
