package ca.gc.cra.textpipe.infrastructure.io;

import ca.gc.cra.textpipe.domain.text.RawText;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads batch submissions from newline-delimited JSON, one object per line:
 *
 * <pre>
 * {"content": "Great product", "source": "reviews", "traceId": "r-1", "metadata": {"lang": "en"}}
 * </pre>
 *
 * <p>{@code content} is required but may be JSON {@code null} (the pipeline then rejects that submission).
 * {@code source}, {@code traceId}, {@code receivedAt} (ISO-8601) and {@code metadata} are optional. Blank lines
 * are skipped.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonRawTextReader {
  private final ObjectMapper mapper;

  public NdjsonRawTextReader() {
    this(new ObjectMapper());
  }

  NdjsonRawTextReader(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Reads every submission in the file.
   *
   * @param file NDJSON file
   * @return submissions in file order
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if a line is not a valid submission object; the message names the line
   */
  public List<RawText> read(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    List<RawText> submissions = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        submissions.add(parseLine(line, lineNumber));
      }
    }
    return submissions;
  }

  RawText parseLine(String line, int lineNumber) {
    JsonNode node;
    try {
      node = mapper.readTree(line);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("line " + lineNumber + ": invalid JSON: " + ex.getOriginalMessage(), ex);
    }
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("line " + lineNumber + ": expected a JSON object");
    }
    if (!node.has("content")) {
      throw new IllegalArgumentException("line " + lineNumber + ": missing 'content'");
    }
    JsonNode content = node.get("content");
    if (!content.isNull() && !content.isTextual()) {
      throw new IllegalArgumentException("line " + lineNumber + ": 'content' must be a string or null");
    }
    return new RawText(
        content.isNull() ? null : content.asText(),
        text(node, "source"),
        receivedAt(node, lineNumber),
        text(node, "traceId"),
        metadata(node, lineNumber));
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static Instant receivedAt(JsonNode node, int lineNumber) {
    String raw = text(node, "receivedAt");
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(raw.trim());
    } catch (DateTimeParseException ex) {
      throw new IllegalArgumentException("line " + lineNumber + ": 'receivedAt' must be ISO-8601", ex);
    }
  }

  private static Map<String, String> metadata(JsonNode node, int lineNumber) {
    JsonNode value = node.get("metadata");
    if (value == null || value.isNull()) {
      return Map.of();
    }
    if (!value.isObject()) {
      throw new IllegalArgumentException("line " + lineNumber + ": 'metadata' must be an object");
    }
    Map<String, String> metadata = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode item = field.getValue();
      if (item.isContainerNode()) {
        throw new IllegalArgumentException(
            "line " + lineNumber + ": metadata value for '" + field.getKey() + "' must be a scalar");
      }
      metadata.put(field.getKey(), item.isNull() ? "" : item.asText());
    }
    return metadata;
  }
}
