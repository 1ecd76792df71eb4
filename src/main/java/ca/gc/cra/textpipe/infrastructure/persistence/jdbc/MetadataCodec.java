package ca.gc.cra.textpipe.infrastructure.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes record metadata to the JSON text stored in the {@code metadata} column.
 *
 * @since 0.1.0
 */
final class MetadataCodec {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {};

  private MetadataCodec() {}

  /**
   * Encodes metadata with sorted keys so equal maps produce equal documents.
   *
   * @param metadata attributes; may be empty
   * @return JSON object text
   * @throws JsonProcessingException if a value cannot be serialized
   */
  static String encode(Map<String, String> metadata) throws JsonProcessingException {
    return MAPPER.writeValueAsString(new TreeMap<>(metadata));
  }

  /**
   * Decodes a stored metadata document.
   *
   * @param json JSON object text; {@code null} or blank decodes to an empty map
   * @return attributes
   * @throws JsonProcessingException if the document is not a string-to-string object
   */
  static Map<String, String> decode(String json) throws JsonProcessingException {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    Map<String, String> decoded = MAPPER.readValue(json, MAP_TYPE);
    return decoded == null ? Map.of() : decoded;
  }
}
