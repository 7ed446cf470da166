package dev.sirchmunk.cluster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.sirchmunk.evidence.EvidenceUnit;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA converters storing the structured fields of {@link KnowledgeCluster} as JSON text columns.
 * JPA instantiates converters itself, so they share one static {@link ObjectMapper}.
 */
public final class JsonColumns {

  static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private JsonColumns() {
    // utility class
  }

  static String write(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialise cluster column", e);
    }
  }

  static <T> T read(String json, TypeReference<T> type) {
    try {
      return MAPPER.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Corrupt cluster column: " + e.getOriginalMessage(), e);
    }
  }

  /** Scalar text as a JSON string, multi-line text as a JSON array. */
  @Converter
  public static class ClusterTextConverter implements AttributeConverter<ClusterText, String> {

    @Override
    public String convertToDatabaseColumn(ClusterText attribute) {
      if (attribute == null) {
        return null;
      }
      return attribute instanceof ClusterText.Scalar scalar
          ? write(scalar.text())
          : write(attribute.lines());
    }

    @Override
    public ClusterText convertToEntityAttribute(String dbData) {
      if (dbData == null || dbData.isBlank()) {
        return ClusterText.of("");
      }
      JsonNode node = read(dbData, new TypeReference<JsonNode>() {});
      if (node.isArray()) {
        List<String> lines = new ArrayList<>();
        node.forEach(line -> lines.add(line.asText()));
        return new ClusterText.Multi(lines);
      }
      return new ClusterText.Scalar(node.asText());
    }
  }

  @Converter
  public static class StringListConverter implements AttributeConverter<List<String>, String> {

    @Override
    public String convertToDatabaseColumn(List<String> attribute) {
      return write(attribute == null ? List.of() : attribute);
    }

    @Override
    public List<String> convertToEntityAttribute(String dbData) {
      return dbData == null ? new ArrayList<>() : read(dbData, new TypeReference<>() {});
    }
  }

  @Converter
  public static class EvidenceListConverter
      implements AttributeConverter<List<EvidenceUnit>, String> {

    @Override
    public String convertToDatabaseColumn(List<EvidenceUnit> attribute) {
      return write(attribute == null ? List.of() : attribute);
    }

    @Override
    public List<EvidenceUnit> convertToEntityAttribute(String dbData) {
      return dbData == null ? new ArrayList<>() : read(dbData, new TypeReference<>() {});
    }
  }

  @Converter
  public static class ConstraintListConverter
      implements AttributeConverter<List<Constraint>, String> {

    @Override
    public String convertToDatabaseColumn(List<Constraint> attribute) {
      return write(attribute == null ? List.of() : attribute);
    }

    @Override
    public List<Constraint> convertToEntityAttribute(String dbData) {
      return dbData == null ? new ArrayList<>() : read(dbData, new TypeReference<>() {});
    }
  }

  @Converter
  public static class ScanMetadataConverter implements AttributeConverter<ScanMetadata, String> {

    @Override
    public String convertToDatabaseColumn(ScanMetadata attribute) {
      return write(attribute == null ? ScanMetadata.empty() : attribute);
    }

    @Override
    public ScanMetadata convertToEntityAttribute(String dbData) {
      return dbData == null ? ScanMetadata.empty() : read(dbData, new TypeReference<>() {});
    }
  }

  @Converter
  public static class EmbeddingConverter implements AttributeConverter<float[], String> {

    @Override
    public String convertToDatabaseColumn(float[] attribute) {
      return attribute == null ? null : write(attribute);
    }

    @Override
    public float[] convertToEntityAttribute(String dbData) {
      return dbData == null ? null : read(dbData, new TypeReference<float[]>() {});
    }
  }
}
