package io.b2mash.reportengine.query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Converts between validated definitions, raw requests and the JSON documents stored with custom
 * reports and execution records. Validating the output of {@link #toRequest} against the same
 * catalog yields an equal definition.
 */
@Component
public class QueryDefinitionMapper {

  private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public QueryDefinitionMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public RawQueryRequest toRequest(QueryDefinition definition) {
    var filters =
        definition.filters().stream()
            .map(
                f ->
                    new RawQueryRequest.RawFilter(
                        f.field(), f.operator().wireName(), wireValue(f.value())))
            .toList();
    var orderBy =
        definition.orderBy() == null
            ? null
            : new RawQueryRequest.RawOrderBy(
                definition.orderBy().field(), definition.orderBy().direction().wireName());
    return new RawQueryRequest(
        definition.source().slug(),
        definition.selectedFields(),
        filters,
        definition.groupBy(),
        orderBy,
        definition.pagination().page(),
        definition.pagination().pageSize(),
        new LinkedHashMap<>(definition.parameters()));
  }

  public Map<String, Object> toDocument(RawQueryRequest request) {
    return objectMapper.convertValue(request, DOCUMENT);
  }

  public Map<String, Object> toDocument(QueryDefinition definition) {
    return toDocument(toRequest(definition));
  }

  public RawQueryRequest fromDocument(Map<String, Object> document) {
    return objectMapper.convertValue(document, RawQueryRequest.class);
  }

  private static Object wireValue(Object value) {
    if (value instanceof Instant instant) {
      return instant.toString();
    }
    if (value instanceof List<?> items) {
      var converted = new ArrayList<>();
      for (var item : items) {
        converted.add(wireValue(item));
      }
      return converted;
    }
    return value;
  }
}
