package io.b2mash.reportengine.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry as returned by a backend, keyed by native attribute name.
 *
 * @param attributes attribute values; multi-valued attributes are lists
 * @param attributeErrors attributes the backend refused to return for this entry, with the reason
 */
public record RawRecord(Map<String, Object> attributes, Map<String, String> attributeErrors) {

  public RawRecord {
    attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    attributeErrors = attributeErrors == null ? Map.of() : Map.copyOf(attributeErrors);
  }

  public static RawRecord of(Map<String, Object> attributes) {
    return new RawRecord(attributes, Map.of());
  }
}
