package io.b2mash.reportengine.execution;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A non-fatal problem in a completed execution.
 *
 * @param code machine readable reason
 * @param rowIndex index of the affected fetched record, {@code null} for query-wide warnings
 * @param field affected field, if any
 * @param message human readable description
 */
public record ExecutionWarning(String code, Integer rowIndex, String field, String message) {

  public static final String ATTRIBUTE_UNREADABLE = "ATTRIBUTE_UNREADABLE";
  public static final String VALUE_UNPARSEABLE = "VALUE_UNPARSEABLE";
  public static final String RESULT_TRUNCATED = "RESULT_TRUNCATED";

  public Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    map.put("code", code);
    if (rowIndex != null) {
      map.put("rowIndex", rowIndex);
    }
    if (field != null) {
      map.put("field", field);
    }
    map.put("message", message);
    return map;
  }
}
