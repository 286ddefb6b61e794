package io.b2mash.reportengine.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** An unvalidated query as submitted by a caller or loaded from a stored custom report. */
public record RawQueryRequest(
    String source,
    List<String> fields,
    List<RawFilter> filters,
    String groupBy,
    RawOrderBy orderBy,
    Integer page,
    Integer pageSize,
    Map<String, Object> parameters) {

  public record RawFilter(String field, String operator, Object value) {}

  public record RawOrderBy(String field, String direction) {}

  /** Returns a copy whose parameters are {@code overrides} layered over the current ones. */
  public RawQueryRequest withParameters(Map<String, Object> overrides) {
    var merged = new LinkedHashMap<String, Object>();
    if (parameters != null) {
      merged.putAll(parameters);
    }
    if (overrides != null) {
      merged.putAll(overrides);
    }
    return new RawQueryRequest(
        source, fields, filters, groupBy, orderBy, page, pageSize, merged);
  }

  public RawQueryRequest withPage(Integer page, Integer pageSize) {
    return new RawQueryRequest(
        source, fields, filters, groupBy, orderBy, page, pageSize, parameters);
  }
}
