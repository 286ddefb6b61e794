package io.b2mash.reportengine.query;

import io.b2mash.reportengine.source.SourceKind;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A validated, source-agnostic report query. Field names are canonical names of the catalog the
 * definition was validated against. Only {@link QueryValidator} creates instances from user input.
 */
public record QueryDefinition(
    SourceKind source,
    List<String> selectedFields,
    List<FilterClause> filters,
    String groupBy,
    OrderBy orderBy,
    Pagination pagination,
    Map<String, Object> parameters) {

  public QueryDefinition {
    selectedFields = List.copyOf(selectedFields);
    filters = filters == null ? List.of() : List.copyOf(filters);
    parameters =
        parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(parameters));
  }
}
