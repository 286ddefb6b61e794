package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.query.Pagination;
import io.b2mash.reportengine.source.SourceKind;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * An OData collection request against the cloud directory.
 *
 * @param resource collection path, e.g. {@code /users}
 * @param select {@code $select} properties
 * @param filter {@code $filter} expression, or {@code null}
 * @param orderBy {@code $orderby} expression, or {@code null}
 * @param top {@code $top} page size requested from the backend
 * @param count whether {@code $count=true} is sent
 * @param headers request headers the query depends on
 */
public record GraphApiQuery(
    String resource,
    List<String> select,
    String filter,
    String orderBy,
    int top,
    boolean count,
    SortedMap<String, String> headers,
    List<String> selectedFields,
    List<FieldBinding> bindings,
    Pagination pagination,
    PostFetchPlan postFetch,
    List<CompilerWarning> warnings)
    implements NativeQuery {

  public GraphApiQuery {
    select = List.copyOf(select);
    headers = headers == null ? new TreeMap<>() : new TreeMap<>(headers);
    selectedFields = List.copyOf(selectedFields);
    bindings = List.copyOf(bindings);
    warnings = List.copyOf(warnings);
  }

  @Override
  public SourceKind source() {
    return SourceKind.CLOUD_DIRECTORY;
  }

  /** Query string parameters in the order they are sent. */
  public Map<String, String> queryParameters() {
    var params = new LinkedHashMap<String, String>();
    params.put("$select", String.join(",", select));
    if (filter != null) {
      params.put("$filter", filter);
    }
    if (orderBy != null) {
      params.put("$orderby", orderBy);
    }
    params.put("$top", String.valueOf(top));
    if (count) {
      params.put("$count", "true");
    }
    return params;
  }

  @Override
  public String canonicalForm() {
    var query =
        queryParameters().entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .collect(Collectors.joining("&"));
    var headerPart =
        headers.entrySet().stream()
            .map(e -> e.getKey() + ":" + e.getValue())
            .collect(Collectors.joining(","));
    return "graph;GET "
        + resource
        + "?"
        + query
        + ";headers="
        + headerPart
        + ";fields="
        + String.join(",", selectedFields)
        + ";limit="
        + (stopsAtRequestedPage() ? String.valueOf(pagination.rowsNeeded()) : "all")
        + ";post="
        + postFetch.canonicalForm();
  }
}
