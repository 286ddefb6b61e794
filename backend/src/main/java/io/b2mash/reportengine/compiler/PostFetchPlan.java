package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.query.FilterClause;
import io.b2mash.reportengine.query.OrderBy;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Work the engine performs in memory after fetching: filter, then group, then sort. Any
 * post-fetch step needs the whole eligible row set, so native paging cannot stop early.
 */
public record PostFetchPlan(List<FilterClause> filters, String groupBy, OrderBy orderBy) {

  public PostFetchPlan {
    filters = filters == null ? List.of() : List.copyOf(filters);
  }

  public static PostFetchPlan none() {
    return new PostFetchPlan(List.of(), null, null);
  }

  public boolean isEmpty() {
    return filters.isEmpty() && groupBy == null && orderBy == null;
  }

  public boolean requiresFullFetch() {
    return !isEmpty();
  }

  String canonicalForm() {
    if (isEmpty()) {
      return "none";
    }
    var filterPart =
        filters.stream()
            .map(f -> f.field() + ":" + f.operator().wireName() + ":" + f.value())
            .collect(Collectors.joining(","));
    return "filter["
        + filterPart
        + "];group["
        + (groupBy != null ? groupBy : "")
        + "];order["
        + (orderBy != null ? orderBy.field() + ":" + orderBy.direction().wireName() : "")
        + "]";
  }
}
