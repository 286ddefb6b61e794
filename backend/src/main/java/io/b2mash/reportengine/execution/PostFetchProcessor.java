package io.b2mash.reportengine.execution;

import io.b2mash.reportengine.compiler.PostFetchPlan;
import io.b2mash.reportengine.query.FilterClause;
import io.b2mash.reportengine.query.OrderBy;
import io.b2mash.reportengine.query.SortDirection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates a {@link PostFetchPlan} over normalized rows: filter, then group, then sort. Grouped
 * rows are contiguous per key and the ordering applies within each group. Text comparisons ignore
 * case and missing values sort last in both directions.
 */
public class PostFetchProcessor {

  public record Processed(List<Map<String, Object>> rows, List<GroupSummary> groups) {}

  public Processed apply(List<Map<String, Object>> rows, PostFetchPlan plan) {
    var kept = new ArrayList<Map<String, Object>>(rows.size());
    for (var row : rows) {
      if (plan.filters().stream().allMatch(f -> matches(row, f))) {
        kept.add(row);
      }
    }

    Comparator<Map<String, Object>> order = null;
    if (plan.groupBy() != null) {
      order = byField(plan.groupBy(), SortDirection.ASC);
    }
    if (plan.orderBy() != null) {
      var byOrder = byField(plan.orderBy());
      order = order == null ? byOrder : order.thenComparing(byOrder);
    }
    if (order != null) {
      kept.sort(order);
    }

    var groups = new ArrayList<GroupSummary>();
    if (plan.groupBy() != null) {
      // keyed case-insensitively like the group sort; the first spelling seen labels the group
      var labels = new LinkedHashMap<Object, Object>();
      var counts = new LinkedHashMap<Object, Integer>();
      for (var row : kept) {
        var value = sortable(row.get(plan.groupBy()));
        var key = groupKey(value);
        labels.putIfAbsent(key, value);
        counts.merge(key, 1, Integer::sum);
      }
      counts.forEach((key, count) -> groups.add(new GroupSummary(labels.get(key), count)));
    }
    return new Processed(kept, groups);
  }

  static boolean matches(Map<String, Object> row, FilterClause clause) {
    var actual = row.get(clause.field());
    var expected = clause.value();
    return switch (clause.operator()) {
      case EQUALS -> isBlank(expected) ? isEmpty(actual) : valueEquals(actual, expected);
      case NOT_EQUALS -> isBlank(expected) ? !isEmpty(actual) : !valueEquals(actual, expected);
      case CONTAINS -> contains(actual, expected);
      case NOT_CONTAINS -> !contains(actual, expected);
      case STARTS_WITH -> actual != null && lower(actual).startsWith(lower(expected));
      case ENDS_WITH -> actual != null && lower(actual).endsWith(lower(expected));
      case GREATER_THAN -> actual != null && compare(actual, expected) > 0;
      case GREATER_OR_EQUAL -> actual != null && compare(actual, expected) >= 0;
      case LESS_THAN -> actual != null && compare(actual, expected) < 0;
      case LESS_OR_EQUAL -> actual != null && compare(actual, expected) <= 0;
      case IN -> ((List<?>) expected).stream().anyMatch(v -> valueEquals(actual, v));
      case EXISTS -> actual != null;
      case NOT_EXISTS -> actual == null;
      case IS_EMPTY -> isEmpty(actual);
      case IS_NOT_EMPTY -> !isEmpty(actual);
      case OLDER_THAN, NEWER_THAN ->
          throw new IllegalArgumentException(
              "Relative date filter on '" + clause.field() + "' must be resolved at compile time");
    };
  }

  private static Comparator<Map<String, Object>> byField(OrderBy orderBy) {
    return byField(orderBy.field(), orderBy.direction());
  }

  private static Comparator<Map<String, Object>> byField(String field, SortDirection direction) {
    Comparator<Object> values = PostFetchProcessor::compare;
    if (direction == SortDirection.DESC) {
      values = values.reversed();
    }
    return Comparator.comparing(
        (Map<String, Object> row) -> sortable(row.get(field)), Comparator.nullsLast(values));
  }

  private static Object sortable(Object value) {
    if (value instanceof Collection<?> items) {
      if (items.isEmpty()) {
        return null;
      }
      return String.join(",", items.stream().map(String::valueOf).toList());
    }
    return value;
  }

  private static Object groupKey(Object value) {
    return value instanceof String text ? text.toLowerCase(Locale.ROOT) : value;
  }

  /** Values of differing normalized types fall back to comparing their lower-cased text. */
  private static int compare(Object left, Object right) {
    if (left instanceof String l && right instanceof String r) {
      return String.CASE_INSENSITIVE_ORDER.compare(l, r);
    }
    if (left instanceof Number l && right instanceof Number r) {
      return Long.compare(l.longValue(), r.longValue());
    }
    if (left instanceof Boolean l && right instanceof Boolean r) {
      return Boolean.compare(l, r);
    }
    if (left instanceof Instant l && right instanceof Instant r) {
      return l.compareTo(r);
    }
    return lower(left).compareTo(lower(right));
  }

  private static boolean valueEquals(Object actual, Object expected) {
    if (actual instanceof Collection<?> items) {
      return items.stream().anyMatch(item -> valueEquals(item, expected));
    }
    if (actual instanceof String a && expected instanceof String e) {
      return a.equalsIgnoreCase(e);
    }
    if (actual instanceof Number a && expected instanceof Number e) {
      return a.longValue() == e.longValue();
    }
    return Objects.equals(actual, expected);
  }

  /** Arrays contain an element equal to the value; text contains the value as a substring. */
  private static boolean contains(Object actual, Object expected) {
    if (actual == null) {
      return false;
    }
    if (actual instanceof Collection<?> items) {
      return items.stream().anyMatch(item -> item != null && lower(item).equals(lower(expected)));
    }
    return lower(actual).contains(lower(expected));
  }

  private static boolean isEmpty(Object value) {
    return value == null
        || (value instanceof String s && s.isEmpty())
        || (value instanceof Collection<?> c && c.isEmpty());
  }

  private static boolean isBlank(Object value) {
    return value instanceof String s && s.isEmpty();
  }

  private static String lower(Object value) {
    return String.valueOf(value).toLowerCase();
  }
}
