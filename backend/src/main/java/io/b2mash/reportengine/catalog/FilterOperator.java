package io.b2mash.reportengine.catalog;

import java.util.Arrays;
import java.util.Optional;

/** Comparison operators a filter clause may use. */
public enum FilterOperator {
  EQUALS("equals", true),
  NOT_EQUALS("not_equals", true),
  CONTAINS("contains", true),
  NOT_CONTAINS("not_contains", true),
  STARTS_WITH("starts_with", true),
  ENDS_WITH("ends_with", true),
  GREATER_THAN("greater_than", true),
  GREATER_OR_EQUAL("greater_or_equal", true),
  LESS_THAN("less_than", true),
  LESS_OR_EQUAL("less_or_equal", true),
  IN("in", true),
  EXISTS("exists", false),
  NOT_EXISTS("not_exists", false),
  IS_EMPTY("is_empty", false),
  IS_NOT_EMPTY("is_not_empty", false),
  OLDER_THAN("older_than", true),
  NEWER_THAN("newer_than", true);

  private final String wireName;
  private final boolean requiresValue;

  FilterOperator(String wireName, boolean requiresValue) {
    this.wireName = wireName;
    this.requiresValue = requiresValue;
  }

  public String wireName() {
    return wireName;
  }

  public boolean requiresValue() {
    return requiresValue;
  }

  /** Age operators take a number of days rather than a point in time. */
  public boolean isRelativeDate() {
    return this == OLDER_THAN || this == NEWER_THAN;
  }

  /**
   * Resolves a wire name. Both the snake_case form ({@code starts_with}) and the camelCase form
   * ({@code startsWith}) are accepted.
   */
  public static Optional<FilterOperator> fromWireName(String value) {
    if (value == null) {
      return Optional.empty();
    }
    var normalized = value.trim().replaceAll("([a-z])([A-Z])", "$1_$2").toLowerCase();
    return Arrays.stream(values()).filter(op -> op.wireName.equals(normalized)).findFirst();
  }
}
