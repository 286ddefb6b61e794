package io.b2mash.reportengine.query;

import io.b2mash.reportengine.catalog.FilterOperator;

/**
 * A validated filter. {@code value} is already typed for the field: {@code String}, {@code Long},
 * {@code Boolean}, {@code Instant}, a day count ({@code Long}) for age operators, a {@code List} of
 * those for {@code in}, or {@code null} for operators without a value.
 */
public record FilterClause(String field, FilterOperator operator, Object value) {}
