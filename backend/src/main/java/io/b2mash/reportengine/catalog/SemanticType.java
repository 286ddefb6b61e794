package io.b2mash.reportengine.catalog;

import static io.b2mash.reportengine.catalog.FilterOperator.CONTAINS;
import static io.b2mash.reportengine.catalog.FilterOperator.ENDS_WITH;
import static io.b2mash.reportengine.catalog.FilterOperator.EQUALS;
import static io.b2mash.reportengine.catalog.FilterOperator.EXISTS;
import static io.b2mash.reportengine.catalog.FilterOperator.GREATER_OR_EQUAL;
import static io.b2mash.reportengine.catalog.FilterOperator.GREATER_THAN;
import static io.b2mash.reportengine.catalog.FilterOperator.IN;
import static io.b2mash.reportengine.catalog.FilterOperator.IS_EMPTY;
import static io.b2mash.reportengine.catalog.FilterOperator.IS_NOT_EMPTY;
import static io.b2mash.reportengine.catalog.FilterOperator.LESS_OR_EQUAL;
import static io.b2mash.reportengine.catalog.FilterOperator.LESS_THAN;
import static io.b2mash.reportengine.catalog.FilterOperator.NEWER_THAN;
import static io.b2mash.reportengine.catalog.FilterOperator.NOT_CONTAINS;
import static io.b2mash.reportengine.catalog.FilterOperator.NOT_EQUALS;
import static io.b2mash.reportengine.catalog.FilterOperator.NOT_EXISTS;
import static io.b2mash.reportengine.catalog.FilterOperator.OLDER_THAN;
import static io.b2mash.reportengine.catalog.FilterOperator.STARTS_WITH;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Source-independent value type of a catalog field. */
public enum SemanticType {
  STRING(
      EnumSet.of(
          EQUALS,
          NOT_EQUALS,
          CONTAINS,
          NOT_CONTAINS,
          STARTS_WITH,
          ENDS_WITH,
          IN,
          EXISTS,
          NOT_EXISTS,
          IS_EMPTY,
          IS_NOT_EMPTY)),
  INTEGER(
      EnumSet.of(
          EQUALS,
          NOT_EQUALS,
          GREATER_THAN,
          GREATER_OR_EQUAL,
          LESS_THAN,
          LESS_OR_EQUAL,
          IN,
          EXISTS,
          NOT_EXISTS)),
  BOOLEAN(EnumSet.of(EQUALS, NOT_EQUALS, EXISTS, NOT_EXISTS)),
  DATETIME(
      EnumSet.of(
          GREATER_THAN,
          GREATER_OR_EQUAL,
          LESS_THAN,
          LESS_OR_EQUAL,
          OLDER_THAN,
          NEWER_THAN,
          EXISTS,
          NOT_EXISTS)),
  ARRAY(EnumSet.of(CONTAINS, NOT_CONTAINS, IS_EMPTY, IS_NOT_EMPTY, EXISTS, NOT_EXISTS)),
  REFERENCE(EnumSet.of(EQUALS, NOT_EQUALS, EXISTS, NOT_EXISTS));

  private final Set<FilterOperator> defaultOperators;

  SemanticType(EnumSet<FilterOperator> defaultOperators) {
    this.defaultOperators = Collections.unmodifiableSet(defaultOperators);
  }

  public Set<FilterOperator> defaultOperators() {
    return defaultOperators;
  }

  /** Multi-valued fields have no stable sort order. */
  public boolean isSortable() {
    return this != ARRAY;
  }
}
