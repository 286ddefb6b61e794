package io.b2mash.reportengine.query;

/**
 * One problem found while validating a query.
 *
 * @param code machine readable category
 * @param path location in the request, e.g. {@code filters[2].operator}
 * @param message human readable description
 */
public record ValidationError(Code code, String path, String message) {

  public enum Code {
    UNKNOWN_SOURCE,
    SOURCE_DISABLED,
    CATALOG_MISMATCH,
    NO_FIELDS_SELECTED,
    UNKNOWN_FIELD,
    DUPLICATE_FIELD,
    UNKNOWN_OPERATOR,
    OPERATOR_NOT_ALLOWED,
    MISSING_VALUE,
    INVALID_VALUE,
    INVALID_DIRECTION,
    FIELD_NOT_SORTABLE,
    PAGE_OUT_OF_RANGE,
    PAGE_SIZE_OUT_OF_RANGE,
    MISSING_PARAMETER,
    INVALID_PARAMETER
  }
}
