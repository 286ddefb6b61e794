package io.b2mash.reportengine.query;

import io.b2mash.reportengine.catalog.FieldCatalog;
import io.b2mash.reportengine.catalog.FieldDescriptor;
import io.b2mash.reportengine.catalog.FilterOperator;
import io.b2mash.reportengine.execution.ExecutionProperties;
import io.b2mash.reportengine.query.ValidationError.Code;
import io.b2mash.reportengine.source.SourceKind;
import io.b2mash.reportengine.source.SourceProperties;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link RawQueryRequest} into a {@link QueryDefinition} against a field catalog. Checks
 * run in a fixed order (source, fields, operators and values, grouping and ordering, pagination
 * and parameters) and every violation is reported together.
 */
@Component
public class QueryValidator {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

  private static final List<Function<String, Instant>> DATE_PARSERS =
      List.of(
          Instant::parse,
          text -> OffsetDateTime.parse(text).toInstant(),
          text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());

  /** Largest age, in days, a relative date filter may ask for. */
  public static final long MAX_RELATIVE_DAYS = 36_500;

  private final SourceProperties sourceProperties;
  private final QueryProperties queryProperties;
  private final ExecutionProperties executionProperties;

  public QueryValidator(
      SourceProperties sourceProperties,
      QueryProperties queryProperties,
      ExecutionProperties executionProperties) {
    this.sourceProperties = sourceProperties;
    this.queryProperties = queryProperties;
    this.executionProperties = executionProperties;
  }

  /**
   * Validates {@code raw} against {@code catalog}.
   *
   * @throws QueryValidationException carrying all violations when the request is invalid
   */
  public QueryDefinition validate(RawQueryRequest raw, FieldCatalog catalog) {
    var errors = new ArrayList<ValidationError>();
    var parameters = raw.parameters() != null ? raw.parameters() : Map.<String, Object>of();

    // 1. source
    var source = SourceKind.fromSlug(raw.source()).orElse(null);
    if (source == null) {
      errors.add(error(Code.UNKNOWN_SOURCE, "source", "Unknown source '" + raw.source() + "'"));
    } else if (!sourceProperties.isEnabled(source)) {
      errors.add(
          error(Code.SOURCE_DISABLED, "source", "Source '" + source.slug() + "' is disabled"));
    } else if (catalog.getSource() != source) {
      errors.add(
          error(
              Code.CATALOG_MISMATCH,
              "source",
              "Field catalog belongs to '" + catalog.getSource().slug() + "'"));
    }

    // 2. selected and filtered fields exist
    var selected = new ArrayList<String>();
    var requested = raw.fields() != null ? raw.fields() : List.<String>of();
    if (requested.isEmpty()) {
      errors.add(error(Code.NO_FIELDS_SELECTED, "fields", "At least one field must be selected"));
    }
    var seen = new HashSet<String>();
    for (int i = 0; i < requested.size(); i++) {
      var path = "fields[" + i + "]";
      var field = catalog.find(requested.get(i));
      if (field.isEmpty()) {
        errors.add(unknownField(path, requested.get(i)));
      } else if (!seen.add(field.get().name())) {
        errors.add(
            error(
                Code.DUPLICATE_FIELD,
                path,
                "Field '" + field.get().name() + "' is selected more than once"));
      } else {
        selected.add(field.get().name());
      }
    }

    var rawFilters = raw.filters() != null ? raw.filters() : List.<RawQueryRequest.RawFilter>of();
    var filterFields = new ArrayList<FieldDescriptor>();
    for (int i = 0; i < rawFilters.size(); i++) {
      var rawFilter = rawFilters.get(i);
      var field = catalog.find(rawFilter.field()).orElse(null);
      if (field == null) {
        errors.add(unknownField("filters[" + i + "].field", rawFilter.field()));
      }
      filterFields.add(field);
    }

    // 3. operators and values
    var parameterErrors = new ArrayList<ValidationError>();
    var filters = new ArrayList<FilterClause>();
    for (int i = 0; i < rawFilters.size(); i++) {
      var field = filterFields.get(i);
      if (field == null) {
        continue;
      }
      var clause =
          validateFilter(
              rawFilters.get(i), field, "filters[" + i + "]", parameters, errors, parameterErrors);
      if (clause != null) {
        filters.add(clause);
      }
    }

    // 4. grouping and ordering
    String groupBy = null;
    if (raw.groupBy() != null && !raw.groupBy().isBlank()) {
      var field = catalog.find(raw.groupBy());
      if (field.isEmpty()) {
        errors.add(unknownField("groupBy", raw.groupBy()));
      } else {
        groupBy = field.get().name();
      }
    }
    OrderBy orderBy = null;
    if (raw.orderBy() != null && raw.orderBy().field() != null) {
      var field = catalog.find(raw.orderBy().field());
      var direction = SortDirection.fromWireName(raw.orderBy().direction());
      if (field.isEmpty()) {
        errors.add(unknownField("orderBy.field", raw.orderBy().field()));
      } else if (!field.get().sortable()) {
        errors.add(
            error(
                Code.FIELD_NOT_SORTABLE,
                "orderBy.field",
                "Field '" + field.get().name() + "' cannot be sorted"));
      }
      if (direction.isEmpty()) {
        errors.add(
            error(
                Code.INVALID_DIRECTION,
                "orderBy.direction",
                "Direction must be 'asc' or 'desc', was '" + raw.orderBy().direction() + "'"));
      }
      if (field.isPresent() && direction.isPresent()) {
        orderBy = new OrderBy(field.get().name(), direction.get());
      }
    }

    // 5. pagination and parameters
    int page = raw.page() != null ? raw.page() : 1;
    int pageSize = raw.pageSize() != null ? raw.pageSize() : queryProperties.defaultPageSize();
    if (page < 1) {
      errors.add(error(Code.PAGE_OUT_OF_RANGE, "page", "Page must be at least 1, was " + page));
    }
    if (pageSize < 1 || pageSize > queryProperties.maxPageSize()) {
      errors.add(
          error(
              Code.PAGE_SIZE_OUT_OF_RANGE,
              "pageSize",
              "Page size must be between 1 and "
                  + queryProperties.maxPageSize()
                  + ", was "
                  + pageSize));
    } else if (page > 1 && (long) page * pageSize > executionProperties.maxResultRows()) {
      errors.add(
          error(
              Code.INVALID_VALUE,
              "page",
              "Page "
                  + page
                  + " lies beyond the result limit of "
                  + executionProperties.maxResultRows()
                  + " rows"));
    }
    if (source != null) {
      for (var rule : SourceParameters.forSource(source)) {
        var value = parameters.get(rule.name());
        var path = "parameters." + rule.name();
        if (value == null || value.toString().isBlank()) {
          if (rule.required()) {
            errors.add(
                error(
                    Code.MISSING_PARAMETER,
                    path,
                    "Parameter '" + rule.name() + "' is required for " + source.slug()));
          }
        } else if (!rule.allowedValues().isEmpty()
            && !rule.allowedValues().contains(value.toString())) {
          errors.add(
              error(
                  Code.INVALID_PARAMETER,
                  path,
                  "Parameter '"
                      + rule.name()
                      + "' must be one of "
                      + rule.allowedValues().stream().sorted().toList()));
        }
      }
    }
    errors.addAll(parameterErrors);

    if (!errors.isEmpty()) {
      throw new QueryValidationException(errors);
    }
    return new QueryDefinition(
        source, selected, filters, groupBy, orderBy, new Pagination(page, pageSize), parameters);
  }

  private FilterClause validateFilter(
      RawQueryRequest.RawFilter raw,
      FieldDescriptor field,
      String path,
      Map<String, Object> parameters,
      List<ValidationError> errors,
      List<ValidationError> parameterErrors) {
    var operator = FilterOperator.fromWireName(raw.operator()).orElse(null);
    if (operator == null) {
      errors.add(
          error(
              Code.UNKNOWN_OPERATOR,
              path + ".operator",
              "Unknown operator '" + raw.operator() + "'"));
      return null;
    }
    if (!field.allows(operator)) {
      errors.add(
          error(
              Code.OPERATOR_NOT_ALLOWED,
              path + ".operator",
              "Operator '"
                  + operator.wireName()
                  + "' is not allowed on "
                  + field.semanticType().name().toLowerCase()
                  + " field '"
                  + field.name()
                  + "'"));
      return null;
    }
    if (!operator.requiresValue()) {
      return new FilterClause(field.name(), operator, null);
    }

    var missing = new ArrayList<String>();
    var value = substitute(raw.value(), parameters, missing);
    if (!missing.isEmpty()) {
      for (var name : missing) {
        parameterErrors.add(
            error(
                Code.MISSING_PARAMETER,
                path + ".value",
                "Filter references parameter '" + name + "' which was not supplied"));
      }
      return null;
    }
    if (value == null) {
      errors.add(
          error(
              Code.MISSING_VALUE,
              path + ".value",
              "Operator '" + operator.wireName() + "' requires a value"));
      return null;
    }
    try {
      return new FilterClause(field.name(), operator, coerce(field, operator, value));
    } catch (InvalidListItemException e) {
      errors.add(
          error(Code.INVALID_VALUE, path + ".value[" + e.index + "]", e.getMessage()));
      return null;
    } catch (IllegalArgumentException e) {
      errors.add(error(Code.INVALID_VALUE, path + ".value", e.getMessage()));
      return null;
    }
  }

  /**
   * Replaces {@code {{name}}} placeholders. A value that is exactly one placeholder keeps the
   * parameter's type.
   */
  private static Object substitute(
      Object value, Map<String, Object> parameters, List<String> missing) {
    if (value instanceof Collection<?> items) {
      var resolved = new ArrayList<>();
      for (var item : items) {
        resolved.add(substitute(item, parameters, missing));
      }
      return resolved;
    }
    if (!(value instanceof String text)) {
      return value;
    }
    var whole = PLACEHOLDER.matcher(text.trim());
    if (whole.matches()) {
      var name = whole.group(1);
      if (!parameters.containsKey(name)) {
        missing.add(name);
        return null;
      }
      return parameters.get(name);
    }
    var matcher = PLACEHOLDER.matcher(text);
    var sb = new StringBuilder();
    while (matcher.find()) {
      var name = matcher.group(1);
      if (!parameters.containsKey(name)) {
        missing.add(name);
        matcher.appendReplacement(sb, "");
      } else {
        var replacement = String.valueOf(parameters.get(name));
        matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
      }
    }
    matcher.appendTail(sb);
    return sb.toString();
  }

  private static Object coerce(FieldDescriptor field, FilterOperator operator, Object value) {
    if (operator == FilterOperator.IN) {
      var items = asList(value);
      if (items.isEmpty()) {
        throw new IllegalArgumentException("Operator 'in' requires at least one value");
      }
      var typed = new ArrayList<>();
      for (int i = 0; i < items.size(); i++) {
        var item = items.get(i);
        if (item == null) {
          throw new InvalidListItemException(i, "Operator 'in' does not accept null values");
        }
        try {
          typed.add(coerceScalar(field, item));
        } catch (IllegalArgumentException e) {
          throw new InvalidListItemException(i, e.getMessage());
        }
      }
      return List.copyOf(typed);
    }
    if (operator.isRelativeDate()) {
      long days = toLong(value, "a number of days");
      if (days < 0 || days > MAX_RELATIVE_DAYS) {
        throw new IllegalArgumentException(
            "Number of days must be between 0 and " + MAX_RELATIVE_DAYS + ", was " + days);
      }
      return days;
    }
    return coerceScalar(field, value);
  }

  private static Object coerceScalar(FieldDescriptor field, Object value) {
    return switch (field.semanticType()) {
      case STRING, REFERENCE, ARRAY -> {
        if (value instanceof Collection<?> || value instanceof Map<?, ?>) {
          throw new IllegalArgumentException(
              "Field '" + field.name() + "' expects a single text value");
        }
        yield value.toString();
      }
      case INTEGER -> toLong(value, "an integer");
      case BOOLEAN -> toBoolean(value);
      case DATETIME -> toInstant(value);
    };
  }

  private static List<?> asList(Object value) {
    if (value instanceof Collection<?> items) {
      return new ArrayList<>(items);
    }
    if (value instanceof String text) {
      return Arrays.stream(text.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }
    return List.of(value);
  }

  private static long toLong(Object value, String expected) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      return ((Number) value).longValue();
    }
    if (value instanceof Number number) {
      double d = number.doubleValue();
      if (d == Math.rint(d)) {
        return number.longValue();
      }
    }
    if (value instanceof String text) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Expected " + expected + ", was '" + text + "'");
      }
    }
    throw new IllegalArgumentException("Expected " + expected + ", was '" + value + "'");
  }

  private static boolean toBoolean(Object value) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    var text = value.toString().trim();
    if ("true".equalsIgnoreCase(text)) {
      return true;
    }
    if ("false".equalsIgnoreCase(text)) {
      return false;
    }
    throw new IllegalArgumentException("Expected true or false, was '" + value + "'");
  }

  private static Instant toInstant(Object value) {
    if (value instanceof Instant instant) {
      return instant;
    }
    var text = value.toString().trim();
    DateTimeParseException failure = null;
    for (var parser : DATE_PARSERS) {
      try {
        return parser.apply(text);
      } catch (DateTimeParseException e) {
        failure = e;
      }
    }
    throw new IllegalArgumentException(
        "Expected an ISO-8601 date or timestamp, was '" + text + "'", failure);
  }

  private static ValidationError unknownField(String path, String name) {
    return error(Code.UNKNOWN_FIELD, path, "Unknown field '" + name + "'");
  }

  private static ValidationError error(Code code, String path, String message) {
    return new ValidationError(code, path, message);
  }

  /** A single element of an {@code in} list could not be used. */
  private static final class InvalidListItemException extends IllegalArgumentException {

    private final int index;

    InvalidListItemException(int index, String message) {
      super(message);
      this.index = index;
    }
  }
}
