package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.catalog.FieldCatalog;
import io.b2mash.reportengine.catalog.FieldDescriptor;
import io.b2mash.reportengine.query.FilterClause;
import io.b2mash.reportengine.query.QueryDefinition;
import io.b2mash.reportengine.query.SourceParameters;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Compiles definitions against the usage report backend. The backend cannot filter, sort or page,
 * so everything except the period runs after the download.
 */
@Component
public class CloudSuiteQueryCompiler extends AbstractSourceCompiler {

  static final String REPORT = "getOffice365ActiveUserDetail";
  static final String TABLE = "office365ActiveUserDetail";

  public CloudSuiteQueryCompiler(Clock clock) {
    super(clock);
  }

  @Override
  public SourceKind source() {
    return SourceKind.CLOUD_SUITE;
  }

  @Override
  public UsageReportQuery compile(QueryDefinition definition, FieldCatalog catalog) {
    requireSource(definition, catalog);
    var period = definition.parameters().get(SourceParameters.PERIOD);
    if (period == null || !SourceParameters.PERIODS.contains(period.toString())) {
      throw new CompileException("Usage report query has no valid period: " + period);
    }

    var columns =
        definition.selectedFields().stream()
            .map(name -> quote(field(catalog, name).nativeName()))
            .collect(Collectors.joining(", "));
    var statement = new StringBuilder("SELECT ").append(columns).append(" FROM ").append(TABLE);
    if (!definition.filters().isEmpty()) {
      var predicates = new ArrayList<String>();
      for (var clause : definition.filters()) {
        predicates.add(predicate(clause, field(catalog, clause.field())));
      }
      statement.append(" WHERE ").append(String.join(" AND ", predicates));
    }
    if (definition.groupBy() != null) {
      var groupColumn = field(catalog, definition.groupBy()).nativeName();
      statement.append(" GROUP BY ").append(quote(groupColumn));
    }
    if (definition.orderBy() != null) {
      statement
          .append(" ORDER BY ")
          .append(quote(field(catalog, definition.orderBy().field()).nativeName()))
          .append(' ')
          .append(definition.orderBy().direction().name());
    }
    var pagination = definition.pagination();
    statement
        .append(" LIMIT ")
        .append(pagination.pageSize())
        .append(" OFFSET ")
        .append(pagination.offset());

    return new UsageReportQuery(
        REPORT + "(period='" + period + "')",
        period.toString(),
        statement.toString(),
        definition.selectedFields(),
        bindings(definition, catalog),
        pagination,
        new PostFetchPlan(
            definition.filters().stream().map(this::resolveRelative).toList(),
            definition.groupBy(),
            definition.orderBy()),
        List.of());
  }

  private String predicate(FilterClause clause, FieldDescriptor field) {
    var column = quote(field.nativeName());
    var value = clause.value();
    return switch (clause.operator()) {
      case EQUALS -> column + " = " + literal(value);
      case NOT_EQUALS -> column + " <> " + literal(value);
      case CONTAINS -> column + " LIKE " + like("%", value, "%");
      case NOT_CONTAINS -> column + " NOT LIKE " + like("%", value, "%");
      case STARTS_WITH -> column + " LIKE " + like("", value, "%");
      case ENDS_WITH -> column + " LIKE " + like("%", value, "");
      case GREATER_THAN -> column + " > " + literal(value);
      case GREATER_OR_EQUAL -> column + " >= " + literal(value);
      case LESS_THAN -> column + " < " + literal(value);
      case LESS_OR_EQUAL -> column + " <= " + literal(value);
      case IN -> {
        var items = ((List<?>) value).stream().map(CloudSuiteQueryCompiler::literal).toList();
        yield column + " IN (" + String.join(", ", items) + ")";
      }
      case EXISTS -> column + " IS NOT NULL";
      case NOT_EXISTS -> column + " IS NULL";
      case IS_EMPTY -> "(" + column + " IS NULL OR " + column + " = '')";
      case IS_NOT_EMPTY -> "(" + column + " IS NOT NULL AND " + column + " <> '')";
      case OLDER_THAN -> column + " <= " + literal(cutoff((Long) value));
      case NEWER_THAN -> column + " >= " + literal(cutoff((Long) value));
    };
  }

  private static String quote(String column) {
    return "\"" + column.replace("\"", "\"\"") + "\"";
  }

  private static String like(String prefix, Object value, String suffix) {
    var escaped =
        value.toString().replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    return literal(prefix + escaped + suffix) + " ESCAPE '\\'";
  }

  static String literal(Object value) {
    if (value instanceof Instant instant) {
      return "TIMESTAMP '" + instant + "'";
    }
    if (value instanceof Boolean || value instanceof Number) {
      return value.toString().toUpperCase();
    }
    return "'" + value.toString().replace("'", "''") + "'";
  }
}
