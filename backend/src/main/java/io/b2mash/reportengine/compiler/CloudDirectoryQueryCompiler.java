package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.catalog.FieldCatalog;
import io.b2mash.reportengine.catalog.FieldDescriptor;
import io.b2mash.reportengine.catalog.FilterOperator;
import io.b2mash.reportengine.catalog.SemanticType;
import io.b2mash.reportengine.query.FilterClause;
import io.b2mash.reportengine.query.QueryDefinition;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Compiles definitions into OData requests. Operators the directory cannot evaluate server-side
 * are moved to the post-fetch plan with a warning, which turns the request into a full fetch.
 */
@Component
public class CloudDirectoryQueryCompiler extends AbstractSourceCompiler {

  static final String RESOURCE = "/users";

  /** Largest {@code $top} the directory honours. */
  static final int MAX_TOP = 999;

  private static final Set<FilterOperator> NATIVE_OPERATORS =
      EnumSet.of(
          FilterOperator.EQUALS,
          FilterOperator.NOT_EQUALS,
          FilterOperator.STARTS_WITH,
          FilterOperator.ENDS_WITH,
          FilterOperator.GREATER_THAN,
          FilterOperator.GREATER_OR_EQUAL,
          FilterOperator.LESS_THAN,
          FilterOperator.LESS_OR_EQUAL,
          FilterOperator.IN,
          FilterOperator.EXISTS,
          FilterOperator.NOT_EXISTS,
          FilterOperator.OLDER_THAN,
          FilterOperator.NEWER_THAN);

  /** Operators that only work as advanced queries ({@code ConsistencyLevel: eventual}). */
  private static final Set<FilterOperator> ADVANCED_OPERATORS =
      EnumSet.of(
          FilterOperator.NOT_EQUALS,
          FilterOperator.ENDS_WITH,
          FilterOperator.EXISTS,
          FilterOperator.NOT_EXISTS);

  public CloudDirectoryQueryCompiler(Clock clock) {
    super(clock);
  }

  @Override
  public SourceKind source() {
    return SourceKind.CLOUD_DIRECTORY;
  }

  @Override
  public GraphApiQuery compile(QueryDefinition definition, FieldCatalog catalog) {
    requireSource(definition, catalog);
    var nativeFilters = new ArrayList<String>();
    var postFilters = new ArrayList<FilterClause>();
    var warnings = new ArrayList<CompilerWarning>();
    boolean advanced = false;

    for (var clause : definition.filters()) {
      var field = field(catalog, clause.field());
      if (isNative(clause, field)) {
        nativeFilters.add(compileClause(clause, field));
        advanced |= ADVANCED_OPERATORS.contains(clause.operator());
      } else {
        postFilters.add(resolveRelative(clause));
        warnings.add(
            new CompilerWarning(
                CompilerWarning.POST_FETCH_FILTER,
                field.name(),
                "Filter '"
                    + clause.operator().wireName()
                    + "' on '"
                    + field.name()
                    + "' is applied after fetching; all matching users are retrieved"));
      }
    }

    String nativeOrder = null;
    var postOrder = definition.orderBy();
    if (definition.orderBy() != null && definition.groupBy() == null && postFilters.isEmpty()) {
      var field = field(catalog, definition.orderBy().field());
      if (isTopLevel(field)) {
        nativeOrder = field.nativeName() + " " + definition.orderBy().direction().wireName();
        postOrder = null;
        advanced |= !nativeFilters.isEmpty();
      }
    }
    if (postOrder != null && definition.groupBy() == null) {
      warnings.add(
          new CompilerWarning(
              CompilerWarning.POST_FETCH_ORDER,
              postOrder.field(),
              "Ordering by '" + postOrder.field() + "' is applied after fetching"));
    }

    var bindings = bindings(definition, catalog);
    var select = new LinkedHashSet<String>();
    bindings.forEach(b -> select.add(topLevelProperty(b.nativeName())));

    var postFetch = new PostFetchPlan(postFilters, definition.groupBy(), postOrder);
    int top =
        postFetch.requiresFullFetch()
            ? MAX_TOP
            : Math.min(definition.pagination().pageSize(), MAX_TOP);
    var headers = new TreeMap<String, String>();
    if (advanced) {
      headers.put("ConsistencyLevel", "eventual");
    }
    return new GraphApiQuery(
        RESOURCE,
        new ArrayList<>(select),
        nativeFilters.isEmpty() ? null : String.join(" and ", nativeFilters),
        nativeOrder,
        top,
        advanced,
        headers,
        definition.selectedFields(),
        bindings,
        definition.pagination(),
        postFetch,
        warnings);
  }

  private static boolean isNative(FilterClause clause, FieldDescriptor field) {
    var type = field.semanticType();
    if (type == SemanticType.ARRAY || type == SemanticType.REFERENCE) {
      return false;
    }
    return NATIVE_OPERATORS.contains(clause.operator());
  }

  private static boolean isTopLevel(FieldDescriptor field) {
    return !field.nativeName().contains("/") && field.semanticType().isSortable();
  }

  private String compileClause(FilterClause clause, FieldDescriptor field) {
    var prop = field.nativeName();
    var value = clause.value();
    return switch (clause.operator()) {
      case EQUALS -> prop + " eq " + literal(value);
      case NOT_EQUALS -> prop + " ne " + literal(value);
      case STARTS_WITH -> "startswith(" + prop + "," + literal(value) + ")";
      case ENDS_WITH -> "endswith(" + prop + "," + literal(value) + ")";
      case GREATER_THAN -> prop + " gt " + literal(value);
      case GREATER_OR_EQUAL -> prop + " ge " + literal(value);
      case LESS_THAN -> prop + " lt " + literal(value);
      case LESS_OR_EQUAL -> prop + " le " + literal(value);
      case IN -> {
        var items = ((List<?>) value).stream().map(CloudDirectoryQueryCompiler::literal).toList();
        yield prop + " in (" + String.join(",", items) + ")";
      }
      case EXISTS -> prop + " ne null";
      case NOT_EXISTS -> prop + " eq null";
      case OLDER_THAN -> prop + " le " + literal(cutoff((Long) value));
      case NEWER_THAN -> prop + " ge " + literal(cutoff((Long) value));
      default ->
          throw new CompileException(
              "Operator " + clause.operator().wireName() + " has no OData form");
    };
  }

  /** Formats an OData literal. Strings are single-quoted with embedded quotes doubled. */
  static String literal(Object value) {
    if (value == null) {
      return "null";
    }
    if (value instanceof Instant instant) {
      return instant.toString();
    }
    if (value instanceof Boolean || value instanceof Number) {
      return value.toString();
    }
    return "'" + value.toString().replace("'", "''") + "'";
  }

  private static String topLevelProperty(String nativeName) {
    int slash = nativeName.indexOf('/');
    return slash < 0 ? nativeName : nativeName.substring(0, slash);
  }
}
