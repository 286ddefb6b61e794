package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.catalog.FieldCatalog;
import io.b2mash.reportengine.catalog.FieldDescriptor;
import io.b2mash.reportengine.catalog.SemanticType;
import io.b2mash.reportengine.catalog.StandardFields;
import io.b2mash.reportengine.query.FilterClause;
import io.b2mash.reportengine.query.QueryDefinition;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Compiles definitions into LDAP search filters. Every filter is evaluated by the directory;
 * grouping and ordering happen after the fetch because paged searches return entries unordered.
 */
@Component
public class DirectoryQueryCompiler extends AbstractSourceCompiler {

  static final String USER_BASE_FILTER = "(objectClass=user)(objectCategory=person)";

  private static final String DISABLED_RULE =
      "(userAccountControl:"
          + LdapSyntax.BITWISE_AND_RULE
          + ":="
          + LdapSyntax.ACCOUNT_DISABLE_FLAG
          + ")";

  public DirectoryQueryCompiler(Clock clock) {
    super(clock);
  }

  @Override
  public SourceKind source() {
    return SourceKind.DIRECTORY;
  }

  @Override
  public LdapSearchQuery compile(QueryDefinition definition, FieldCatalog catalog) {
    requireSource(definition, catalog);
    var filter = new StringBuilder("(&").append(USER_BASE_FILTER);
    for (var clause : definition.filters()) {
      filter.append(compileClause(clause, field(catalog, clause.field())));
    }
    filter.append(')');

    var bindings = bindings(definition, catalog);
    var attributes = new LinkedHashSet<String>();
    bindings.forEach(b -> attributes.add(b.nativeName()));

    var postFetch = new PostFetchPlan(List.of(), definition.groupBy(), definition.orderBy());
    return new LdapSearchQuery(
        filter.toString(),
        new ArrayList<>(attributes),
        definition.selectedFields(),
        bindings,
        definition.pagination(),
        postFetch,
        List.of());
  }

  String compileClause(FilterClause clause, FieldDescriptor field) {
    if (StandardFields.DIRECTORY_ENABLED.equals(field.name())) {
      return compileEnabled(clause);
    }
    var attr = field.nativeName();
    var value = clause.value();
    return switch (clause.operator()) {
      case EQUALS -> isBlank(value) ? absent(attr) : eq(attr, format(field, value));
      case NOT_EQUALS -> isBlank(value) ? present(attr) : not(eq(attr, format(field, value)));
      case CONTAINS ->
          field.semanticType() == SemanticType.ARRAY
              ? eq(attr, escape(value))
              : eq(attr, "*" + escape(value) + "*");
      case NOT_CONTAINS ->
          field.semanticType() == SemanticType.ARRAY
              ? not(eq(attr, escape(value)))
              : not(eq(attr, "*" + escape(value) + "*"));
      case STARTS_WITH -> eq(attr, escape(value) + "*");
      case ENDS_WITH -> eq(attr, "*" + escape(value));
      case GREATER_THAN ->
          "(&" + cmp(attr, ">=", format(field, value)) + not(eq(attr, format(field, value))) + ")";
      case GREATER_OR_EQUAL -> cmp(attr, ">=", format(field, value));
      case LESS_THAN ->
          "(&" + cmp(attr, "<=", format(field, value)) + not(eq(attr, format(field, value))) + ")";
      case LESS_OR_EQUAL -> cmp(attr, "<=", format(field, value));
      case IN -> {
        var any = new StringBuilder("(|");
        for (var item : (List<?>) value) {
          any.append(eq(attr, format(field, item)));
        }
        yield any.append(')').toString();
      }
      case EXISTS, IS_NOT_EMPTY -> present(attr);
      case NOT_EXISTS, IS_EMPTY -> absent(attr);
      case OLDER_THAN -> cmp(attr, "<=", formatDate(attr, cutoff((Long) value)));
      case NEWER_THAN -> cmp(attr, ">=", formatDate(attr, cutoff((Long) value)));
    };
  }

  private String compileEnabled(FilterClause clause) {
    return switch (clause.operator()) {
      case EQUALS -> Boolean.TRUE.equals(clause.value()) ? not(DISABLED_RULE) : DISABLED_RULE;
      case NOT_EQUALS -> Boolean.TRUE.equals(clause.value()) ? DISABLED_RULE : not(DISABLED_RULE);
      case EXISTS -> present("userAccountControl");
      case NOT_EXISTS -> absent("userAccountControl");
      default ->
          throw new CompileException(
              "Operator " + clause.operator().wireName() + " cannot be applied to 'enabled'");
    };
  }

  private String format(FieldDescriptor field, Object value) {
    return switch (field.semanticType()) {
      case BOOLEAN -> ((Boolean) value) ? "TRUE" : "FALSE";
      case INTEGER -> value.toString();
      case DATETIME -> formatDate(field.nativeName(), (Instant) value);
      case STRING, REFERENCE, ARRAY -> escape(value);
    };
  }

  private static String formatDate(String attribute, Instant instant) {
    return LdapSyntax.isFileTimeAttribute(attribute)
        ? String.valueOf(LdapSyntax.toFileTime(instant))
        : LdapSyntax.toGeneralizedTime(instant);
  }

  private static String escape(Object value) {
    return LdapSyntax.escapeFilterValue(value.toString());
  }

  private static boolean isBlank(Object value) {
    return value instanceof String s && s.isEmpty();
  }

  private static String eq(String attr, String value) {
    return "(" + attr + "=" + value + ")";
  }

  private static String cmp(String attr, String op, String value) {
    return "(" + attr + op + value + ")";
  }

  private static String present(String attr) {
    return "(" + attr + "=*)";
  }

  private static String absent(String attr) {
    return not(present(attr));
  }

  private static String not(String expression) {
    return "(!" + expression + ")";
  }
}
