package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.catalog.FieldCatalog;
import io.b2mash.reportengine.catalog.FieldDescriptor;
import io.b2mash.reportengine.catalog.FilterOperator;
import io.b2mash.reportengine.query.FilterClause;
import io.b2mash.reportengine.query.QueryDefinition;
import io.b2mash.reportengine.query.QueryValidator;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/** Field resolution and date arithmetic shared by the source compilers. */
abstract class AbstractSourceCompiler implements SourceCompiler {

  private final Clock clock;

  protected AbstractSourceCompiler(Clock clock) {
    this.clock = clock;
  }

  protected FieldDescriptor field(FieldCatalog catalog, String name) {
    return catalog
        .find(name)
        .orElseThrow(
            () ->
                new CompileException(
                    "Field '"
                        + name
                        + "' is not in catalog version "
                        + catalog.getVersion()
                        + " of "
                        + catalog.getSource().slug()));
  }

  protected void requireSource(QueryDefinition definition, FieldCatalog catalog) {
    if (definition.source() != source() || catalog.getSource() != source()) {
      throw new CompileException(
          getClass().getSimpleName()
              + " cannot compile a "
              + definition.source()
              + " query against a "
              + catalog.getSource()
              + " catalog");
    }
  }

  /** Selected fields first, then fields used by filters, grouping and ordering. */
  protected List<FieldBinding> bindings(QueryDefinition definition, FieldCatalog catalog) {
    var names = new LinkedHashMap<String, FieldBinding>();
    var referenced = new ArrayList<>(definition.selectedFields());
    definition.filters().forEach(f -> referenced.add(f.field()));
    if (definition.groupBy() != null) {
      referenced.add(definition.groupBy());
    }
    if (definition.orderBy() != null) {
      referenced.add(definition.orderBy().field());
    }
    for (var name : referenced) {
      names.computeIfAbsent(name, n -> FieldBinding.of(field(catalog, n)));
    }
    return List.copyOf(names.values());
  }

  /**
   * Rewrites age filters as absolute comparisons so the post-fetch plan carries no clock
   * dependency.
   */
  protected FilterClause resolveRelative(FilterClause clause) {
    return switch (clause.operator()) {
      case OLDER_THAN ->
          new FilterClause(
              clause.field(), FilterOperator.LESS_OR_EQUAL, cutoff((Long) clause.value()));
      case NEWER_THAN ->
          new FilterClause(
              clause.field(), FilterOperator.GREATER_OR_EQUAL, cutoff((Long) clause.value()));
      default -> clause;
    };
  }

  /**
   * Start of the current UTC day minus {@code days}. Age filters resolve against the day, not the
   * instant, so a query compiles identically all day.
   */
  protected Instant cutoff(long days) {
    if (days < 0 || days > QueryValidator.MAX_RELATIVE_DAYS) {
      throw new CompileException("Relative date of " + days + " days is out of range");
    }
    return LocalDate.now(clock.withZone(ZoneOffset.UTC))
        .minusDays(days)
        .atStartOfDay(ZoneOffset.UTC)
        .toInstant();
  }
}
