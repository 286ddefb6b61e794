package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.query.Pagination;
import io.b2mash.reportengine.source.SourceKind;
import java.util.List;

/**
 * A usage report download. The backend returns the whole report for a period; {@code statement}
 * describes what the engine evaluates over it.
 *
 * @param reportFunction report endpoint including its period argument
 * @param period reporting window, e.g. {@code D30}
 * @param statement SQL-like description of the selection, filtering, ordering and paging
 */
public record UsageReportQuery(
    String reportFunction,
    String period,
    String statement,
    List<String> selectedFields,
    List<FieldBinding> bindings,
    Pagination pagination,
    PostFetchPlan postFetch,
    List<CompilerWarning> warnings)
    implements NativeQuery {

  public UsageReportQuery {
    selectedFields = List.copyOf(selectedFields);
    bindings = List.copyOf(bindings);
    warnings = List.copyOf(warnings);
  }

  @Override
  public SourceKind source() {
    return SourceKind.CLOUD_SUITE;
  }

  /** The report always arrives whole. */
  @Override
  public boolean stopsAtRequestedPage() {
    return false;
  }

  @Override
  public String canonicalForm() {
    return "usage;" + reportFunction + ";" + statement + ";post=" + postFetch.canonicalForm();
  }
}
