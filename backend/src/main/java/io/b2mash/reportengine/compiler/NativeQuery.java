package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.query.Pagination;
import io.b2mash.reportengine.source.SourceKind;
import java.util.List;

/** A query in the form one backend executes, together with the work left for the engine. */
public interface NativeQuery {

  SourceKind source();

  /** Catalog fields in output order. Result rows carry exactly these keys. */
  List<String> selectedFields();

  /** Every field the fetched records must carry, including those only used after fetching. */
  List<FieldBinding> bindings();

  Pagination pagination();

  PostFetchPlan postFetch();

  List<CompilerWarning> warnings();

  /** Whether fetching may stop once the requested page is covered. */
  default boolean stopsAtRequestedPage() {
    return !postFetch().requiresFullFetch();
  }

  /**
   * Stable text form used to fingerprint the query. Two queries with the same canonical form
   * return the same rows from the same backend state.
   */
  String canonicalForm();
}
