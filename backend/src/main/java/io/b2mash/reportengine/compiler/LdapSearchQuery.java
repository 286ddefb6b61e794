package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.query.Pagination;
import io.b2mash.reportengine.source.SourceKind;
import java.util.List;

/**
 * A paged subtree search against the directory.
 *
 * @param filter RFC 4515 search filter
 * @param attributes attributes to return, in request order
 */
public record LdapSearchQuery(
    String filter,
    List<String> attributes,
    List<String> selectedFields,
    List<FieldBinding> bindings,
    Pagination pagination,
    PostFetchPlan postFetch,
    List<CompilerWarning> warnings)
    implements NativeQuery {

  public LdapSearchQuery {
    attributes = List.copyOf(attributes);
    selectedFields = List.copyOf(selectedFields);
    bindings = List.copyOf(bindings);
    warnings = List.copyOf(warnings);
  }

  @Override
  public SourceKind source() {
    return SourceKind.DIRECTORY;
  }

  @Override
  public String canonicalForm() {
    return "ldap;filter="
        + filter
        + ";attributes="
        + String.join(",", attributes)
        + ";fields="
        + String.join(",", selectedFields)
        + ";limit="
        + (stopsAtRequestedPage() ? String.valueOf(pagination.rowsNeeded()) : "all")
        + ";post="
        + postFetch.canonicalForm();
  }
}
