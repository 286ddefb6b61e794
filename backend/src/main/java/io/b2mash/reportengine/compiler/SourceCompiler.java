package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.catalog.FieldCatalog;
import io.b2mash.reportengine.query.QueryDefinition;
import io.b2mash.reportengine.source.SourceKind;

/**
 * Translates a {@link QueryDefinition} into a backend's native query. Implementations are pure:
 * the same definition, catalog and day always produce an equal result, and no connection is
 * opened.
 */
public interface SourceCompiler {

  SourceKind source();

  NativeQuery compile(QueryDefinition definition, FieldCatalog catalog);
}
