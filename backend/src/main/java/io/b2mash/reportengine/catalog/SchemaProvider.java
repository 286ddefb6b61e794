package io.b2mash.reportengine.catalog;

import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.source.SourceKind;

/** Reads the queryable fields of a backend. */
public interface SchemaProvider {

  /**
   * Reads the schema visible to {@code credential}. Attribute groups that cannot be read are
   * reported as warnings on the snapshot instead of failing the call.
   *
   * @throws CatalogDiscoveryException if the backend is unreachable or denies schema access
   */
  SchemaSnapshot readSchema(SourceKind source, Credential credential);
}
