package io.b2mash.reportengine.catalog;

import java.util.List;

/** Fields read from a backend before they are versioned into a {@link FieldCatalog}. */
public record SchemaSnapshot(List<FieldDescriptor> fields, List<CatalogWarning> warnings) {

  public SchemaSnapshot {
    fields = List.copyOf(fields);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }
}
