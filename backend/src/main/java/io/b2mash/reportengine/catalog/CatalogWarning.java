package io.b2mash.reportengine.catalog;

/**
 * A part of the backend schema that discovery could not read. The catalog is still usable but is
 * missing the fields of {@code attributeGroup}.
 */
public record CatalogWarning(String attributeGroup, String message) {}
