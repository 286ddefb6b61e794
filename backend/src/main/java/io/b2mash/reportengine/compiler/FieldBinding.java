package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.catalog.FieldDescriptor;
import io.b2mash.reportengine.catalog.SemanticType;

/** Maps a catalog field to the backend attribute a fetched record carries it under. */
public record FieldBinding(String name, String nativeName, SemanticType semanticType) {

  public static FieldBinding of(FieldDescriptor field) {
    return new FieldBinding(field.name(), field.nativeName(), field.semanticType());
  }
}
