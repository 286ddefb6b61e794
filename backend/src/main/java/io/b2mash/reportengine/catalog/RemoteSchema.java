package io.b2mash.reportengine.catalog;

import java.util.List;

/** Result of reading a backend's schema: readable attributes plus groups that failed. */
public record RemoteSchema(List<RemoteAttribute> attributes, List<CatalogWarning> unreadable) {

  public RemoteSchema {
    attributes = attributes == null ? List.of() : List.copyOf(attributes);
    unreadable = unreadable == null ? List.of() : List.copyOf(unreadable);
  }

  public static RemoteSchema empty() {
    return new RemoteSchema(List.of(), List.of());
  }
}
