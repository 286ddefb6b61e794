package io.b2mash.reportengine.credential;

import io.b2mash.reportengine.source.SourceKind;
import java.util.Map;
import java.util.Optional;

/**
 * A backend credential as handed out by the {@link CredentialStore}. The version changes whenever
 * the secret material is rotated, which retires pooled connections and cached results built with
 * the old material.
 */
public record Credential(
    String id, SourceKind source, long version, Map<String, String> properties) {

  public Credential {
    properties = properties == null ? Map.of() : Map.copyOf(properties);
  }

  public Optional<String> property(String key) {
    return Optional.ofNullable(properties.get(key));
  }

  public String requireProperty(String key) {
    return property(key)
        .orElseThrow(
            () ->
                new CredentialUnavailableException(
                    id, "credential is missing required property '" + key + "'"));
  }

  @Override
  public String toString() {
    return "Credential[id=" + id + ", source=" + source + ", version=" + version + "]";
  }
}
