package io.b2mash.reportengine.credential;

import io.b2mash.reportengine.source.SourceKind;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials declared in configuration, keyed by credential id. Used when no external credential
 * store bean is present.
 */
@ConfigurationProperties(prefix = "report-engine.credentials")
public record CredentialProperties(Map<String, Entry> entries) {

  public CredentialProperties {
    entries = entries == null ? Map.of() : Map.copyOf(entries);
  }

  public record Entry(SourceKind source, long version, Map<String, String> properties) {}
}
