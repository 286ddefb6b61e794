package io.b2mash.reportengine.source;

import java.util.EnumSet;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Which sources accept queries. A disabled source still appears in {@link SourceKind} but every
 * query against it is rejected by validation.
 *
 * @param enabled sources open for querying; all sources when unset
 */
@ConfigurationProperties(prefix = "report-engine.sources")
public record SourceProperties(Set<SourceKind> enabled) {

  public SourceProperties {
    enabled =
        enabled == null || enabled.isEmpty()
            ? EnumSet.allOf(SourceKind.class)
            : EnumSet.copyOf(enabled);
  }

  public boolean isEnabled(SourceKind source) {
    return enabled.contains(source);
  }
}
