package io.b2mash.reportengine.catalog;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Field catalog settings.
 *
 * @param ttl age after which a cached catalog is rediscovered on next use
 */
@ConfigurationProperties(prefix = "report-engine.catalog")
public record CatalogProperties(Duration ttl) {

  public CatalogProperties {
    ttl = ttl == null ? Duration.ofHours(1) : ttl;
  }
}
