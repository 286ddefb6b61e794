package io.b2mash.reportengine.cache;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Result cache settings.
 *
 * @param ttl how long a result set is replayed before the backend is queried again
 * @param maxEntries upper bound on cached result sets; least recently used entries go first
 */
@ConfigurationProperties(prefix = "report-engine.cache")
public record CacheProperties(Duration ttl, Integer maxEntries) {

  public CacheProperties {
    ttl = ttl == null ? Duration.ofMinutes(15) : ttl;
    maxEntries = maxEntries == null ? 500 : maxEntries;
  }
}
