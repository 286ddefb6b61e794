package io.b2mash.reportengine.query;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Query limits.
 *
 * @param defaultPageSize page size used when a request omits one
 * @param maxPageSize largest page size a request may ask for
 */
@ConfigurationProperties(prefix = "report-engine.query")
public record QueryProperties(Integer defaultPageSize, Integer maxPageSize) {

  public QueryProperties {
    defaultPageSize = defaultPageSize == null ? 50 : defaultPageSize;
    maxPageSize = maxPageSize == null ? 1000 : maxPageSize;
  }
}
