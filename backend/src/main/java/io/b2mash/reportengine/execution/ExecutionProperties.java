package io.b2mash.reportengine.execution;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Execution engine settings.
 *
 * @param defaultTimeout timeout applied when a request gives none
 * @param maxTimeout upper bound on caller supplied timeouts
 * @param maxResultRows hard ceiling on rows materialized by one execution
 * @param fetchBatchSize records requested per backend page
 * @param retry retry policy for transient backend failures
 * @param pool connection pool sizing
 * @param workers worker pool running submitted executions
 */
@ConfigurationProperties(prefix = "report-engine.execution")
public record ExecutionProperties(
    Duration defaultTimeout,
    Duration maxTimeout,
    Integer maxResultRows,
    Integer fetchBatchSize,
    Retry retry,
    Pool pool,
    Workers workers) {

  public ExecutionProperties {
    defaultTimeout = defaultTimeout == null ? Duration.ofSeconds(60) : defaultTimeout;
    maxTimeout = maxTimeout == null ? Duration.ofMinutes(10) : maxTimeout;
    maxResultRows = maxResultRows == null ? 50_000 : maxResultRows;
    fetchBatchSize = fetchBatchSize == null ? 500 : fetchBatchSize;
    retry = retry == null ? new Retry(null, null, null, null) : retry;
    pool = pool == null ? new Pool(null, null, null) : pool;
    workers = workers == null ? new Workers(null, null, null, null) : workers;
  }

  /** Clamps a requested timeout into (0, maxTimeout], defaulting when absent. */
  public Duration effectiveTimeout(Duration requested) {
    if (requested == null || requested.isZero() || requested.isNegative()) {
      return defaultTimeout;
    }
    return requested.compareTo(maxTimeout) > 0 ? maxTimeout : requested;
  }

  public record Retry(
      Integer maxAttempts, Duration initialBackoff, Double multiplier, Duration maxBackoff) {

    public Retry {
      maxAttempts = maxAttempts == null ? 3 : maxAttempts;
      initialBackoff = initialBackoff == null ? Duration.ofMillis(500) : initialBackoff;
      multiplier = multiplier == null ? 2.0 : multiplier;
      maxBackoff = maxBackoff == null ? Duration.ofSeconds(5) : maxBackoff;
    }
  }

  public record Pool(Integer maxConnections, Duration acquireTimeout, Duration idleTimeout) {

    public Pool {
      maxConnections = maxConnections == null ? 5 : maxConnections;
      acquireTimeout = acquireTimeout == null ? Duration.ofSeconds(30) : acquireTimeout;
      idleTimeout = idleTimeout == null ? Duration.ofMinutes(5) : idleTimeout;
    }
  }

  public record Workers(
      Integer coreSize, Integer maxSize, Integer queueCapacity, Duration shutdownGrace) {

    public Workers {
      coreSize = coreSize == null ? 4 : coreSize;
      maxSize = maxSize == null ? 8 : maxSize;
      queueCapacity = queueCapacity == null ? 100 : queueCapacity;
      shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(30) : shutdownGrace;
    }
  }
}
