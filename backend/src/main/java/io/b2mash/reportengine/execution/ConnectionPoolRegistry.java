package io.b2mash.reportengine.execution;

import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.source.SourceKind;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * One {@link ConnectionPool} per (source, credential). A pool built for an older credential
 * version is retired when the rotated credential is first used.
 */
@Component
public class ConnectionPoolRegistry {

  private static final Logger log = LoggerFactory.getLogger(ConnectionPoolRegistry.class);

  private final Map<SourceKind, SourceConnector> connectors;
  private final ExecutionProperties.Pool poolProperties;
  private final Clock clock;
  private final ConcurrentHashMap<PoolKey, ConnectionPool> pools = new ConcurrentHashMap<>();

  public ConnectionPoolRegistry(
      List<SourceConnector> connectors, ExecutionProperties properties, Clock clock) {
    var bySource = new EnumMap<SourceKind, SourceConnector>(SourceKind.class);
    for (var connector : connectors) {
      if (bySource.putIfAbsent(connector.source(), connector) != null) {
        throw new IllegalStateException("Duplicate connector for " + connector.source());
      }
    }
    this.connectors = bySource;
    this.poolProperties = properties.pool();
    this.clock = clock;
  }

  /** Borrows a connection for the credential's source. */
  public ConnectionLease lease(Credential credential) {
    return poolFor(credential).acquire(poolProperties.acquireTimeout());
  }

  ConnectionPool poolFor(Credential credential) {
    var connector = connectors.get(credential.source());
    if (connector == null) {
      throw new IllegalStateException("No connector registered for " + credential.source());
    }
    var key = new PoolKey(credential.source(), credential.id());
    return pools.compute(
        key,
        (k, existing) -> {
          if (existing != null && existing.credential().version() == credential.version()) {
            return existing;
          }
          if (existing != null) {
            log.info(
                "Retiring connection pool after credential rotation: source={}, credentialId={},"
                    + " oldVersion={}, newVersion={}",
                k.source().slug(),
                k.credentialId(),
                existing.credential().version(),
                credential.version());
            existing.close();
          }
          return new ConnectionPool(
              connector,
              credential,
              poolProperties.maxConnections(),
              poolProperties.idleTimeout(),
              clock);
        });
  }

  /** Closes and forgets the pool of a credential, e.g. after the credential is deleted. */
  public void retire(SourceKind source, String credentialId) {
    var pool = pools.remove(new PoolKey(source, credentialId));
    if (pool != null) {
      pool.close();
    }
  }

  @Scheduled(fixedDelayString = "${report-engine.execution.pool.eviction-interval-ms:60000}")
  public void evictIdleConnections() {
    int evicted = 0;
    for (var pool : pools.values()) {
      evicted += pool.evictIdle();
    }
    if (evicted > 0) {
      log.debug("Evicted {} idle connection(s) across {} pool(s)", evicted, pools.size());
    }
  }

  @PreDestroy
  public void shutdown() {
    log.info("Closing {} connection pool(s)", pools.size());
    pools.values().forEach(ConnectionPool::close);
    pools.clear();
  }

  private record PoolKey(SourceKind source, String credentialId) {}
}
