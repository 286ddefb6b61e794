package io.b2mash.reportengine.execution;

import io.b2mash.reportengine.credential.Credential;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded set of connections opened with one credential. At most {@code maxConnections} are
 * leased at once; idle connections are reused most-recently-returned first and closed once they
 * sit unused longer than the idle timeout.
 */
public class ConnectionPool {

  private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);

  private final SourceConnector connector;
  private final Credential credential;
  private final Duration idleTimeout;
  private final Clock clock;
  private final int maxConnections;
  private final Semaphore permits;
  private final Deque<IdleConnection> idle = new ArrayDeque<>();
  private boolean closed;

  public ConnectionPool(
      SourceConnector connector,
      Credential credential,
      int maxConnections,
      Duration idleTimeout,
      Clock clock) {
    this.connector = connector;
    this.credential = credential;
    this.idleTimeout = idleTimeout;
    this.clock = clock;
    this.maxConnections = maxConnections;
    this.permits = new Semaphore(maxConnections, true);
  }

  /**
   * Borrows a connection, opening a new one if none is idle.
   *
   * @throws BackendUnavailableException if no connection frees up within {@code timeout}
   */
  public ConnectionLease acquire(Duration timeout) {
    try {
      if (!permits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        throw new BackendUnavailableException(
            "No " + connector.source().slug() + " connection available within " + timeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BackendUnavailableException("Interrupted while waiting for a connection", e);
    }
    try {
      var reused = pollIdle();
      if (reused != null) {
        return new ConnectionLease(this, reused);
      }
      var opened = connector.open(credential);
      log.debug(
          "Opened connection: source={}, credentialId={}",
          connector.source().slug(),
          credential.id());
      return new ConnectionLease(this, opened);
    } catch (RuntimeException e) {
      permits.release();
      throw e;
    }
  }

  void release(SourceConnection connection, boolean discard) {
    try {
      boolean keep;
      synchronized (this) {
        keep = !closed && !discard && connection.isOpen();
        if (keep) {
          idle.push(new IdleConnection(connection, Instant.now(clock)));
        }
      }
      if (!keep) {
        closeQuietly(connection);
      }
    } finally {
      permits.release();
    }
  }

  /** Closes connections idle for longer than the idle timeout. Returns how many were closed. */
  public int evictIdle() {
    var cutoff = Instant.now(clock).minus(idleTimeout);
    var expired = new ArrayList<SourceConnection>();
    synchronized (this) {
      idle.removeIf(
          c -> {
            if (c.returnedAt().isBefore(cutoff) || !c.connection().isOpen()) {
              expired.add(c.connection());
              return true;
            }
            return false;
          });
    }
    expired.forEach(this::closeQuietly);
    return expired.size();
  }

  /** Closes idle connections and makes every leased connection close on return. */
  public void close() {
    var toClose = new ArrayList<SourceConnection>();
    synchronized (this) {
      closed = true;
      idle.forEach(c -> toClose.add(c.connection()));
      idle.clear();
    }
    toClose.forEach(this::closeQuietly);
  }

  public synchronized int idleCount() {
    return idle.size();
  }

  public int leasedCount() {
    return maxConnections - permits.availablePermits();
  }

  public Credential credential() {
    return credential;
  }

  private synchronized SourceConnection pollIdle() {
    while (!idle.isEmpty()) {
      var candidate = idle.pop().connection();
      if (candidate.isOpen()) {
        return candidate;
      }
      closeQuietly(candidate);
    }
    return null;
  }

  private void closeQuietly(SourceConnection connection) {
    try {
      connection.close();
    } catch (RuntimeException e) {
      log.warn("Failed to close {} connection: {}", connector.source().slug(), e.getMessage());
    }
  }

  private record IdleConnection(SourceConnection connection, Instant returnedAt) {}
}
