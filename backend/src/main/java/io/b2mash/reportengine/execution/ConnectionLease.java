package io.b2mash.reportengine.execution;

/**
 * A connection borrowed from a {@link ConnectionPool}. Closing the lease hands the connection back,
 * or closes it if it was discarded or is no longer open.
 */
public final class ConnectionLease implements AutoCloseable {

  private final ConnectionPool pool;
  private final SourceConnection connection;
  private volatile boolean discarded;
  private boolean released;

  ConnectionLease(ConnectionPool pool, SourceConnection connection) {
    this.pool = pool;
    this.connection = connection;
  }

  public SourceConnection connection() {
    return connection;
  }

  /** Marks the connection as unfit for reuse. */
  public void discard() {
    discarded = true;
  }

  public boolean isDiscarded() {
    return discarded;
  }

  @Override
  public void close() {
    if (released) {
      return;
    }
    released = true;
    pool.release(connection, discarded);
  }
}
