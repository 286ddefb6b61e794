package io.b2mash.reportengine.execution;

import io.b2mash.reportengine.catalog.RemoteSchema;
import io.b2mash.reportengine.compiler.NativeQuery;

/**
 * An authenticated session with one backend. Not thread-safe, except for {@link #abort()}, which
 * may be called from any thread to break an in-flight call.
 */
public interface SourceConnection extends AutoCloseable {

  /** Reads attribute definitions. Unreadable attribute groups are reported, not thrown. */
  RemoteSchema readSchema();

  /**
   * Fetches the next batch of records.
   *
   * @param continuationToken token from the previous page, {@code null} for the first page
   * @param batchSize preferred number of records; backends may return fewer or more
   */
  FetchedPage fetch(NativeQuery query, String continuationToken, int batchSize);

  /** Breaks the current call. The connection is unusable afterwards. */
  void abort();

  boolean isOpen();

  @Override
  void close();
}
