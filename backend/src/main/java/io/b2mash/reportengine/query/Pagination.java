package io.b2mash.reportengine.query;

/**
 * One-based page window over a result set.
 *
 * @param page page number, starting at 1
 * @param pageSize rows per page
 */
public record Pagination(int page, int pageSize) {

  public Pagination {
    if (page < 1) {
      throw new IllegalArgumentException("page must be >= 1, was " + page);
    }
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be >= 1, was " + pageSize);
    }
  }

  public long offset() {
    return (long) (page - 1) * pageSize;
  }

  /** Number of rows that must be available to serve this page completely. */
  public long rowsNeeded() {
    return (long) page * pageSize;
  }
}
