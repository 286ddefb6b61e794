package io.b2mash.reportengine.execution;

import java.util.List;

/**
 * A batch of records and the token to fetch the next one.
 *
 * @param nextToken opaque continuation token, {@code null} on the last page
 */
public record FetchedPage(List<RawRecord> records, String nextToken) {

  public FetchedPage {
    records = List.copyOf(records);
  }

  public boolean hasMore() {
    return nextToken != null;
  }
}
