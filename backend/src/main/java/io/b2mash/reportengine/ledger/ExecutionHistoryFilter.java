package io.b2mash.reportengine.ledger;

import io.b2mash.reportengine.source.SourceKind;
import java.time.Instant;
import java.util.UUID;

/**
 * Optional criteria for listing execution history. {@code null} components match everything.
 *
 * @param submittedFrom inclusive lower bound on submission time
 * @param submittedTo exclusive upper bound on submission time
 */
public record ExecutionHistoryFilter(
    SourceKind source,
    ExecutionStatus status,
    UUID customReportId,
    Instant submittedFrom,
    Instant submittedTo) {

  public static ExecutionHistoryFilter none() {
    return new ExecutionHistoryFilter(null, null, null, null, null);
  }
}
