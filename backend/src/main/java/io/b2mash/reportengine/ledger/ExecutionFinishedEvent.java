package io.b2mash.reportengine.ledger;

import io.b2mash.reportengine.execution.ErrorKind;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when an execution reaches a terminal state. Notification and export collaborators
 * listen for it.
 */
public record ExecutionFinishedEvent(
    UUID executionId,
    String ownerId,
    SourceKind source,
    UUID customReportId,
    ExecutionStatus status,
    int rowCount,
    boolean cacheHit,
    ErrorKind errorKind,
    String errorMessage,
    Instant occurredAt) {

  static ExecutionFinishedEvent of(ExecutionRecord record) {
    return new ExecutionFinishedEvent(
        record.getId(),
        record.getOwnerId(),
        record.getSource(),
        record.getCustomReportId(),
        record.getStatus(),
        record.getRowCount(),
        record.isCacheHit(),
        record.getErrorKind(),
        record.getErrorMessage(),
        record.getCompletedAt());
  }
}
