package io.b2mash.reportengine.ledger;

/**
 * Lifecycle of an execution record.
 *
 * <ul>
 *   <li>PENDING → RUNNING (picked up by a worker)
 *   <li>PENDING → CANCELLED (cancelled before a worker started it)
 *   <li>RUNNING → COMPLETED, FAILED or CANCELLED
 * </ul>
 */
public enum ExecutionStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean canTransitionTo(ExecutionStatus target) {
    return switch (this) {
      case PENDING -> target == RUNNING || target == CANCELLED;
      case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
      case COMPLETED, FAILED, CANCELLED -> false;
    };
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}
