package io.b2mash.reportengine.ledger;

import java.util.UUID;

/** An execution record was moved along a transition its state machine does not have. */
public class IllegalExecutionTransitionException extends IllegalStateException {

  private final UUID executionId;
  private final ExecutionStatus from;
  private final ExecutionStatus to;

  public IllegalExecutionTransitionException(
      UUID executionId, ExecutionStatus from, ExecutionStatus to) {
    super("Execution " + executionId + " cannot move from " + from + " to " + to);
    this.executionId = executionId;
    this.from = from;
    this.to = to;
  }

  public UUID getExecutionId() {
    return executionId;
  }

  public ExecutionStatus getFrom() {
    return from;
  }

  public ExecutionStatus getTo() {
    return to;
  }
}
