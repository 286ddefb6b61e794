package io.b2mash.reportengine.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.reportengine.execution.ErrorKind;
import io.b2mash.reportengine.source.SourceKind;
import io.b2mash.reportengine.testutil.TestEntities;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ExecutionRecordTest {

  private static final Instant SUBMITTED = Instant.parse("2024-06-15T10:00:00Z");

  @Test
  void newRecord_isPending() {
    var record = record();

    assertThat(record.getStatus()).isEqualTo(ExecutionStatus.PENDING);
    assertThat(record.getSubmittedAt()).isEqualTo(SUBMITTED);
    assertThat(record.getStartedAt()).isNull();
    assertThat(record.getWarnings()).isEmpty();
  }

  @Test
  void complete_recordsOutcome() {
    var record = record();
    record.markRunning(SUBMITTED.plusSeconds(1));

    record.complete(
        50,
        false,
        List.of(Map.of("code", "ATTRIBUTE_UNREADABLE", "rowIndex", 7)),
        true,
        SUBMITTED.plusSeconds(3));

    assertThat(record.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
    assertThat(record.getRowCount()).isEqualTo(50);
    assertThat(record.getWarnings()).hasSize(1);
    assertThat(record.isCacheHit()).isTrue();
    assertThat(record.getStartedAt()).isEqualTo(SUBMITTED.plusSeconds(1));
    assertThat(record.getCompletedAt()).isEqualTo(SUBMITTED.plusSeconds(3));
    assertThat(record.getErrorKind()).isNull();
  }

  @Test
  void cancel_isAllowedBeforeStart() {
    var record = record();

    record.cancel("Cancelled before it started", SUBMITTED.plusSeconds(1));

    assertThat(record.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
    assertThat(record.getErrorKind()).isEqualTo(ErrorKind.CANCELLED);
  }

  @Test
  void fail_isRejectedBeforeStart() {
    var id = UUID.randomUUID();
    var record = TestEntities.withId(record(), id);

    assertThatThrownBy(() -> record.fail(ErrorKind.TIMEOUT, "too slow", SUBMITTED))
        .isInstanceOfSatisfying(
            IllegalExecutionTransitionException.class,
            e -> {
              assertThat(e.getExecutionId()).isEqualTo(id);
              assertThat(e.getFrom()).isEqualTo(ExecutionStatus.PENDING);
              assertThat(e.getTo()).isEqualTo(ExecutionStatus.FAILED);
            });
  }

  @Test
  void terminalRecord_rejectsFurtherTransitions() {
    var record = record();
    record.markRunning(SUBMITTED);
    record.fail(ErrorKind.CONNECTION_FAILED, "unreachable", SUBMITTED.plusSeconds(2));

    assertThatThrownBy(() -> record.cancel("late", SUBMITTED.plusSeconds(3)))
        .isInstanceOf(IllegalExecutionTransitionException.class);
    assertThatThrownBy(() -> record.markRunning(SUBMITTED.plusSeconds(3)))
        .isInstanceOf(IllegalExecutionTransitionException.class);
    assertThat(record.getStatus()).isEqualTo(ExecutionStatus.FAILED);
    assertThat(record.getErrorMessage()).isEqualTo("unreachable");
  }

  @Test
  void status_allowsOnlyForwardTransitions() {
    assertThat(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.RUNNING)).isTrue();
    assertThat(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.COMPLETED)).isFalse();
    assertThat(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.PENDING)).isFalse();
    assertThat(ExecutionStatus.COMPLETED.isTerminal()).isTrue();
    assertThat(ExecutionStatus.RUNNING.isTerminal()).isFalse();
  }

  private static ExecutionRecord record() {
    return new ExecutionRecord(
        "f".repeat(64),
        SourceKind.DIRECTORY,
        "corp-ldap",
        "user_1",
        null,
        Map.of("source", "directory"),
        SUBMITTED);
  }
}
