package io.b2mash.reportengine.ledger;

import io.b2mash.reportengine.execution.ErrorKind;
import io.b2mash.reportengine.source.SourceKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Audit trail of one query execution. Created PENDING at submission and moved through its
 * lifecycle by the execution coordinator only. Immutable once terminal.
 */
@Entity
@Table(name = "execution_records")
public class ExecutionRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "query_fingerprint", nullable = false, length = 64)
  private String queryFingerprint;

  @Enumerated(EnumType.STRING)
  @Column(name = "source", nullable = false, length = 30)
  private SourceKind source;

  @Column(name = "credential_id", nullable = false, length = 200)
  private String credentialId;

  @Column(name = "owner_id", nullable = false, length = 255)
  private String ownerId;

  @Column(name = "custom_report_id")
  private UUID customReportId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ExecutionStatus status;

  @Column(name = "submitted_at", nullable = false, updatable = false)
  private Instant submittedAt;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "row_count", nullable = false)
  private int rowCount;

  @Column(name = "truncated", nullable = false)
  private boolean truncated;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "warnings", nullable = false, columnDefinition = "jsonb")
  private List<Map<String, Object>> warnings = new ArrayList<>();

  @Column(name = "cache_hit", nullable = false)
  private boolean cacheHit;

  @Enumerated(EnumType.STRING)
  @Column(name = "error_kind", length = 30)
  private ErrorKind errorKind;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "query_definition", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> queryDefinition;

  protected ExecutionRecord() {}

  public ExecutionRecord(
      String queryFingerprint,
      SourceKind source,
      String credentialId,
      String ownerId,
      UUID customReportId,
      Map<String, Object> queryDefinition,
      Instant submittedAt) {
    this.queryFingerprint = queryFingerprint;
    this.source = source;
    this.credentialId = credentialId;
    this.ownerId = ownerId;
    this.customReportId = customReportId;
    this.queryDefinition = queryDefinition;
    this.submittedAt = submittedAt;
    this.status = ExecutionStatus.PENDING;
  }

  public void markRunning(Instant now) {
    transition(ExecutionStatus.RUNNING);
    this.startedAt = now;
  }

  public void complete(
      int rowCount,
      boolean truncated,
      List<Map<String, Object>> warnings,
      boolean cacheHit,
      Instant now) {
    transition(ExecutionStatus.COMPLETED);
    this.rowCount = rowCount;
    this.truncated = truncated;
    this.warnings = new ArrayList<>(warnings);
    this.cacheHit = cacheHit;
    this.completedAt = now;
  }

  public void fail(ErrorKind kind, String message, Instant now) {
    transition(ExecutionStatus.FAILED);
    this.errorKind = kind;
    this.errorMessage = message;
    this.completedAt = now;
  }

  public void cancel(String message, Instant now) {
    transition(ExecutionStatus.CANCELLED);
    this.errorKind = ErrorKind.CANCELLED;
    this.errorMessage = message;
    this.completedAt = now;
  }

  private void transition(ExecutionStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new IllegalExecutionTransitionException(id, status, target);
    }
    this.status = target;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getQueryFingerprint() {
    return queryFingerprint;
  }

  public SourceKind getSource() {
    return source;
  }

  public String getCredentialId() {
    return credentialId;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public UUID getCustomReportId() {
    return customReportId;
  }

  public ExecutionStatus getStatus() {
    return status;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public int getRowCount() {
    return rowCount;
  }

  public boolean isTruncated() {
    return truncated;
  }

  public List<Map<String, Object>> getWarnings() {
    return warnings;
  }

  public boolean isCacheHit() {
    return cacheHit;
  }

  public ErrorKind getErrorKind() {
    return errorKind;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Map<String, Object> getQueryDefinition() {
    return queryDefinition;
  }
}
