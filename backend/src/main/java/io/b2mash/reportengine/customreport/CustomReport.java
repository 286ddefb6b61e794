package io.b2mash.reportengine.customreport;

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

/** A query definition saved by a user under a name, optionally with a default credential. */
@Entity
@Table(name = "custom_reports")
public class CustomReport {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false, length = 255)
  private String ownerId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "source", nullable = false, length = 30)
  private SourceKind source;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "query_definition", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> queryDefinition;

  @Column(name = "credential_id", length = 200)
  private String credentialId;

  @Column(name = "category", length = 100)
  private String category;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tags", nullable = false, columnDefinition = "jsonb")
  private List<String> tags = new ArrayList<>();

  @Column(name = "locked", nullable = false)
  private boolean locked;

  @Column(name = "execution_count", nullable = false)
  private long executionCount;

  @Column(name = "last_executed_at")
  private Instant lastExecutedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CustomReport() {}

  public CustomReport(
      String ownerId,
      String name,
      SourceKind source,
      Map<String, Object> queryDefinition,
      Instant now) {
    this.ownerId = ownerId;
    this.name = name;
    this.source = source;
    this.queryDefinition = queryDefinition;
    this.createdAt = now;
    this.updatedAt = now;
  }

  public void rename(String name, Instant now) {
    this.name = name;
    this.updatedAt = now;
  }

  public void updateDefinition(
      SourceKind source, Map<String, Object> queryDefinition, Instant now) {
    this.source = source;
    this.queryDefinition = queryDefinition;
    this.updatedAt = now;
  }

  public void updateDetails(
      String description, String credentialId, String category, List<String> tags, Instant now) {
    this.description = description;
    this.credentialId = credentialId;
    this.category = category;
    this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    this.updatedAt = now;
  }

  public void setLocked(boolean locked, Instant now) {
    this.locked = locked;
    this.updatedAt = now;
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public SourceKind getSource() {
    return source;
  }

  public Map<String, Object> getQueryDefinition() {
    return queryDefinition;
  }

  public String getCredentialId() {
    return credentialId;
  }

  public String getCategory() {
    return category;
  }

  public List<String> getTags() {
    return tags;
  }

  public boolean isLocked() {
    return locked;
  }

  public long getExecutionCount() {
    return executionCount;
  }

  public Instant getLastExecutedAt() {
    return lastExecutedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
