package io.b2mash.reportengine.cache;

import io.b2mash.reportengine.execution.ExecutionWarning;
import io.b2mash.reportengine.execution.GroupSummary;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A materialized result set. Holds every row the execution produced, so any page within it can be
 * served without going back to the backend.
 */
public record CacheEntry(
    String fingerprint,
    SourceKind source,
    String credentialId,
    List<Map<String, Object>> rows,
    List<ExecutionWarning> warnings,
    List<GroupSummary> groups,
    boolean truncated,
    Instant generatedAt,
    Instant expiresAt,
    long catalogVersion) {

  public CacheEntry {
    rows = List.copyOf(rows);
    warnings = List.copyOf(warnings);
    groups = List.copyOf(groups);
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  boolean belongsTo(SourceKind source, String credentialId) {
    return this.source == source && this.credentialId.equals(credentialId);
  }
}
