package io.b2mash.reportengine.engine;

import io.b2mash.reportengine.execution.ExecutionWarning;
import io.b2mash.reportengine.execution.GroupSummary;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One page of a completed execution's rows.
 *
 * @param totalRows rows held for the execution; a lower bound when the backend paged natively
 * @param generatedAt when the rows were fetched from the backend; identical across cache replays
 */
public record ResultsPage(
    UUID executionId,
    int page,
    int pageSize,
    int totalRows,
    List<Map<String, Object>> rows,
    List<GroupSummary> groups,
    List<ExecutionWarning> warnings,
    boolean truncated,
    Instant generatedAt) {

  public boolean hasNext() {
    return (long) page * pageSize < totalRows;
  }
}
