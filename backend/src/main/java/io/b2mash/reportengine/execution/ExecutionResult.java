package io.b2mash.reportengine.execution;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Rows materialized by one execution, after post-fetch filtering, grouping and ordering. Rows
 * carry exactly the selected fields, in selection order.
 *
 * @param truncated whether the row ceiling cut the result short
 * @param elapsed wall time spent in the backend and in post-processing
 */
public record ExecutionResult(
    List<Map<String, Object>> rows,
    List<GroupSummary> groups,
    List<ExecutionWarning> warnings,
    boolean truncated,
    Duration elapsed) {

  public ExecutionResult {
    rows = List.copyOf(rows);
    groups = groups == null ? List.of() : List.copyOf(groups);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public boolean isPartial() {
    return !warnings.isEmpty();
  }
}
