package io.b2mash.reportengine.engine;

import io.b2mash.reportengine.query.RawQueryRequest;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * A request to run either an ad hoc query or a saved custom report.
 *
 * @param query the ad hoc query; {@code null} when running a custom report
 * @param customReportId the saved report to run; {@code null} for ad hoc queries
 * @param parameters parameter overrides layered over the query's own parameters
 * @param credentialId credential to run under; for custom reports defaults to the report's own
 * @param timeout requested timeout, clamped by the engine; {@code null} for the default
 */
public record ExecutionRequest(
    String ownerId,
    RawQueryRequest query,
    UUID customReportId,
    Map<String, Object> parameters,
    String credentialId,
    Duration timeout) {

  public static ExecutionRequest forQuery(
      String ownerId, RawQueryRequest query, String credentialId, Duration timeout) {
    return new ExecutionRequest(ownerId, query, null, Map.of(), credentialId, timeout);
  }

  public static ExecutionRequest forCustomReport(
      String ownerId,
      UUID customReportId,
      Map<String, Object> parameters,
      String credentialId,
      Duration timeout) {
    return new ExecutionRequest(
        ownerId, null, customReportId, parameters, credentialId, timeout);
  }

  public boolean isCustomReport() {
    return customReportId != null;
  }
}
