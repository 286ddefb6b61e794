package io.b2mash.reportengine.customreport;

import io.b2mash.reportengine.query.RawQueryRequest;
import java.util.List;

/**
 * Fields of a custom report as supplied on create and update. On update, a {@code null} query
 * keeps the stored definition.
 */
public record CustomReportRequest(
    String name,
    String description,
    RawQueryRequest query,
    String credentialId,
    String category,
    List<String> tags) {}
