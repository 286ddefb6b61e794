package io.b2mash.reportengine.execution.connector;

import io.b2mash.reportengine.catalog.RemoteAttribute;
import io.b2mash.reportengine.catalog.RemoteSchema;
import io.b2mash.reportengine.catalog.SemanticType;
import io.b2mash.reportengine.compiler.FieldBinding;
import io.b2mash.reportengine.compiler.NativeQuery;
import io.b2mash.reportengine.compiler.UsageReportQuery;
import io.b2mash.reportengine.execution.BackendUnavailableException;
import io.b2mash.reportengine.execution.FetchedPage;
import io.b2mash.reportengine.execution.RawRecord;
import io.b2mash.reportengine.execution.SourceConnection;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Downloads usage reports. Each report arrives as a single page. */
class UsageReportConnection implements SourceConnection {

  /** Report used to read the column layout. */
  static final String SCHEMA_REPORT = "getOffice365ActiveUserDetail(period='D7')";

  private final RestClient restClient;
  private final String baseUrl;
  private final GraphTokenClient.AccessToken token;
  private final InterruptibleCalls calls = new InterruptibleCalls();
  private volatile boolean open = true;

  UsageReportConnection(RestClient restClient, String baseUrl, GraphTokenClient.AccessToken token) {
    this.restClient = restClient;
    this.baseUrl = baseUrl;
    this.token = token;
  }

  @Override
  public FetchedPage fetch(NativeQuery nativeQuery, String continuationToken, int batchSize) {
    if (!(nativeQuery instanceof UsageReportQuery query)) {
      throw new IllegalArgumentException("Expected a UsageReportQuery, got " + nativeQuery);
    }
    var csv = download(query.reportFunction());
    var arrayColumns =
        query.bindings().stream()
            .filter(b -> b.semanticType() == SemanticType.ARRAY)
            .map(FieldBinding::nativeName)
            .collect(Collectors.toSet());
    var records = new ArrayList<RawRecord>();
    for (var row : CsvReportParser.parse(csv)) {
      records.add(RawRecord.of(toAttributes(row, arrayColumns)));
    }
    return new FetchedPage(records, null);
  }

  @Override
  public RemoteSchema readSchema() {
    var attributes = new ArrayList<RemoteAttribute>();
    for (var column : CsvReportParser.header(download(SCHEMA_REPORT))) {
      attributes.add(new RemoteAttribute(column, typeOf(column), "usage"));
    }
    return new RemoteSchema(attributes, List.of());
  }

  @Override
  public void abort() {
    open = false;
    calls.abort();
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    open = false;
  }

  private String download(String reportFunction) {
    ensureOpen();
    String body;
    try {
      body =
          calls.call(
              () ->
                  restClient
                      .get()
                      .uri(URI.create(baseUrl + "/reports/" + reportFunction))
                      .headers(h -> h.setBearerAuth(token.value()))
                      .retrieve()
                      .body(String.class));
    } catch (RestClientException e) {
      ensureOpen();
      throw GraphHttp.translate(e, "Usage report download");
    }
    ensureOpen();
    return body != null ? body : "";
  }

  private void ensureOpen() {
    if (!open) {
      throw new BackendUnavailableException("Usage report connection was aborted");
    }
  }

  private static LinkedHashMap<String, Object> toAttributes(
      Map<String, String> row, Set<String> arrayColumns) {
    var attributes = new LinkedHashMap<String, Object>();
    row.forEach(
        (column, value) -> {
          if (value == null || value.isEmpty()) {
            attributes.put(column, null);
          } else if (arrayColumns.contains(column)) {
            var items =
                Arrays.stream(value.split("\\+")).map(String::trim).filter(s -> !s.isEmpty());
            attributes.put(column, items.toList());
          } else {
            attributes.put(column, value);
          }
        });
    return attributes;
  }

  private static SemanticType typeOf(String column) {
    if (column.startsWith("Is ") || column.startsWith("Has ")) {
      return SemanticType.BOOLEAN;
    }
    if (column.endsWith(" Date")) {
      return SemanticType.DATETIME;
    }
    return SemanticType.STRING;
  }
}
