package io.b2mash.reportengine.execution.connector;

import io.b2mash.reportengine.catalog.CatalogWarning;
import io.b2mash.reportengine.catalog.RemoteAttribute;
import io.b2mash.reportengine.catalog.RemoteSchema;
import io.b2mash.reportengine.catalog.SemanticType;
import io.b2mash.reportengine.compiler.GraphApiQuery;
import io.b2mash.reportengine.compiler.NativeQuery;
import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.execution.BackendUnavailableException;
import io.b2mash.reportengine.execution.FetchedPage;
import io.b2mash.reportengine.execution.RawRecord;
import io.b2mash.reportengine.execution.SourceConnection;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * One authenticated session against the cloud directory. Pages are followed through
 * {@code @odata.nextLink}, which is used verbatim as the continuation token.
 */
class GraphApiConnection implements SourceConnection {

  private static final Logger log = LoggerFactory.getLogger(GraphApiConnection.class);

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
      new ParameterizedTypeReference<>() {};

  static final String NEXT_LINK = "@odata.nextLink";

  private final RestClient restClient;
  private final String baseUrl;
  private final GraphTokenClient tokenClient;
  private final Credential credential;
  private final Clock clock;
  private final InterruptibleCalls calls = new InterruptibleCalls();
  private GraphTokenClient.AccessToken token;
  private volatile boolean open = true;

  GraphApiConnection(
      RestClient restClient,
      String baseUrl,
      GraphTokenClient tokenClient,
      Credential credential,
      GraphTokenClient.AccessToken token,
      Clock clock) {
    this.restClient = restClient;
    this.baseUrl = baseUrl;
    this.tokenClient = tokenClient;
    this.credential = credential;
    this.token = token;
    this.clock = clock;
  }

  @Override
  public FetchedPage fetch(NativeQuery nativeQuery, String continuationToken, int batchSize) {
    if (!(nativeQuery instanceof GraphApiQuery query)) {
      throw new IllegalArgumentException("Expected a GraphApiQuery, got " + nativeQuery);
    }
    ensureOpen();
    var uri = continuationToken != null ? URI.create(continuationToken) : firstPageUri(query);
    Map<String, Object> body;
    try {
      body =
          calls.call(
              () ->
                  restClient
                      .get()
                      .uri(uri)
                      .headers(
                          h -> {
                            h.setBearerAuth(accessToken());
                            query.headers().forEach(h::set);
                          })
                      .accept(MediaType.APPLICATION_JSON)
                      .retrieve()
                      .body(JSON_OBJECT));
    } catch (RestClientException e) {
      ensureOpen();
      throw GraphHttp.translate(e, "User query");
    }
    ensureOpen();
    var records = new ArrayList<RawRecord>();
    if (body != null && body.get("value") instanceof List<?> values) {
      for (var value : values) {
        if (value instanceof Map<?, ?> entry) {
          records.add(RawRecord.of(stringKeys(entry)));
        }
      }
    }
    var next = body != null && body.get(NEXT_LINK) instanceof String link ? link : null;
    return new FetchedPage(records, next);
  }

  @Override
  public RemoteSchema readSchema() {
    ensureOpen();
    try {
      // fails with 401/403 when the app has no directory read permission
      calls.call(
          () ->
              restClient
                  .get()
                  .uri(baseUrl + "/users?$top=1&$select=id")
                  .headers(h -> h.setBearerAuth(accessToken()))
                  .retrieve()
                  .toBodilessEntity());
    } catch (RestClientException e) {
      ensureOpen();
      throw GraphHttp.translate(e, "Directory read check");
    }

    var attributes = new ArrayList<RemoteAttribute>();
    var warnings = new ArrayList<CatalogWarning>();
    try {
      var body =
          calls.call(
              () ->
                  restClient
                      .post()
                      .uri(baseUrl + "/directoryObjects/getAvailableExtensionProperties")
                      .headers(h -> h.setBearerAuth(accessToken()))
                      .contentType(MediaType.APPLICATION_JSON)
                      .body(Map.of("isSyncedFromOnPremises", false))
                      .retrieve()
                      .body(JSON_OBJECT));
      if (body != null && body.get("value") instanceof List<?> values) {
        for (var value : values) {
          if (value instanceof Map<?, ?> property && targetsUsers(property)) {
            attributes.add(
                new RemoteAttribute(
                    String.valueOf(property.get("name")), typeOf(property), "extension"));
          }
        }
      }
    } catch (RestClientException e) {
      ensureOpen();
      log.warn(
          "Could not read extension properties: credentialId={}, error={}",
          credential.id(),
          e.getMessage());
      warnings.add(new CatalogWarning("extensionProperties", e.getMessage()));
    }
    return new RemoteSchema(attributes, warnings);
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

  private URI firstPageUri(GraphApiQuery query) {
    var builder = UriComponentsBuilder.fromUriString(baseUrl + query.resource());
    query.queryParameters().forEach((name, value) -> builder.queryParam(name, value));
    return builder.build().encode().toUri();
  }

  private synchronized String accessToken() {
    if (token.expiresWithin(Instant.now(clock), 60)) {
      token = tokenClient.acquire(credential);
    }
    return token.value();
  }

  private void ensureOpen() {
    if (!open) {
      throw new BackendUnavailableException("Cloud directory connection was aborted");
    }
  }

  private static boolean targetsUsers(Map<?, ?> property) {
    return property.get("targetObjects") instanceof List<?> targets
        && targets.stream().anyMatch(t -> "User".equalsIgnoreCase(String.valueOf(t)));
  }

  private static SemanticType typeOf(Map<?, ?> property) {
    if (Boolean.TRUE.equals(property.get("isMultiValued"))) {
      return SemanticType.ARRAY;
    }
    return switch (String.valueOf(property.get("dataType"))) {
      case "Boolean" -> SemanticType.BOOLEAN;
      case "Integer", "LargeInteger" -> SemanticType.INTEGER;
      case "DateTime" -> SemanticType.DATETIME;
      default -> SemanticType.STRING;
    };
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> stringKeys(Map<?, ?> entry) {
    return (Map<String, Object>) entry;
  }
}
