package io.b2mash.reportengine.execution.connector;

import io.b2mash.reportengine.execution.BackendAuthException;
import io.b2mash.reportengine.execution.BackendException;
import io.b2mash.reportengine.execution.BackendPermissionException;
import io.b2mash.reportengine.execution.BackendUnavailableException;
import java.net.http.HttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.json.JsonMapper;

/** RestClient setup and error mapping shared by the Graph based connectors. */
final class GraphHttp {

  private static final Logger log = LoggerFactory.getLogger(GraphHttp.class);

  private static final JsonMapper JSON = JsonMapper.builder().build();

  private GraphHttp() {}

  static RestClient restClient(ConnectorProperties.Graph properties) {
    var httpClient =
        HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());
    return RestClient.builder().requestFactory(requestFactory).build();
  }

  /** Maps a failed call onto the backend exception family the engine retries on. */
  static BackendException translate(RestClientException e, String operation) {
    if (e instanceof RestClientResponseException response) {
      int status = response.getStatusCode().value();
      var detail = operation + " failed with HTTP " + status + ": " + errorCode(response);
      if (status == 401) {
        return new BackendAuthException(detail, e);
      }
      if (status == 403) {
        return new BackendPermissionException(detail, e);
      }
      if (status == 408 || status == 429 || status >= 500) {
        return new BackendUnavailableException(detail, e);
      }
      return new BackendException(detail, e);
    }
    if (e instanceof ResourceAccessException) {
      return new BackendUnavailableException(operation + " failed: " + e.getMessage(), e);
    }
    return new BackendException(operation + " failed: " + e.getMessage(), e);
  }

  /** The top level {@code error.code} of a Graph error body, else the HTTP status text. */
  static String errorCode(RestClientResponseException response) {
    var body = response.getResponseBodyAsString();
    if (body.isBlank()) {
      return response.getStatusText();
    }
    try {
      JsonNode code = JSON.readTree(body).path("error").path("code");
      if (code.isMissingNode() || code.isNull() || code.asText().isBlank()) {
        return response.getStatusText();
      }
      return code.asText();
    } catch (JacksonException e) {
      log.debug("{} error body is not JSON: {}", response.getStatusCode(), e.getMessage());
      return response.getStatusText();
    }
  }
}
