package io.b2mash.reportengine.execution.connector;

import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.execution.BackendAuthException;
import io.b2mash.reportengine.execution.BackendException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/** Client-credentials token requests against the identity authority. */
class GraphTokenClient {

  static final String TENANT_ID = "tenantId";
  static final String CLIENT_ID = "clientId";
  static final String CLIENT_SECRET = "clientSecret";

  private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
      new ParameterizedTypeReference<>() {};

  private final RestClient restClient;
  private final ConnectorProperties.Graph properties;
  private final Clock clock;

  GraphTokenClient(RestClient restClient, ConnectorProperties.Graph properties, Clock clock) {
    this.restClient = restClient;
    this.properties = properties;
    this.clock = clock;
  }

  record AccessToken(String value, Instant expiresAt) {

    boolean expiresWithin(Instant now, long seconds) {
      return !now.plusSeconds(seconds).isBefore(expiresAt);
    }
  }

  AccessToken acquire(Credential credential) {
    var form = new LinkedMultiValueMap<String, String>();
    form.add("grant_type", "client_credentials");
    form.add("client_id", credential.requireProperty(CLIENT_ID));
    form.add("client_secret", credential.requireProperty(CLIENT_SECRET));
    form.add("scope", properties.scope());
    var url =
        properties.authorityUrl()
            + "/"
            + credential.requireProperty(TENANT_ID)
            + "/oauth2/v2.0/token";
    Map<String, Object> response;
    try {
      response =
          restClient
              .post()
              .uri(url)
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(JSON_OBJECT);
    } catch (RestClientException e) {
      var translated = GraphHttp.translate(e, "Token request");
      // the authority answers 400 invalid_client for a bad secret
      if (translated.getClass() == BackendException.class) {
        throw new BackendAuthException(translated.getMessage(), e);
      }
      throw translated;
    }
    if (response == null || !(response.get("access_token") instanceof String token)) {
      throw new BackendAuthException("Token response did not contain an access token");
    }
    long expiresIn = response.get("expires_in") instanceof Number n ? n.longValue() : 3600L;
    return new AccessToken(token, Instant.now(clock).plusSeconds(expiresIn));
  }
}
