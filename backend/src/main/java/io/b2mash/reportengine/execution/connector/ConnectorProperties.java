package io.b2mash.reportengine.execution.connector;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backend endpoints and network timeouts.
 *
 * @param graph cloud directory and usage report API settings
 * @param ldap directory settings
 */
@ConfigurationProperties(prefix = "report-engine.connectors")
public record ConnectorProperties(Graph graph, Ldap ldap) {

  public ConnectorProperties {
    graph = graph == null ? new Graph(null, null, null, null, null) : graph;
    ldap = ldap == null ? new Ldap(null, null) : ldap;
  }

  public record Graph(
      String baseUrl,
      String authorityUrl,
      String scope,
      Duration connectTimeout,
      Duration readTimeout) {

    public Graph {
      baseUrl = baseUrl == null ? "https://graph.microsoft.com/v1.0" : baseUrl;
      authorityUrl = authorityUrl == null ? "https://login.microsoftonline.com" : authorityUrl;
      scope = scope == null ? "https://graph.microsoft.com/.default" : scope;
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofSeconds(60) : readTimeout;
    }
  }

  public record Ldap(Duration connectTimeout, Duration readTimeout) {

    public Ldap {
      connectTimeout = connectTimeout == null ? Duration.ofSeconds(10) : connectTimeout;
      readTimeout = readTimeout == null ? Duration.ofSeconds(60) : readTimeout;
    }
  }
}
