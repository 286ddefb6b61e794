package io.b2mash.reportengine.execution.connector;

import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.execution.SourceConnection;
import io.b2mash.reportengine.execution.SourceConnector;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Clock;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/** Connects to the productivity suite reporting API, which serves whole reports as CSV. */
@Component
public class UsageReportConnector implements SourceConnector {

  private final RestClient restClient;
  private final GraphTokenClient tokenClient;
  private final ConnectorProperties.Graph properties;

  public UsageReportConnector(ConnectorProperties properties, Clock clock) {
    this.properties = properties.graph();
    this.restClient = GraphHttp.restClient(this.properties);
    this.tokenClient = new GraphTokenClient(restClient, this.properties, clock);
  }

  @Override
  public SourceKind source() {
    return SourceKind.CLOUD_SUITE;
  }

  @Override
  public SourceConnection open(Credential credential) {
    var token = tokenClient.acquire(credential);
    return new UsageReportConnection(restClient, properties.baseUrl(), token);
  }
}
