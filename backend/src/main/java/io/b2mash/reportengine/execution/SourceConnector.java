package io.b2mash.reportengine.execution;

import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.source.SourceKind;

/** Opens connections to the backend of one source. */
public interface SourceConnector {

  SourceKind source();

  /**
   * @throws BackendAuthException if the backend rejects the credential
   * @throws BackendUnavailableException if the backend cannot be reached
   */
  SourceConnection open(Credential credential);
}
