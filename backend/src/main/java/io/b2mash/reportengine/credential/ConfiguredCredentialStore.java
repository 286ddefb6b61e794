package io.b2mash.reportengine.credential;

import org.springframework.stereotype.Component;

/**
 * Serves credentials from {@code report-engine.credentials.entries}. A deployment backed by a
 * secret manager replaces this bean with its own {@link CredentialStore}.
 */
@Component
public class ConfiguredCredentialStore implements CredentialStore {

  private final CredentialProperties properties;

  public ConfiguredCredentialStore(CredentialProperties properties) {
    this.properties = properties;
  }

  @Override
  public Credential getCredential(String credentialId) {
    var entry = properties.entries().get(credentialId);
    if (entry == null) {
      throw new CredentialUnavailableException(credentialId, "no such credential");
    }
    return new Credential(credentialId, entry.source(), entry.version(), entry.properties());
  }
}
