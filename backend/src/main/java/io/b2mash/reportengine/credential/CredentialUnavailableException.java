package io.b2mash.reportengine.credential;

public class CredentialUnavailableException extends RuntimeException {

  private final String credentialId;

  public CredentialUnavailableException(String credentialId, String message) {
    super("Credential " + credentialId + ": " + message);
    this.credentialId = credentialId;
  }

  public String getCredentialId() {
    return credentialId;
  }
}
