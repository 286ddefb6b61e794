package io.b2mash.reportengine.credential;

/**
 * Resolves stored backend credentials. Storage and encryption at rest belong to the implementing
 * module; the engine only reads.
 */
public interface CredentialStore {

  /**
   * Loads the current version of a credential.
   *
   * @param credentialId the stored credential identifier
   * @return the decrypted credential
   * @throws CredentialUnavailableException if the credential does not exist or cannot be read
   */
  Credential getCredential(String credentialId);
}
