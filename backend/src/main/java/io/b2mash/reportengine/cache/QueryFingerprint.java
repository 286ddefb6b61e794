package io.b2mash.reportengine.cache;

import io.b2mash.reportengine.source.SourceKind;

/**
 * Identity of a result set: a SHA-256 hex digest plus the (source, credential) scope it belongs to,
 * so that scope invalidation does not need to parse the digest.
 */
public record QueryFingerprint(String value, SourceKind source, String credentialId) {

  @Override
  public String toString() {
    return value;
  }
}
