package io.b2mash.reportengine.execution;

/** The backend rejected the credential. Never retried. */
public class BackendAuthException extends BackendException {

  public BackendAuthException(String message) {
    super(message);
  }

  public BackendAuthException(String message, Throwable cause) {
    super(message, cause);
  }
}
