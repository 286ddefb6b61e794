package io.b2mash.reportengine.execution;

/** The backend could not be reached or dropped the connection. Retryable. */
public class BackendUnavailableException extends BackendException {

  public BackendUnavailableException(String message) {
    super(message);
  }

  public BackendUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
