package io.b2mash.reportengine.execution;

/** A backend call failed. Subclasses tell the engine whether retrying can help. */
public class BackendException extends RuntimeException {

  public BackendException(String message) {
    super(message);
  }

  public BackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
