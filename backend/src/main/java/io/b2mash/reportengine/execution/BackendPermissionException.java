package io.b2mash.reportengine.execution;

/** The credential is valid but lacks rights for the requested data. Never retried. */
public class BackendPermissionException extends BackendException {

  public BackendPermissionException(String message) {
    super(message);
  }

  public BackendPermissionException(String message, Throwable cause) {
    super(message, cause);
  }
}
