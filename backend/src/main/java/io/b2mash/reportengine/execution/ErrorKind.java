package io.b2mash.reportengine.execution;

/** Why an execution did not complete. Stored on failed and cancelled execution records. */
public enum ErrorKind {
  VALIDATION,
  COMPILE,
  CONNECTION_FAILED,
  AUTH_FAILED,
  TIMEOUT,
  CANCELLED,
  INTERNAL
}
