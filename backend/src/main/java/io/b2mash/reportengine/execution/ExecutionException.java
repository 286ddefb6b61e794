package io.b2mash.reportengine.execution;

/** Terminal failure of a native query execution. */
public class ExecutionException extends RuntimeException {

  private final ErrorKind kind;

  public ExecutionException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public static ExecutionException connectionFailed(String message, Throwable cause) {
    return new ExecutionException(ErrorKind.CONNECTION_FAILED, message, cause);
  }

  public static ExecutionException authFailed(String message, Throwable cause) {
    return new ExecutionException(ErrorKind.AUTH_FAILED, message, cause);
  }

  public static ExecutionException timeout(long timeoutMillis) {
    return new ExecutionException(
        ErrorKind.TIMEOUT, "Execution exceeded its timeout of " + timeoutMillis + " ms", null);
  }

  public static ExecutionException cancelled() {
    return new ExecutionException(ErrorKind.CANCELLED, "Execution was cancelled", null);
  }

  public ErrorKind getKind() {
    return kind;
  }
}
