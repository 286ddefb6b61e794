package io.b2mash.reportengine.catalog;

import io.b2mash.reportengine.source.SourceKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Schema discovery failed outright; no catalog could be built. */
public class CatalogDiscoveryException extends ErrorResponseException {

  public enum Reason {
    UNREACHABLE,
    PERMISSION_DENIED
  }

  private final Reason reason;
  private final SourceKind source;

  public CatalogDiscoveryException(
      SourceKind source, Reason reason, String message, Throwable cause) {
    super(statusFor(reason), createProblem(source, reason, message), cause);
    this.reason = reason;
    this.source = source;
  }

  public Reason getReason() {
    return reason;
  }

  public SourceKind getSource() {
    return source;
  }

  private static HttpStatus statusFor(Reason reason) {
    return reason == Reason.PERMISSION_DENIED ? HttpStatus.FORBIDDEN : HttpStatus.BAD_GATEWAY;
  }

  private static ProblemDetail createProblem(SourceKind source, Reason reason, String message) {
    var problem = ProblemDetail.forStatus(statusFor(reason));
    problem.setTitle("Schema discovery failed");
    problem.setDetail(source.slug() + ": " + message);
    problem.setProperty("reason", reason.name());
    return problem;
  }
}
