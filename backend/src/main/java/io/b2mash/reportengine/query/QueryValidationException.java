package io.b2mash.reportengine.query;

import java.util.List;
import java.util.Map;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A query failed validation. Carries every violation found, not just the first. */
public class QueryValidationException extends ErrorResponseException {

  private static final HttpStatusCode UNPROCESSABLE = HttpStatusCode.valueOf(422);

  private final List<ValidationError> errors;

  public QueryValidationException(List<ValidationError> errors) {
    super(UNPROCESSABLE, createProblem(errors), null);
    this.errors = List.copyOf(errors);
  }

  public List<ValidationError> getErrors() {
    return errors;
  }

  private static ProblemDetail createProblem(List<ValidationError> errors) {
    var problem = ProblemDetail.forStatus(UNPROCESSABLE);
    problem.setTitle("Invalid query");
    problem.setDetail(errors.size() + " validation error(s) in query");
    problem.setProperty(
        "errors",
        errors.stream()
            .map(e -> Map.of("code", e.code().name(), "path", e.path(), "message", e.message()))
            .toList());
    return problem;
  }
}
