package io.b2mash.reportengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/** Builds the problem bodies shared by the engine's exceptions. */
final class Problems {

  private Problems() {}

  static ProblemDetail of(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
