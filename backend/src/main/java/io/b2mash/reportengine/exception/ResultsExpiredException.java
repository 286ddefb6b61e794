package io.b2mash.reportengine.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** Results of a completed execution are no longer held by the result cache. */
public class ResultsExpiredException extends ErrorResponseException {

  public ResultsExpiredException(UUID executionId) {
    super(
        HttpStatus.GONE,
        Problems.of(
            HttpStatus.GONE,
            "Results expired",
            "Results for execution "
                + executionId
                + " have expired or were invalidated; run the query again"),
        null);
    getBody().setProperty("executionId", executionId.toString());
  }
}
