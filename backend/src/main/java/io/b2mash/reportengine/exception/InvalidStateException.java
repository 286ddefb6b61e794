package io.b2mash.reportengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/** The request cannot be served in the current state of the engine or of the resource. */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, Problems.of(HttpStatus.BAD_REQUEST, title, detail), null);
  }

  public InvalidStateException(String title, String detail, Throwable cause) {
    super(HttpStatus.BAD_REQUEST, Problems.of(HttpStatus.BAD_REQUEST, title, detail), cause);
  }
}
