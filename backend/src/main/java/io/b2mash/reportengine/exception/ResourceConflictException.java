package io.b2mash.reportengine.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(HttpStatus.CONFLICT, Problems.of(HttpStatus.CONFLICT, title, detail), null);
  }

  /** Another resource of the same owner already uses {@code name}. */
  public static ResourceConflictException duplicateName(String resourceType, String name) {
    var exception =
        new ResourceConflictException(
            "Duplicate " + resourceType + " name",
            "A " + resourceType + " named '" + name + "' already exists");
    exception.getBody().setProperty("name", name);
    return exception;
  }
}
