package io.b2mash.reportengine.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

/**
 * A resource does not exist or is not visible to the caller. Records owned by someone else are
 * reported the same way as missing ones.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        Problems.of(
            HttpStatus.NOT_FOUND,
            resourceType + " not found",
            "No " + resourceType.toLowerCase(Locale.ROOT) + " found with id " + id),
        null);
    getBody().setProperty("resourceType", resourceType);
    getBody().setProperty("resourceId", String.valueOf(id));
  }

  private ResourceNotFoundException(String title, String detail, Throwable cause) {
    super(HttpStatus.NOT_FOUND, Problems.of(HttpStatus.NOT_FOUND, title, detail), cause);
  }

  public static ResourceNotFoundException withDetail(
      String title, String detail, Throwable cause) {
    return new ResourceNotFoundException(title, detail, cause);
  }
}
