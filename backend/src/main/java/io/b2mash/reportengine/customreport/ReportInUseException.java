package io.b2mash.reportengine.customreport;

import io.b2mash.reportengine.exception.ResourceConflictException;
import java.util.UUID;

/** A custom report cannot be deleted while it is locked or a scheduled job still runs it. */
public class ReportInUseException extends ResourceConflictException {

  public ReportInUseException(UUID reportId, String reason) {
    super("Report in use", "Custom report " + reportId + " cannot be deleted: " + reason);
  }
}
