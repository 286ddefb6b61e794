package io.b2mash.reportengine.customreport;

import java.util.UUID;

/** Tells whether a scheduler still has an active job that runs a custom report. */
public interface ScheduledJobLookup {

  boolean hasActiveJob(UUID customReportId);
}
