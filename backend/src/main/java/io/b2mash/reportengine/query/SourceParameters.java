package io.b2mash.reportengine.query;

import io.b2mash.reportengine.source.SourceKind;
import java.util.List;
import java.util.Set;

/** Named parameters a source understands beyond the generic query shape. */
public final class SourceParameters {

  /** Reporting window of the usage report backend. */
  public static final String PERIOD = "period";

  public static final Set<String> PERIODS = Set.of("D7", "D30", "D90", "D180");

  private SourceParameters() {}

  public record Rule(String name, boolean required, Set<String> allowedValues) {}

  public static List<Rule> forSource(SourceKind source) {
    return switch (source) {
      case CLOUD_SUITE -> List.of(new Rule(PERIOD, true, PERIODS));
      case DIRECTORY, CLOUD_DIRECTORY -> List.of();
    };
  }
}
