package io.b2mash.reportengine.query;

import java.util.Optional;

public enum SortDirection {
  ASC,
  DESC;

  public String wireName() {
    return name().toLowerCase();
  }

  public static Optional<SortDirection> fromWireName(String value) {
    if (value == null || value.isBlank()) {
      return Optional.of(ASC);
    }
    return switch (value.trim().toLowerCase()) {
      case "asc", "ascending" -> Optional.of(ASC);
      case "desc", "descending" -> Optional.of(DESC);
      default -> Optional.empty();
    };
  }
}
