package io.b2mash.reportengine.source;

import java.util.Arrays;
import java.util.Optional;

/** The backends a report query can target. Each constant has its own compiler and connector. */
public enum SourceKind {
  DIRECTORY("directory", "On-premise directory"),
  CLOUD_DIRECTORY("cloud-directory", "Cloud identity directory"),
  CLOUD_SUITE("cloud-suite", "Productivity suite usage reports");

  private final String slug;
  private final String displayName;

  SourceKind(String slug, String displayName) {
    this.slug = slug;
    this.displayName = displayName;
  }

  public String slug() {
    return slug;
  }

  public String displayName() {
    return displayName;
  }

  /** Resolves a slug ({@code cloud-directory}) or constant name ({@code CLOUD_DIRECTORY}). */
  public static Optional<SourceKind> fromSlug(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    var normalized = value.trim();
    return Arrays.stream(values())
        .filter(k -> k.slug.equalsIgnoreCase(normalized) || k.name().equalsIgnoreCase(normalized))
        .findFirst();
  }
}
