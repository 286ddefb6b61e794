package io.b2mash.reportengine.catalog;

import io.b2mash.reportengine.source.SourceKind;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of the fields one source exposes under one credential. A newer snapshot
 * supersedes an older one; snapshots are never modified.
 */
public final class FieldCatalog {

  private final SourceKind source;
  private final String credentialId;
  private final long credentialVersion;
  private final long version;
  private final Instant discoveredAt;
  private final Map<String, FieldDescriptor> fields;
  private final Map<String, String> lookup;
  private final List<CatalogWarning> warnings;

  public FieldCatalog(
      SourceKind source,
      String credentialId,
      long credentialVersion,
      long version,
      Instant discoveredAt,
      Collection<FieldDescriptor> fields,
      List<CatalogWarning> warnings) {
    this.source = source;
    this.credentialId = credentialId;
    this.credentialVersion = credentialVersion;
    this.version = version;
    this.discoveredAt = discoveredAt;
    var byName = new LinkedHashMap<String, FieldDescriptor>();
    var index = new HashMap<String, String>();
    for (var field : fields) {
      if (field.source() != source) {
        throw new IllegalArgumentException(
            "Field " + field.name() + " belongs to " + field.source() + ", not " + source);
      }
      if (byName.putIfAbsent(field.name(), field) != null) {
        throw new IllegalArgumentException("Duplicate field name: " + field.name());
      }
      index.put(key(field.name()), field.name());
    }
    // aliases never shadow a canonical name
    for (var field : byName.values()) {
      for (var alias : field.aliases()) {
        index.putIfAbsent(key(alias), field.name());
      }
      index.putIfAbsent(key(field.nativeName()), field.name());
    }
    this.fields = Collections.unmodifiableMap(byName);
    this.lookup = Map.copyOf(index);
    this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  /** Resolves a canonical name, alias or native attribute name, ignoring case. */
  public Optional<FieldDescriptor> find(String nameOrAlias) {
    if (nameOrAlias == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(lookup.get(key(nameOrAlias))).map(fields::get);
  }

  public boolean contains(String nameOrAlias) {
    return find(nameOrAlias).isPresent();
  }

  public Collection<FieldDescriptor> fields() {
    return fields.values();
  }

  public Map<String, List<FieldDescriptor>> fieldsByCategory() {
    return fields.values().stream()
        .collect(
            Collectors.groupingBy(
                FieldDescriptor::category, LinkedHashMap::new, Collectors.toList()));
  }

  /** Matches the term against names, display names, descriptions and aliases. */
  public List<FieldDescriptor> search(String term) {
    if (term == null || term.isBlank()) {
      return List.copyOf(fields.values());
    }
    var needle = key(term);
    return fields.values().stream()
        .filter(
            f ->
                key(f.name()).contains(needle)
                    || key(f.displayName()).contains(needle)
                    || key(f.description()).contains(needle)
                    || f.aliases().stream().anyMatch(a -> key(a).contains(needle)))
        .toList();
  }

  /** A partial catalog is usable but some attribute groups could not be read. */
  public boolean isPartial() {
    return !warnings.isEmpty();
  }

  private static String key(String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }

  // --- Getters ---

  public SourceKind getSource() {
    return source;
  }

  public String getCredentialId() {
    return credentialId;
  }

  public long getCredentialVersion() {
    return credentialVersion;
  }

  public long getVersion() {
    return version;
  }

  public Instant getDiscoveredAt() {
    return discoveredAt;
  }

  public List<CatalogWarning> getWarnings() {
    return warnings;
  }

  public int size() {
    return fields.size();
  }

  @Override
  public String toString() {
    return "FieldCatalog[source="
        + source
        + ", credentialId="
        + credentialId
        + ", version="
        + version
        + ", fields="
        + fields.size()
        + ", warnings="
        + warnings.size()
        + "]";
  }
}
