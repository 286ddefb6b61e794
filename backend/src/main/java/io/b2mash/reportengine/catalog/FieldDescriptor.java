package io.b2mash.reportengine.catalog;

import io.b2mash.reportengine.source.SourceKind;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A field that queries against one source may select, filter, group or order by.
 *
 * @param name canonical field name used in query definitions and result rows
 * @param displayName label shown to report authors
 * @param semanticType value type, which bounds the allowed operators
 * @param source the owning source
 * @param category grouping used by the field picker (identity, organization, security, ...)
 * @param allowedOperators operators accepted in filter clauses on this field
 * @param nativeName attribute or column name on the backend
 * @param description free text help
 * @param aliases alternative names resolved to {@code name}
 * @param sortable whether the field may appear in an order-by
 * @param sensitive whether values should be masked by presentation layers
 */
public record FieldDescriptor(
    String name,
    String displayName,
    SemanticType semanticType,
    SourceKind source,
    String category,
    Set<FilterOperator> allowedOperators,
    String nativeName,
    String description,
    List<String> aliases,
    boolean sortable,
    boolean sensitive) {

  public FieldDescriptor {
    allowedOperators =
        allowedOperators == null || allowedOperators.isEmpty()
            ? semanticType.defaultOperators()
            : Set.copyOf(allowedOperators);
    nativeName = nativeName == null ? name : nativeName;
    aliases = aliases == null ? List.of() : List.copyOf(aliases);
  }

  public static Builder builder(String name, SemanticType type, SourceKind source) {
    return new Builder(name, type, source);
  }

  public boolean allows(FilterOperator operator) {
    return allowedOperators.contains(operator);
  }

  /** Fluent construction with type-derived defaults. */
  public static final class Builder {

    private final String name;
    private final SemanticType type;
    private final SourceKind source;
    private String displayName;
    private String category = "general";
    private Set<FilterOperator> operators;
    private String nativeName;
    private String description = "";
    private List<String> aliases = List.of();
    private Boolean sortable;
    private boolean sensitive;

    private Builder(String name, SemanticType type, SourceKind source) {
      this.name = name;
      this.type = type;
      this.source = source;
    }

    public Builder displayName(String displayName) {
      this.displayName = displayName;
      return this;
    }

    public Builder category(String category) {
      this.category = category;
      return this;
    }

    public Builder operators(FilterOperator first, FilterOperator... rest) {
      this.operators = EnumSet.of(first, rest);
      return this;
    }

    public Builder nativeName(String nativeName) {
      this.nativeName = nativeName;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder aliases(String... aliases) {
      this.aliases = List.of(aliases);
      return this;
    }

    public Builder sortable(boolean sortable) {
      this.sortable = sortable;
      return this;
    }

    public Builder sensitive() {
      this.sensitive = true;
      return this;
    }

    public FieldDescriptor build() {
      return new FieldDescriptor(
          name,
          displayName != null ? displayName : name,
          type,
          source,
          category,
          operators,
          nativeName,
          description,
          aliases,
          sortable != null ? sortable : type.isSortable(),
          sensitive);
    }
  }
}
