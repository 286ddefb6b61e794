package io.b2mash.reportengine.compiler;

import io.b2mash.reportengine.catalog.FieldCatalog;
import io.b2mash.reportengine.query.QueryDefinition;
import io.b2mash.reportengine.source.SourceKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Dispatches a definition to the compiler of its source. */
@Component
public class CompilerRegistry {

  private final Map<SourceKind, SourceCompiler> compilers;

  public CompilerRegistry(List<SourceCompiler> compilers) {
    var bySource = new EnumMap<SourceKind, SourceCompiler>(SourceKind.class);
    for (var compiler : compilers) {
      var existing = bySource.putIfAbsent(compiler.source(), compiler);
      if (existing != null) {
        throw new IllegalStateException(
            "Duplicate compiler for "
                + compiler.source()
                + ": "
                + existing.getClass().getSimpleName()
                + " and "
                + compiler.getClass().getSimpleName());
      }
    }
    for (var source : SourceKind.values()) {
      if (!bySource.containsKey(source)) {
        throw new IllegalStateException("No compiler registered for " + source);
      }
    }
    this.compilers = bySource;
  }

  public NativeQuery compile(QueryDefinition definition, FieldCatalog catalog) {
    return compilers.get(definition.source()).compile(definition, catalog);
  }
}
