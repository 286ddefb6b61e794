package io.b2mash.reportengine.catalog;

import io.b2mash.reportengine.catalog.CatalogDiscoveryException.Reason;
import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.execution.BackendAuthException;
import io.b2mash.reportengine.execution.BackendException;
import io.b2mash.reportengine.execution.BackendPermissionException;
import io.b2mash.reportengine.execution.ConnectionPoolRegistry;
import io.b2mash.reportengine.source.SourceKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines the {@link StandardFields} of a source with the attributes its backend schema reports.
 * Backend attributes already covered by a standard field are skipped.
 */
@Component
public class BackendSchemaProvider implements SchemaProvider {

  private static final Logger log = LoggerFactory.getLogger(BackendSchemaProvider.class);

  private final ConnectionPoolRegistry connectionPools;

  public BackendSchemaProvider(ConnectionPoolRegistry connectionPools) {
    this.connectionPools = connectionPools;
  }

  @Override
  public SchemaSnapshot readSchema(SourceKind source, Credential credential) {
    RemoteSchema remote;
    try (var lease = connectionPools.lease(credential)) {
      remote = lease.connection().readSchema();
    } catch (BackendPermissionException | BackendAuthException e) {
      throw new CatalogDiscoveryException(source, Reason.PERMISSION_DENIED, e.getMessage(), e);
    } catch (BackendException e) {
      throw new CatalogDiscoveryException(source, Reason.UNREACHABLE, e.getMessage(), e);
    }

    var fields = new ArrayList<>(StandardFields.forSource(source));
    var known = new HashSet<String>();
    for (var field : fields) {
      known.add(field.name().toLowerCase(Locale.ROOT));
      known.add(field.nativeName().toLowerCase(Locale.ROOT));
    }
    int added = 0;
    for (var attribute : remote.attributes()) {
      var name = canonicalName(attribute.nativeName());
      if (known.contains(attribute.nativeName().toLowerCase(Locale.ROOT))
          || !known.add(name.toLowerCase(Locale.ROOT))) {
        continue;
      }
      fields.add(
          FieldDescriptor.builder(name, attribute.semanticType(), source)
              .displayName(attribute.nativeName())
              .nativeName(attribute.nativeName())
              .category(attribute.category() != null ? attribute.category() : "extended")
              .description("Discovered from backend schema")
              .build());
      added++;
    }

    log.info(
        "Read schema: source={}, credentialId={}, standardFields={}, discoveredFields={},"
            + " unreadableGroups={}",
        source.slug(),
        credential.id(),
        fields.size() - added,
        added,
        remote.unreadable().size());
    return new SchemaSnapshot(fields, remote.unreadable());
  }

  /** Turns a native attribute or column name into a camelCase field name. */
  static String canonicalName(String nativeName) {
    var parts = nativeName.trim().split("[^A-Za-z0-9]+");
    var sb = new StringBuilder();
    for (var part : parts) {
      if (part.isEmpty()) {
        continue;
      }
      if (sb.length() == 0) {
        sb.append(Character.toLowerCase(part.charAt(0))).append(part.substring(1));
      } else {
        sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
      }
    }
    return sb.length() == 0 ? nativeName : sb.toString();
  }
}
