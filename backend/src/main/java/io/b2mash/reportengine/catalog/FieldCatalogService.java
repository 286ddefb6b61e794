package io.b2mash.reportengine.catalog;

import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.credential.CredentialStore;
import io.b2mash.reportengine.exception.InvalidStateException;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holds the active {@link FieldCatalog} per (source, credential). Reads see a consistent snapshot
 * without locking; discovery for one scope runs at most once at a time and only replaces the
 * active catalog when it succeeds.
 */
@Service
public class FieldCatalogService {

  private static final Logger log = LoggerFactory.getLogger(FieldCatalogService.class);

  private final SchemaProvider schemaProvider;
  private final CredentialStore credentialStore;
  private final CatalogProperties properties;
  private final Clock clock;

  private final ConcurrentHashMap<CatalogKey, FieldCatalog> active = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<CatalogKey, Object> discoveryLocks = new ConcurrentHashMap<>();
  private final AtomicLong versionSequence = new AtomicLong();

  public FieldCatalogService(
      SchemaProvider schemaProvider,
      CredentialStore credentialStore,
      CatalogProperties properties,
      Clock clock) {
    this.schemaProvider = schemaProvider;
    this.credentialStore = credentialStore;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Reads the backend schema and installs the result as the active catalog for the scope.
   *
   * @throws CatalogDiscoveryException if the backend cannot be read at all
   */
  public FieldCatalog discover(SourceKind source, String credentialId) {
    var credential = loadCredential(source, credentialId);
    var key = new CatalogKey(source, credentialId);
    synchronized (lockFor(key)) {
      return discoverAndInstall(key, credential);
    }
  }

  /** Returns the active catalog if it is fresh and was built with the current credential. */
  public Optional<FieldCatalog> getCached(SourceKind source, Credential credential) {
    var catalog = active.get(new CatalogKey(source, credential.id()));
    if (catalog == null || !isFresh(catalog, credential)) {
      return Optional.empty();
    }
    return Optional.of(catalog);
  }

  /** Returns the cached catalog, discovering it first on a miss. */
  public FieldCatalog resolve(SourceKind source, String credentialId) {
    var credential = loadCredential(source, credentialId);
    var cached = getCached(source, credential);
    if (cached.isPresent()) {
      return cached.get();
    }
    var key = new CatalogKey(source, credentialId);
    synchronized (lockFor(key)) {
      // another caller may have finished discovery while this one waited
      var current = getCached(source, credential);
      if (current.isPresent()) {
        return current.get();
      }
      return discoverAndInstall(key, credential);
    }
  }

  /**
   * Rediscovers the schema. On failure the previously active catalog stays in place and the error
   * propagates.
   */
  public FieldCatalog refresh(SourceKind source, String credentialId) {
    var previous = active.get(new CatalogKey(source, credentialId));
    try {
      var refreshed = discover(source, credentialId);
      log.info(
          "Refreshed field catalog: source={}, credentialId={}, previousVersion={}, version={}",
          source.slug(),
          credentialId,
          previous != null ? previous.getVersion() : null,
          refreshed.getVersion());
      return refreshed;
    } catch (CatalogDiscoveryException e) {
      log.warn(
          "Catalog refresh failed, keeping version {}: source={}, credentialId={}, reason={}",
          previous != null ? previous.getVersion() : null,
          source.slug(),
          credentialId,
          e.getReason());
      throw e;
    }
  }

  /** Drops every catalog built for a credential, for example after the credential is removed. */
  public void evict(String credentialId) {
    active.keySet().removeIf(k -> k.credentialId().equals(credentialId));
  }

  private FieldCatalog discoverAndInstall(CatalogKey key, Credential credential) {
    var snapshot = schemaProvider.readSchema(key.source(), credential);
    var catalog =
        new FieldCatalog(
            key.source(),
            credential.id(),
            credential.version(),
            versionSequence.incrementAndGet(),
            Instant.now(clock),
            snapshot.fields(),
            snapshot.warnings());
    active.put(key, catalog);
    if (catalog.isPartial()) {
      log.warn(
          "Installed partial field catalog: source={}, credentialId={}, version={}, warnings={}",
          key.source().slug(),
          credential.id(),
          catalog.getVersion(),
          catalog.getWarnings());
    } else {
      log.info(
          "Installed field catalog: source={}, credentialId={}, version={}, fields={}",
          key.source().slug(),
          credential.id(),
          catalog.getVersion(),
          catalog.size());
    }
    return catalog;
  }

  private boolean isFresh(FieldCatalog catalog, Credential credential) {
    if (catalog.getCredentialVersion() != credential.version()) {
      return false;
    }
    var age = Duration.between(catalog.getDiscoveredAt(), Instant.now(clock));
    return age.compareTo(properties.ttl()) < 0;
  }

  private Credential loadCredential(SourceKind source, String credentialId) {
    var credential = credentialStore.getCredential(credentialId);
    if (credential.source() != source) {
      throw new InvalidStateException(
          "Credential source mismatch",
          "Credential "
              + credentialId
              + " is registered for "
              + credential.source().slug()
              + ", not "
              + source.slug());
    }
    return credential;
  }

  private Object lockFor(CatalogKey key) {
    return discoveryLocks.computeIfAbsent(key, k -> new Object());
  }

  private record CatalogKey(SourceKind source, String credentialId) {}
}
