package io.b2mash.reportengine.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.credential.CredentialStore;
import io.b2mash.reportengine.credential.CredentialUnavailableException;
import io.b2mash.reportengine.exception.InvalidStateException;
import io.b2mash.reportengine.source.SourceKind;
import io.b2mash.reportengine.testutil.MutableClock;
import io.b2mash.reportengine.testutil.TestCatalogs;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FieldCatalogServiceTest {

  private static final SourceKind SOURCE = SourceKind.DIRECTORY;
  private static final String CREDENTIAL_ID = TestCatalogs.credentialId(SOURCE);

  private final MutableClock clock = new MutableClock(Instant.parse("2024-06-15T10:00:00Z"));
  private final Map<String, Credential> credentials = new ConcurrentHashMap<>();
  private final CredentialStore credentialStore =
      id -> {
        var credential = credentials.get(id);
        if (credential == null) {
          throw new CredentialUnavailableException(id, "no such credential");
        }
        return credential;
      };
  private final ScriptedSchemaProvider schemaProvider = new ScriptedSchemaProvider();

  private FieldCatalogService service;

  @BeforeEach
  void setUp() {
    credentials.put(CREDENTIAL_ID, TestCatalogs.credential(SOURCE, 1L));
    service =
        new FieldCatalogService(
            schemaProvider, credentialStore, new CatalogProperties(Duration.ofHours(1)), clock);
  }

  @Test
  void resolve_discoversOnceAndServesCachedCatalog() {
    var first = service.resolve(SOURCE, CREDENTIAL_ID);
    var second = service.resolve(SOURCE, CREDENTIAL_ID);

    assertThat(second).isSameAs(first);
    assertThat(first.getCredentialVersion()).isEqualTo(1L);
    assertThat(first.size()).isEqualTo(StandardFields.forSource(SOURCE).size());
    assertThat(schemaProvider.calls()).isEqualTo(1);
  }

  @Test
  void refresh_keepsPreviousCatalogWhenDiscoveryFails() {
    var installed = service.resolve(SOURCE, CREDENTIAL_ID);
    schemaProvider.failNext(
        new CatalogDiscoveryException(
            SOURCE, CatalogDiscoveryException.Reason.UNREACHABLE, "connection refused", null));

    assertThatThrownBy(() -> service.refresh(SOURCE, CREDENTIAL_ID))
        .isInstanceOfSatisfying(
            CatalogDiscoveryException.class,
            e -> assertThat(e.getReason()).isEqualTo(CatalogDiscoveryException.Reason.UNREACHABLE));

    assertThat(service.getCached(SOURCE, credentials.get(CREDENTIAL_ID))).containsSame(installed);
    assertThat(service.resolve(SOURCE, CREDENTIAL_ID).getVersion())
        .isEqualTo(installed.getVersion());
  }

  @Test
  void refresh_installsNewVersion() {
    var installed = service.resolve(SOURCE, CREDENTIAL_ID);

    var refreshed = service.refresh(SOURCE, CREDENTIAL_ID);

    assertThat(refreshed.getVersion()).isGreaterThan(installed.getVersion());
    assertThat(service.resolve(SOURCE, CREDENTIAL_ID)).isSameAs(refreshed);
  }

  @Test
  void discover_returnsPartialCatalogWithWarnings() {
    var warning = new CatalogWarning("user", "Class definition unreadable: access denied");
    schemaProvider.respondNext(
        new SchemaSnapshot(StandardFields.forSource(SOURCE), List.of(warning)));

    var catalog = service.discover(SOURCE, CREDENTIAL_ID);

    assertThat(catalog.isPartial()).isTrue();
    assertThat(catalog.getWarnings()).containsExactly(warning);
    assertThat(catalog.find("displayName")).isPresent();
  }

  @Test
  void getCached_treatsCatalogOlderThanTtlAsStale() {
    var installed = service.resolve(SOURCE, CREDENTIAL_ID);
    var credential = credentials.get(CREDENTIAL_ID);

    clock.advance(Duration.ofMinutes(59));
    assertThat(service.getCached(SOURCE, credential)).containsSame(installed);

    clock.advance(Duration.ofMinutes(1));
    assertThat(service.getCached(SOURCE, credential)).isEmpty();

    var rediscovered = service.resolve(SOURCE, CREDENTIAL_ID);
    assertThat(rediscovered.getVersion()).isGreaterThan(installed.getVersion());
    assertThat(schemaProvider.calls()).isEqualTo(2);
  }

  @Test
  void resolve_rediscoversAfterCredentialVersionChanges() {
    var installed = service.resolve(SOURCE, CREDENTIAL_ID);
    credentials.put(CREDENTIAL_ID, TestCatalogs.credential(SOURCE, 2L));

    assertThat(service.getCached(SOURCE, credentials.get(CREDENTIAL_ID))).isEmpty();

    var rediscovered = service.resolve(SOURCE, CREDENTIAL_ID);
    assertThat(rediscovered.getCredentialVersion()).isEqualTo(2L);
    assertThat(rediscovered.getVersion()).isGreaterThan(installed.getVersion());
  }

  @Test
  void evict_dropsCatalogsOfCredential() {
    var credential = credentials.get(CREDENTIAL_ID);
    service.resolve(SOURCE, CREDENTIAL_ID);

    service.evict(CREDENTIAL_ID);

    assertThat(service.getCached(SOURCE, credential)).isEmpty();
    service.resolve(SOURCE, CREDENTIAL_ID);
    assertThat(schemaProvider.calls()).isEqualTo(2);
  }

  @Test
  void resolve_rejectsCredentialOfAnotherSource() {
    assertThatThrownBy(() -> service.resolve(SourceKind.CLOUD_DIRECTORY, CREDENTIAL_ID))
        .isInstanceOf(InvalidStateException.class);
    assertThat(schemaProvider.calls()).isZero();
  }

  /** Answers with the standard fields unless a response or failure was queued. */
  private static final class ScriptedSchemaProvider implements SchemaProvider {

    private final Deque<Object> script = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();

    void respondNext(SchemaSnapshot snapshot) {
      script.add(snapshot);
    }

    void failNext(RuntimeException failure) {
      script.add(failure);
    }

    int calls() {
      return calls.get();
    }

    @Override
    public synchronized SchemaSnapshot readSchema(SourceKind source, Credential credential) {
      calls.incrementAndGet();
      var next = script.poll();
      if (next instanceof RuntimeException failure) {
        throw failure;
      }
      if (next instanceof SchemaSnapshot snapshot) {
        return snapshot;
      }
      return new SchemaSnapshot(StandardFields.forSource(source), List.of());
    }
  }
}
