package io.b2mash.reportengine.cache;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.reportengine.compiler.DirectoryQueryCompiler;
import io.b2mash.reportengine.compiler.LdapSearchQuery;
import io.b2mash.reportengine.query.Pagination;
import io.b2mash.reportengine.query.QueryDefinition;
import io.b2mash.reportengine.source.SourceKind;
import io.b2mash.reportengine.testutil.TestCatalogs;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.json.JsonMapper;

class QueryFingerprinterTest {

  private final QueryFingerprinter fingerprinter =
      new QueryFingerprinter(JsonMapper.builder().build());

  private final DirectoryQueryCompiler compiler =
      new DirectoryQueryCompiler(
          Clock.fixed(Instant.parse("2024-06-15T10:30:00Z"), ZoneOffset.UTC));

  @Test
  void fingerprint_isStableHexDigestScopedToCredential() {
    var credential = TestCatalogs.credential(SourceKind.DIRECTORY);

    var first = fingerprinter.fingerprint(query(1), credential, Map.of(), 1);
    var second = fingerprinter.fingerprint(query(1), credential, Map.of(), 1);

    assertThat(first).isEqualTo(second);
    assertThat(first.value()).hasSize(64).matches("[0-9a-f]+");
    assertThat(first.source()).isEqualTo(SourceKind.DIRECTORY);
    assertThat(first.credentialId()).isEqualTo(credential.id());
    assertThat(first.toString()).isEqualTo(first.value());
  }

  @Test
  void fingerprint_ignoresParameterOrder() {
    var credential = TestCatalogs.credential(SourceKind.DIRECTORY);
    var forward = new LinkedHashMap<String, Object>();
    forward.put("dept", "Sales");
    forward.put("days", 30);
    var backward = new LinkedHashMap<String, Object>();
    backward.put("days", 30);
    backward.put("dept", "Sales");

    assertThat(fingerprinter.fingerprint(query(1), credential, forward, 1))
        .isEqualTo(fingerprinter.fingerprint(query(1), credential, backward, 1));
  }

  @Test
  void fingerprint_changesWithAnyInput() {
    var credential = TestCatalogs.credential(SourceKind.DIRECTORY);
    var base = fingerprinter.fingerprint(query(1), credential, Map.of(), 1);

    assertThat(fingerprinter.fingerprint(query(1), credential, Map.of(), 2)).isNotEqualTo(base);
    assertThat(
            fingerprinter.fingerprint(
                query(1), TestCatalogs.credential(SourceKind.DIRECTORY, 2), Map.of(), 1))
        .isNotEqualTo(base);
    assertThat(fingerprinter.fingerprint(query(2), credential, Map.of(), 1)).isNotEqualTo(base);
    assertThat(fingerprinter.fingerprint(query(1), credential, Map.of("dept", "IT"), 1))
        .isNotEqualTo(base);
  }

  private LdapSearchQuery query(int page) {
    var definition =
        new QueryDefinition(
            SourceKind.DIRECTORY,
            List.of("displayName"),
            List.of(),
            null,
            null,
            new Pagination(page, 50),
            Map.of());
    return compiler.compile(definition, TestCatalogs.catalog(SourceKind.DIRECTORY));
  }
}
