package io.b2mash.reportengine.compiler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.reportengine.catalog.FilterOperator;
import io.b2mash.reportengine.query.FilterClause;
import io.b2mash.reportengine.query.OrderBy;
import io.b2mash.reportengine.query.Pagination;
import io.b2mash.reportengine.query.QueryDefinition;
import io.b2mash.reportengine.query.SortDirection;
import io.b2mash.reportengine.source.SourceKind;
import io.b2mash.reportengine.testutil.TestCatalogs;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DirectoryQueryCompilerTest {

  private static final Instant NOW = Instant.parse("2024-06-15T10:30:00Z");

  private final DirectoryQueryCompiler compiler =
      new DirectoryQueryCompiler(Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void compile_escapesFilterValues() {
    var query =
        compiler.compile(
            definition(
                List.of("displayName"),
                List.of(new FilterClause("department", FilterOperator.EQUALS, "R&D (EU)*")),
                null,
                null),
            TestCatalogs.catalog(SourceKind.DIRECTORY));

    assertThat(query.filter())
        .isEqualTo("(&(objectClass=user)(objectCategory=person)(department=R&D \\28EU\\29\\2a))");
  }

  @Test
  void compile_translatesEnabledToAccountControlBit() {
    var enabled =
        compiler.compile(
            definition(
                List.of("displayName"),
                List.of(new FilterClause("enabled", FilterOperator.EQUALS, true)),
                null,
                null),
            TestCatalogs.catalog(SourceKind.DIRECTORY));
    var disabled =
        compiler.compile(
            definition(
                List.of("displayName"),
                List.of(new FilterClause("enabled", FilterOperator.EQUALS, false)),
                null,
                null),
            TestCatalogs.catalog(SourceKind.DIRECTORY));

    assertThat(enabled.filter()).endsWith("(!(userAccountControl:1.2.840.113556.1.4.803:=2)))");
    assertThat(disabled.filter()).endsWith("(userAccountControl:1.2.840.113556.1.4.803:=2))");
  }

  @Test
  void compile_resolvesOlderThanAgainstStartOfUtcDayAsFileTime() {
    var query =
        compiler.compile(
            definition(
                List.of("accountName", "lastLogon"),
                List.of(new FilterClause("lastLogon", FilterOperator.OLDER_THAN, 30L)),
                null,
                null),
            TestCatalogs.catalog(SourceKind.DIRECTORY));

    long cutoff = LdapSyntax.toFileTime(Instant.parse("2024-05-16T00:00:00Z"));
    assertThat(query.filter()).contains("(lastLogonTimestamp<=" + cutoff + ")");
  }

  @Test
  void compile_rejectsAgeBeyondRepresentableDates() {
    var definition =
        definition(
            List.of("lastLogon"),
            List.of(new FilterClause("lastLogon", FilterOperator.OLDER_THAN, 1_000_000_000_000L)),
            null,
            null);

    assertThatThrownBy(
            () -> compiler.compile(definition, TestCatalogs.catalog(SourceKind.DIRECTORY)))
        .isInstanceOf(CompileException.class)
        .hasMessageContaining("out of range");
  }

  @Test
  void compile_expressesStrictComparisonsWithoutEquality() {
    var query =
        compiler.compile(
            definition(
                List.of("displayName"),
                List.of(
                    new FilterClause(
                        "whenCreated",
                        FilterOperator.GREATER_THAN,
                        Instant.parse("2024-01-01T00:00:00Z"))),
                null,
                null),
            TestCatalogs.catalog(SourceKind.DIRECTORY));

    assertThat(query.filter())
        .contains("(&(whenCreated>=20240101000000.0Z)(!(whenCreated=20240101000000.0Z)))");
  }

  @Test
  void compile_matchesArrayMembershipExactlyAndBlankEqualsAsAbsent() {
    var query =
        compiler.compile(
            definition(
                List.of("displayName"),
                List.of(
                    new FilterClause("memberOf", FilterOperator.CONTAINS, "CN=Admins"),
                    new FilterClause("title", FilterOperator.CONTAINS, "lead"),
                    new FilterClause("mobile", FilterOperator.EQUALS, "")),
                null,
                null),
            TestCatalogs.catalog(SourceKind.DIRECTORY));

    assertThat(query.filter())
        .isEqualTo(
            "(&(objectClass=user)(objectCategory=person)"
                + "(memberOf=CN=Admins)(title=*lead*)(!(mobile=*)))");
  }

  @Test
  void compile_requestsEveryReferencedAttributeOnce() {
    var query =
        compiler.compile(
            definition(
                List.of("displayName", "email"),
                List.of(new FilterClause("email", FilterOperator.EXISTS, null)),
                "department",
                new OrderBy("whenCreated", SortDirection.DESC)),
            TestCatalogs.catalog(SourceKind.DIRECTORY));

    assertThat(query.attributes())
        .containsExactly("displayName", "mail", "department", "whenCreated");
    assertThat(query.selectedFields()).containsExactly("displayName", "email");
    assertThat(query.postFetch().groupBy()).isEqualTo("department");
    assertThat(query.postFetch().orderBy())
        .isEqualTo(new OrderBy("whenCreated", SortDirection.DESC));
    assertThat(query.stopsAtRequestedPage()).isFalse();
    assertThat(query.canonicalForm()).contains(";limit=all;");
  }

  @Test
  void compile_limitsUnorderedQueriesToRequestedPage() {
    var query =
        compiler.compile(
            definition(List.of("displayName"), List.of(), null, null),
            TestCatalogs.catalog(SourceKind.DIRECTORY));

    assertThat(query.stopsAtRequestedPage()).isTrue();
    assertThat(query.canonicalForm()).contains(";limit=50;");
  }

  @Test
  void compile_isDeterministic() {
    var definition =
        definition(
            List.of("displayName", "lastLogon"),
            List.of(
                new FilterClause("department", FilterOperator.IN, List.of("Sales", "Legal")),
                new FilterClause("lastLogon", FilterOperator.NEWER_THAN, 7L)),
            null,
            new OrderBy("displayName", SortDirection.ASC));
    var catalog = TestCatalogs.catalog(SourceKind.DIRECTORY);

    var first = compiler.compile(definition, catalog);
    var second = compiler.compile(definition, catalog);

    assertThat(first).isEqualTo(second);
    assertThat(first.canonicalForm()).isEqualTo(second.canonicalForm());
    assertThat(first.filter()).contains("(|(department=Sales)(department=Legal))");
  }

  @Test
  void compile_rejectsDefinitionOfAnotherSource() {
    var definition =
        new QueryDefinition(
            SourceKind.CLOUD_DIRECTORY,
            List.of("displayName"),
            List.of(),
            null,
            null,
            new Pagination(1, 50),
            Map.of());

    assertThatThrownBy(
            () -> compiler.compile(definition, TestCatalogs.catalog(SourceKind.CLOUD_DIRECTORY)))
        .isInstanceOf(CompileException.class);
  }

  private static QueryDefinition definition(
      List<String> fields, List<FilterClause> filters, String groupBy, OrderBy orderBy) {
    return new QueryDefinition(
        SourceKind.DIRECTORY, fields, filters, groupBy, orderBy, new Pagination(1, 50), Map.of());
  }
}
