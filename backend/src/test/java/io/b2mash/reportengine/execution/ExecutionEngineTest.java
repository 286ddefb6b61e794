package io.b2mash.reportengine.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.b2mash.reportengine.catalog.FilterOperator;
import io.b2mash.reportengine.compiler.DirectoryQueryCompiler;
import io.b2mash.reportengine.compiler.LdapSearchQuery;
import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.query.FilterClause;
import io.b2mash.reportengine.query.OrderBy;
import io.b2mash.reportengine.query.Pagination;
import io.b2mash.reportengine.query.QueryDefinition;
import io.b2mash.reportengine.query.SortDirection;
import io.b2mash.reportengine.source.SourceKind;
import io.b2mash.reportengine.testutil.StubConnector;
import io.b2mash.reportengine.testutil.TestCatalogs;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

class ExecutionEngineTest {

  private final Clock clock = Clock.systemUTC();
  private final DirectoryQueryCompiler compiler = new DirectoryQueryCompiler(clock);
  private final StubConnector connector = new StubConnector(SourceKind.DIRECTORY);
  private ThreadPoolTaskScheduler scheduler;

  @BeforeEach
  void setUp() {
    scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdown();
  }

  @Test
  void execute_returnsRowsWithSelectedFieldsOnly() {
    connector.records(users(3));
    var engine = engine(properties(1000, 500));

    var result = engine.execute(query(1, 50, null), credential(), timeout(), signal());

    assertThat(result.rows()).hasSize(3);
    assertThat(result.rows().get(0))
        .containsExactly(Map.entry("displayName", "User 0"), Map.entry("department", "Sales"));
    assertThat(result.truncated()).isFalse();
    assertThat(result.warnings()).isEmpty();
    assertThat(result.elapsed()).isNotNull();
  }

  @Test
  void execute_stopsFetchingOnceRequestedPageIsCovered() {
    connector.records(users(120)).backendPageSize(15);
    var engine = engine(properties(1000, 500));

    var result = engine.execute(query(2, 10, null), credential(), timeout(), signal());

    assertThat(result.rows()).hasSize(20);
    assertThat(result.truncated()).isFalse();
    assertThat(connector.fetchCount()).isEqualTo(2);
  }

  @Test
  void execute_truncatesAtRowCeilingWithWarning() {
    connector.records(users(100)).backendPageSize(20);
    var engine = engine(properties(30, 20));

    var result =
        engine.execute(
            query(1, 10, new OrderBy("displayName", SortDirection.ASC)),
            credential(),
            timeout(),
            signal());

    assertThat(result.rows()).hasSize(30);
    assertThat(result.truncated()).isTrue();
    assertThat(result.warnings())
        .extracting(ExecutionWarning::code)
        .containsExactly(ExecutionWarning.RESULT_TRUNCATED);
  }

  @Test
  void execute_reportsUnreadableAttributeAsSingleWarning() {
    var records = new ArrayList<>(users(50));
    records.set(
        7,
        new RawRecord(
            Map.of("displayName", "User 7"), Map.of("department", "insufficient access rights")));
    connector.records(records);
    var engine = engine(properties(1000, 500));

    var result = engine.execute(query(1, 50, null), credential(), timeout(), signal());

    assertThat(result.rows()).hasSize(50);
    assertThat(result.rows().get(7)).containsEntry("department", null);
    assertThat(result.warnings()).hasSize(1);
    var warning = result.warnings().get(0);
    assertThat(warning.code()).isEqualTo(ExecutionWarning.ATTRIBUTE_UNREADABLE);
    assertThat(warning.rowIndex()).isEqualTo(7);
    assertThat(warning.field()).isEqualTo("department");
    assertThat(result.isPartial()).isTrue();
  }

  @Test
  void execute_retriesTransientFailuresOnFreshConnection() {
    connector.records(users(2)).failFetch(new BackendUnavailableException("connection reset"));
    var engine = engine(properties(1000, 500));

    var result = engine.execute(query(1, 50, null), credential(), timeout(), signal());

    assertThat(result.rows()).hasSize(2);
    assertThat(connector.fetchCount()).isEqualTo(2);
    assertThat(connector.openCount()).isEqualTo(2);
  }

  @Test
  void execute_failsAfterRetryAttemptsAreExhausted() {
    connector
        .records(users(2))
        .failFetch(new BackendUnavailableException("down"))
        .failFetch(new BackendUnavailableException("down"))
        .failFetch(new BackendUnavailableException("down"));
    var engine = engine(properties(1000, 500));

    assertThatThrownBy(
            () -> engine.execute(query(1, 50, null), credential(), timeout(), signal()))
        .isInstanceOfSatisfying(
            ExecutionException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CONNECTION_FAILED));
    assertThat(connector.fetchCount()).isEqualTo(3);
  }

  @Test
  void execute_doesNotRetryRejectedCredential() {
    connector.records(users(2)).failOpen(new BackendAuthException("invalid credentials"));
    var engine = engine(properties(1000, 500));

    assertThatThrownBy(
            () -> engine.execute(query(1, 50, null), credential(), timeout(), signal()))
        .isInstanceOfSatisfying(
            ExecutionException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.AUTH_FAILED));
    assertThat(connector.openCount()).isZero();
    assertThat(connector.fetchCount()).isZero();
  }

  @Test
  void execute_abortsBackendCallOnTimeout() {
    connector.records(users(2)).holdFetches();
    var engine = engine(properties(1000, 500));

    assertThatThrownBy(
            () ->
                engine.execute(
                    query(1, 50, null), credential(), Duration.ofMillis(200), signal()))
        .isInstanceOfSatisfying(
            ExecutionException.class, e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TIMEOUT));
    assertThat(connector.abortCount()).isEqualTo(1);
  }

  @Test
  void execute_abortsBackendCallOnCancel() throws Exception {
    connector.records(users(2)).holdFetches();
    var engine = engine(properties(1000, 500));
    var signal = signal();

    var future =
        CompletableFuture.supplyAsync(
            () -> engine.execute(query(1, 50, null), credential(), timeout(), signal));
    assertThat(connector.awaitFetchStarted(2000)).isTrue();
    signal.cancel();

    var thrown = catchThrowable(() -> future.get(5, TimeUnit.SECONDS));
    assertThat(thrown).hasCauseInstanceOf(ExecutionException.class);
    assertThat(((ExecutionException) thrown.getCause()).getKind())
        .isEqualTo(ErrorKind.CANCELLED);
    assertThat(connector.abortCount()).isEqualTo(1);
  }

  @Test
  void execute_cancelEndsRetryBackoffEarly() throws Exception {
    connector.records(users(2)).failFetch(new BackendUnavailableException("connection reset"));
    var slowBackoff =
        new ExecutionProperties(
            null,
            null,
            1000,
            500,
            new ExecutionProperties.Retry(3, Duration.ofSeconds(10), 2.0, Duration.ofSeconds(10)),
            new ExecutionProperties.Pool(2, Duration.ofSeconds(1), null),
            null);
    var engine = engine(slowBackoff);
    var signal = signal();

    var future =
        CompletableFuture.supplyAsync(
            () -> engine.execute(query(1, 50, null), credential(), timeout(), signal));
    assertThat(connector.awaitFetchStarted(2000)).isTrue();
    long started = System.nanoTime();
    signal.cancel();

    var thrown = catchThrowable(() -> future.get(5, TimeUnit.SECONDS));
    assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(3));
    assertThat(thrown).hasCauseInstanceOf(ExecutionException.class);
    assertThat(((ExecutionException) thrown.getCause()).getKind())
        .isEqualTo(ErrorKind.CANCELLED);
    assertThat(connector.fetchCount()).isEqualTo(1);
  }

  @Test
  void execute_servesDistantPageWithoutOverflow() {
    connector.records(users(5));
    var engine = engine(properties(1000, 500));

    var result = engine.execute(query(30_000_000, 100, null), credential(), timeout(), signal());

    assertThat(result.rows()).hasSize(5);
    assertThat(result.truncated()).isFalse();
  }

  @Test
  void execute_rejectsAlreadyCancelledSignal() {
    connector.records(users(2));
    var engine = engine(properties(1000, 500));
    var signal = signal();
    signal.cancel();

    assertThatThrownBy(() -> engine.execute(query(1, 50, null), credential(), timeout(), signal))
        .isInstanceOfSatisfying(
            ExecutionException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CANCELLED));
    assertThat(connector.openCount()).isZero();
  }

  @Test
  void execute_appliesPostFetchGroupingAcrossAllRows() {
    var records = new ArrayList<RawRecord>();
    records.add(user("Zoe", "Sales"));
    records.add(user("adam", "Legal"));
    records.add(user("Bea", "Sales"));
    connector.records(records);
    var engine = engine(properties(1000, 500));
    var definition =
        new QueryDefinition(
            SourceKind.DIRECTORY,
            List.of("displayName"),
            List.of(new FilterClause("department", FilterOperator.EXISTS, null)),
            "department",
            new OrderBy("displayName", SortDirection.ASC),
            new Pagination(1, 50),
            Map.of());
    var query = compiler.compile(definition, TestCatalogs.catalog(SourceKind.DIRECTORY));

    var result = engine.execute(query, credential(), timeout(), signal());

    assertThat(result.rows())
        .extracting(row -> row.get("displayName"))
        .containsExactly("adam", "Bea", "Zoe");
    assertThat(result.groups())
        .containsExactly(new GroupSummary("Legal", 1), new GroupSummary("Sales", 2));
  }

  private ExecutionEngine engine(ExecutionProperties properties) {
    var pools = new ConnectionPoolRegistry(List.of(connector), properties, clock);
    return new ExecutionEngine(pools, properties, scheduler, clock);
  }

  private static ExecutionProperties properties(int maxResultRows, int fetchBatchSize) {
    return new ExecutionProperties(
        null,
        null,
        maxResultRows,
        fetchBatchSize,
        new ExecutionProperties.Retry(3, Duration.ofMillis(10), 2.0, Duration.ofMillis(40)),
        new ExecutionProperties.Pool(2, Duration.ofSeconds(1), null),
        null);
  }

  private LdapSearchQuery query(int page, int pageSize, OrderBy orderBy) {
    var definition =
        new QueryDefinition(
            SourceKind.DIRECTORY,
            List.of("displayName", "department"),
            List.of(),
            null,
            orderBy,
            new Pagination(page, pageSize),
            Map.of());
    return compiler.compile(definition, TestCatalogs.catalog(SourceKind.DIRECTORY));
  }

  private static List<RawRecord> users(int count) {
    var records = new ArrayList<RawRecord>(count);
    for (int i = 0; i < count; i++) {
      records.add(user("User " + i, "Sales"));
    }
    return records;
  }

  private static RawRecord user(String displayName, String department) {
    var attributes = new LinkedHashMap<String, Object>();
    attributes.put("displayName", displayName);
    attributes.put("department", department);
    attributes.put("objectGUID", new byte[] {1, 2, 3});
    return RawRecord.of(attributes);
  }

  private static Credential credential() {
    return TestCatalogs.credential(SourceKind.DIRECTORY);
  }

  private static Duration timeout() {
    return Duration.ofSeconds(10);
  }

  private static CancellationSignal signal() {
    return new CancellationSignal();
  }
}
