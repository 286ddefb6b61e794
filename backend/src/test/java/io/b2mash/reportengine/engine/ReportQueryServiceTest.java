package io.b2mash.reportengine.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.reportengine.cache.CacheProperties;
import io.b2mash.reportengine.cache.QueryFingerprinter;
import io.b2mash.reportengine.cache.ResultCache;
import io.b2mash.reportengine.catalog.BackendSchemaProvider;
import io.b2mash.reportengine.catalog.CatalogProperties;
import io.b2mash.reportengine.catalog.FieldCatalogService;
import io.b2mash.reportengine.compiler.CloudDirectoryQueryCompiler;
import io.b2mash.reportengine.compiler.CloudSuiteQueryCompiler;
import io.b2mash.reportengine.compiler.CompilerRegistry;
import io.b2mash.reportengine.compiler.DirectoryQueryCompiler;
import io.b2mash.reportengine.credential.ConfiguredCredentialStore;
import io.b2mash.reportengine.credential.CredentialProperties;
import io.b2mash.reportengine.customreport.CustomReport;
import io.b2mash.reportengine.customreport.CustomReportRepository;
import io.b2mash.reportengine.exception.InvalidStateException;
import io.b2mash.reportengine.exception.ResourceNotFoundException;
import io.b2mash.reportengine.exception.ResultsExpiredException;
import io.b2mash.reportengine.execution.ConnectionPoolRegistry;
import io.b2mash.reportengine.execution.ExecutionEngine;
import io.b2mash.reportengine.execution.ExecutionProperties;
import io.b2mash.reportengine.execution.RawRecord;
import io.b2mash.reportengine.ledger.ExecutionLedger;
import io.b2mash.reportengine.ledger.ExecutionRecord;
import io.b2mash.reportengine.ledger.ExecutionRecordRepository;
import io.b2mash.reportengine.ledger.ExecutionStatus;
import io.b2mash.reportengine.query.QueryDefinitionMapper;
import io.b2mash.reportengine.query.QueryProperties;
import io.b2mash.reportengine.query.QueryValidationException;
import io.b2mash.reportengine.query.QueryValidator;
import io.b2mash.reportengine.query.RawQueryRequest;
import io.b2mash.reportengine.query.RawQueryRequest.RawFilter;
import io.b2mash.reportengine.source.SourceKind;
import io.b2mash.reportengine.source.SourceProperties;
import io.b2mash.reportengine.testutil.StubConnector;
import io.b2mash.reportengine.testutil.TestCatalogs;
import io.b2mash.reportengine.testutil.TestEntities;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import tools.jackson.databind.json.JsonMapper;

@ExtendWith(MockitoExtension.class)
class ReportQueryServiceTest {

  private static final String OWNER = "user_1";
  private static final String CREDENTIAL_ID = TestCatalogs.credentialId(SourceKind.DIRECTORY);
  private static final Duration MAX_WAIT = Duration.ofSeconds(5);

  @Mock private ExecutionRecordRepository recordRepository;
  @Mock private CustomReportRepository customReportRepository;
  @Mock private ApplicationEventPublisher eventPublisher;

  private final Clock clock = Clock.systemUTC();
  private final StubConnector connector = new StubConnector(SourceKind.DIRECTORY);
  private final Map<UUID, ExecutionRecord> records = new ConcurrentHashMap<>();
  private final QueryDefinitionMapper definitionMapper =
      new QueryDefinitionMapper(JsonMapper.builder().build());

  private ThreadPoolTaskScheduler scheduler;
  private ThreadPoolTaskExecutor executor;
  private ResultCache resultCache;
  private ReportQueryService service;

  @BeforeEach
  void setUp() {
    lenient()
        .when(recordRepository.save(any(ExecutionRecord.class)))
        .thenAnswer(
            invocation -> {
              ExecutionRecord record = invocation.getArgument(0);
              if (record.getId() == null) {
                TestEntities.withId(record, UUID.randomUUID());
              }
              records.put(record.getId(), record);
              return record;
            });
    lenient()
        .when(recordRepository.findById(any(UUID.class)))
        .thenAnswer(invocation -> Optional.ofNullable(records.get(invocation.getArgument(0))));
    lenient()
        .when(recordRepository.findByIdAndOwnerId(any(UUID.class), anyString()))
        .thenAnswer(
            invocation ->
                Optional.ofNullable(records.get(invocation.getArgument(0)))
                    .filter(r -> r.getOwnerId().equals(invocation.getArgument(1))));

    scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.initialize();
    executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(10);
    executor.initialize();

    var executionProperties =
        new ExecutionProperties(
            null,
            null,
            1000,
            500,
            new ExecutionProperties.Retry(2, Duration.ofMillis(10), 2.0, Duration.ofMillis(20)),
            new ExecutionProperties.Pool(2, Duration.ofSeconds(1), null),
            null);
    var pools = new ConnectionPoolRegistry(List.of(connector), executionProperties, clock);
    var engine = new ExecutionEngine(pools, executionProperties, scheduler, clock);
    var credentialStore =
        new ConfiguredCredentialStore(
            new CredentialProperties(
                Map.of(
                    CREDENTIAL_ID,
                    new CredentialProperties.Entry(
                        SourceKind.DIRECTORY, 1L, Map.of("url", "stub://backend")))));
    var catalogService =
        new FieldCatalogService(
            new BackendSchemaProvider(pools), credentialStore, new CatalogProperties(null), clock);
    var ledger = new ExecutionLedger(recordRepository, eventPublisher, clock);
    resultCache = new ResultCache(new CacheProperties(null, null), clock);
    var coordinator =
        new ExecutionCoordinator(engine, resultCache, ledger, executor, executionProperties);
    var compilers =
        new CompilerRegistry(
            List.of(
                new DirectoryQueryCompiler(clock),
                new CloudDirectoryQueryCompiler(clock),
                new CloudSuiteQueryCompiler(clock)));
    var queryProperties = new QueryProperties(null, null);

    service =
        new ReportQueryService(
            catalogService,
            new QueryValidator(new SourceProperties(null), queryProperties, executionProperties),
            compilers,
            new QueryFingerprinter(JsonMapper.builder().build()),
            definitionMapper,
            credentialStore,
            resultCache,
            ledger,
            coordinator,
            customReportRepository,
            executionProperties,
            queryProperties,
            clock);
  }

  @AfterEach
  void tearDown() {
    connector.release();
    executor.shutdown();
    scheduler.shutdown();
  }

  @Test
  void executeQuery_completesWithEnabledAccountsOnly() {
    connector.records(List.of(user("Alice", "Sales"), user("Bob", "Legal")));

    var submitted = submit(enabledUsers());
    var finished = service.awaitExecution(submitted.getId(), OWNER, MAX_WAIT);

    assertThat(submitted.getQueryFingerprint()).hasSize(64);
    assertThat(finished.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
    assertThat(finished.getRowCount()).isEqualTo(2);
    assertThat(finished.isCacheHit()).isFalse();
    var page = service.getResults(submitted.getId(), OWNER, null);
    assertThat(page.rows())
        .extracting(row -> row.get("displayName"))
        .containsExactly("Alice", "Bob");
    assertThat(page.page()).isEqualTo(1);
    assertThat(page.hasNext()).isFalse();
  }

  @Test
  void executeQuery_servesIdenticalQueryFromCache() {
    connector.records(List.of(user("Alice", "Sales"), user("Bob", "Legal")));
    var request = ExecutionRequest.forQuery(OWNER, enabledUsers(), CREDENTIAL_ID, null);

    var first = service.executeQuery(request);
    service.awaitExecution(first.getId(), OWNER, MAX_WAIT);
    int fetchesAfterFirst = connector.fetchCount();
    var second = service.executeQuery(request);
    var finished = service.awaitExecution(second.getId(), OWNER, MAX_WAIT);

    assertThat(second.getQueryFingerprint()).isEqualTo(first.getQueryFingerprint());
    assertThat(finished.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
    assertThat(finished.isCacheHit()).isTrue();
    assertThat(connector.fetchCount()).isEqualTo(fetchesAfterFirst);
    assertThat(service.getResults(second.getId(), OWNER, null).generatedAt())
        .isEqualTo(service.getResults(first.getId(), OWNER, null).generatedAt());
  }

  @Test
  void cancelExecution_abortsRunningQueryAndCachesNothing() throws Exception {
    connector.records(List.of(user("Alice", "Sales"))).holdFetches();

    var submitted = submit(enabledUsers());
    assertThat(connector.awaitFetchStarted(2000)).isTrue();
    service.cancelExecution(submitted.getId(), OWNER);
    var finished = service.awaitExecution(submitted.getId(), OWNER, MAX_WAIT);

    assertThat(finished.getStatus()).isEqualTo(ExecutionStatus.CANCELLED);
    assertThat(finished.getCompletedAt()).isNotNull();
    assertThat(resultCache.get(submitted.getQueryFingerprint())).isEmpty();
    assertThatThrownBy(() -> service.getResults(submitted.getId(), OWNER, null))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void cancelExecution_rejectsFinishedExecution() {
    connector.records(List.of(user("Alice", "Sales")));
    var submitted = submit(enabledUsers());
    service.awaitExecution(submitted.getId(), OWNER, MAX_WAIT);

    assertThatThrownBy(() -> service.cancelExecution(submitted.getId(), OWNER))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void executeQuery_rejectsInvalidQueryBeforeRecordingIt() {
    var raw =
        new RawQueryRequest(
            "directory", List.of("shoeSize"), List.of(), null, null, 1, 50, Map.of());

    assertThatThrownBy(() -> submit(raw))
        .isInstanceOf(QueryValidationException.class);
    verify(recordRepository, never()).save(any(ExecutionRecord.class));
  }

  @Test
  void executeQuery_rejectsUnknownCredential() {
    assertThatThrownBy(
            () ->
                service.executeQuery(
                    ExecutionRequest.forQuery(OWNER, enabledUsers(), "missing", null)))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void executeQuery_runsCustomReportWithItsDefaultCredential() {
    connector.records(List.of(user("Alice", "Sales"), user("Bob", "Legal")));
    var reportId = UUID.randomUUID();
    var report =
        TestEntities.withId(
            new CustomReport(
                OWNER,
                "By department",
                SourceKind.DIRECTORY,
                definitionMapper.toDocument(byDepartment()),
                clock.instant()),
            reportId);
    report.updateDetails(null, CREDENTIAL_ID, null, List.of(), clock.instant());
    when(customReportRepository.findByIdAndOwnerId(reportId, OWNER))
        .thenReturn(Optional.of(report));

    var submitted =
        service.executeQuery(
            ExecutionRequest.forCustomReport(
                OWNER, reportId, Map.of("dept", "Sales"), null, null));
    var finished = service.awaitExecution(submitted.getId(), OWNER, MAX_WAIT);

    assertThat(finished.getStatus()).isEqualTo(ExecutionStatus.COMPLETED);
    assertThat(finished.getCustomReportId()).isEqualTo(reportId);
    assertThat(finished.getCredentialId()).isEqualTo(CREDENTIAL_ID);
    verify(customReportRepository).recordExecution(eq(reportId), any());
  }

  @Test
  void getResults_failsOnceCacheIsCleared() {
    connector.records(List.of(user("Alice", "Sales")));
    var submitted = submit(enabledUsers());
    service.awaitExecution(submitted.getId(), OWNER, MAX_WAIT);

    service.clearCache(SourceKind.DIRECTORY, CREDENTIAL_ID);

    assertThatThrownBy(() -> service.getResults(submitted.getId(), OWNER, null))
        .isInstanceOf(ResultsExpiredException.class);
  }

  @Test
  void getResults_slicesStoredRowsByPage() {
    var users = new ArrayList<RawRecord>();
    for (int i = 0; i < 25; i++) {
      users.add(user("User " + (char) ('A' + i), "Sales"));
    }
    connector.records(users);
    var raw =
        new RawQueryRequest(
            "directory",
            List.of("displayName"),
            List.of(),
            null,
            new RawQueryRequest.RawOrderBy("displayName", "asc"),
            1,
            10,
            Map.of());
    var submitted = submit(raw);
    service.awaitExecution(submitted.getId(), OWNER, MAX_WAIT);

    var third = service.getResults(submitted.getId(), OWNER, 3);

    assertThat(third.totalRows()).isEqualTo(25);
    assertThat(third.pageSize()).isEqualTo(10);
    assertThat(third.rows())
        .extracting(row -> row.get("displayName"))
        .containsExactly("User U", "User V", "User W", "User X", "User Y");
    assertThat(third.hasNext()).isFalse();
  }

  @Test
  void getExecution_hidesOtherOwnersExecutions() {
    connector.records(List.of(user("Alice", "Sales")));
    var submitted = submit(enabledUsers());

    assertThatThrownBy(() -> service.getExecution(submitted.getId(), "user_2"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void clearCache_requiresCompleteScope() {
    assertThatThrownBy(() -> service.clearCache(SourceKind.DIRECTORY, null))
        .isInstanceOf(InvalidStateException.class);
  }

  private ExecutionRecord submit(RawQueryRequest raw) {
    return service.executeQuery(ExecutionRequest.forQuery(OWNER, raw, CREDENTIAL_ID, null));
  }

  private static RawQueryRequest enabledUsers() {
    return new RawQueryRequest(
        "directory",
        List.of("displayName", "department"),
        List.of(new RawFilter("enabled", "equals", true)),
        null,
        null,
        1,
        50,
        Map.of());
  }

  private static RawQueryRequest byDepartment() {
    return new RawQueryRequest(
        "directory",
        List.of("displayName"),
        List.of(new RawFilter("department", "equals", "{{dept}}")),
        null,
        null,
        1,
        50,
        Map.of());
  }

  private static RawRecord user(String displayName, String department) {
    var attributes = new LinkedHashMap<String, Object>();
    attributes.put("displayName", displayName);
    attributes.put("department", department);
    attributes.put("userAccountControl", "512");
    return RawRecord.of(attributes);
  }
}
