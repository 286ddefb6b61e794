package io.b2mash.reportengine.engine;

import io.b2mash.reportengine.cache.QueryFingerprinter;
import io.b2mash.reportengine.cache.ResultCache;
import io.b2mash.reportengine.catalog.FieldCatalog;
import io.b2mash.reportengine.catalog.FieldCatalogService;
import io.b2mash.reportengine.compiler.CompilerRegistry;
import io.b2mash.reportengine.credential.Credential;
import io.b2mash.reportengine.credential.CredentialStore;
import io.b2mash.reportengine.credential.CredentialUnavailableException;
import io.b2mash.reportengine.customreport.CustomReportRepository;
import io.b2mash.reportengine.exception.InvalidStateException;
import io.b2mash.reportengine.exception.ResourceNotFoundException;
import io.b2mash.reportengine.exception.ResultsExpiredException;
import io.b2mash.reportengine.execution.ExecutionProperties;
import io.b2mash.reportengine.ledger.ExecutionHistoryFilter;
import io.b2mash.reportengine.ledger.ExecutionLedger;
import io.b2mash.reportengine.ledger.ExecutionRecord;
import io.b2mash.reportengine.ledger.ExecutionStatus;
import io.b2mash.reportengine.query.QueryDefinitionMapper;
import io.b2mash.reportengine.query.QueryProperties;
import io.b2mash.reportengine.query.QueryValidationException;
import io.b2mash.reportengine.query.QueryValidator;
import io.b2mash.reportengine.query.RawQueryRequest;
import io.b2mash.reportengine.query.ValidationError;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

/**
 * Entry point for the route layer. Validation and compilation happen synchronously on the
 * caller's thread; execution is queued and observed through the returned execution record.
 */
@Service
public class ReportQueryService {

  private static final Logger log = LoggerFactory.getLogger(ReportQueryService.class);

  private final FieldCatalogService catalogService;
  private final QueryValidator validator;
  private final CompilerRegistry compilers;
  private final QueryFingerprinter fingerprinter;
  private final QueryDefinitionMapper definitionMapper;
  private final CredentialStore credentialStore;
  private final ResultCache resultCache;
  private final ExecutionLedger ledger;
  private final ExecutionCoordinator coordinator;
  private final CustomReportRepository customReportRepository;
  private final ExecutionProperties executionProperties;
  private final QueryProperties queryProperties;
  private final Clock clock;

  public ReportQueryService(
      FieldCatalogService catalogService,
      QueryValidator validator,
      CompilerRegistry compilers,
      QueryFingerprinter fingerprinter,
      QueryDefinitionMapper definitionMapper,
      CredentialStore credentialStore,
      ResultCache resultCache,
      ExecutionLedger ledger,
      ExecutionCoordinator coordinator,
      CustomReportRepository customReportRepository,
      ExecutionProperties executionProperties,
      QueryProperties queryProperties,
      Clock clock) {
    this.catalogService = catalogService;
    this.validator = validator;
    this.compilers = compilers;
    this.fingerprinter = fingerprinter;
    this.definitionMapper = definitionMapper;
    this.credentialStore = credentialStore;
    this.resultCache = resultCache;
    this.ledger = ledger;
    this.coordinator = coordinator;
    this.customReportRepository = customReportRepository;
    this.executionProperties = executionProperties;
    this.queryProperties = queryProperties;
    this.clock = clock;
  }

  // --- Schema ---

  /** Returns the active catalog for the scope, discovering it when missing or stale. */
  public FieldCatalog discoverSchema(SourceKind source, String credentialId) {
    return catalogService.resolve(source, credentialId);
  }

  public FieldCatalog refreshSchema(SourceKind source, String credentialId) {
    return catalogService.refresh(source, credentialId);
  }

  // --- Queries ---

  /**
   * Validates {@code raw} against the catalog of its source and compiles it.
   *
   * @throws QueryValidationException listing every problem with the query
   */
  public CompiledQuery validateAndCompile(RawQueryRequest raw, String credentialId) {
    var source =
        SourceKind.fromSlug(raw.source())
            .orElseThrow(
                () ->
                    new QueryValidationException(
                        List.of(
                            new ValidationError(
                                ValidationError.Code.UNKNOWN_SOURCE,
                                "source",
                                "Unknown source '" + raw.source() + "'"))));
    Credential credential;
    try {
      credential = credentialStore.getCredential(credentialId);
    } catch (CredentialUnavailableException e) {
      throw ResourceNotFoundException.withDetail("Credential unavailable", e.getMessage(), e);
    }
    var catalog = catalogService.resolve(source, credentialId);
    var definition = validator.validate(raw, catalog);
    var nativeQuery = compilers.compile(definition, catalog);
    var fingerprint =
        fingerprinter.fingerprint(
            nativeQuery, credential, definition.parameters(), catalog.getVersion());
    return new CompiledQuery(definition, catalog, nativeQuery, credential, fingerprint);
  }

  /**
   * Validates, compiles and queues a query or custom report. Returns the PENDING record; progress
   * is read with {@link #getExecution} or {@link #awaitExecution}.
   */
  public ExecutionRecord executeQuery(ExecutionRequest request) {
    var raw = request.query();
    var credentialId = request.credentialId();
    if (request.isCustomReport()) {
      var report =
          customReportRepository
              .findByIdAndOwnerId(request.customReportId(), request.ownerId())
              .orElseThrow(
                  () -> new ResourceNotFoundException("CustomReport", request.customReportId()));
      raw = definitionMapper.fromDocument(report.getQueryDefinition());
      credentialId = credentialId != null ? credentialId : report.getCredentialId();
    }
    if (raw == null) {
      throw new InvalidStateException(
          "Missing query", "Either a query or a report id is required");
    }
    if (credentialId == null) {
      throw new InvalidStateException(
          "Missing credential", "No credential given and the report has no default credential");
    }
    raw = raw.withParameters(request.parameters());

    var compiled = validateAndCompile(raw, credentialId);
    var record =
        ledger.start(
            compiled.fingerprint().value(),
            compiled.definition().source(),
            credentialId,
            request.ownerId(),
            request.customReportId(),
            definitionMapper.toDocument(compiled.definition()));
    if (request.isCustomReport()) {
      customReportRepository.recordExecution(request.customReportId(), clock.instant());
    }
    coordinator.submit(
        record.getId(), compiled, executionProperties.effectiveTimeout(request.timeout()));
    return record;
  }

  // --- Executions ---

  public ExecutionRecord getExecution(UUID executionId, String ownerId) {
    return ledger.get(executionId, ownerId);
  }

  /** Waits up to {@code maxWait} for the execution to finish and returns its current record. */
  public ExecutionRecord awaitExecution(UUID executionId, String ownerId, Duration maxWait) {
    ledger.get(executionId, ownerId);
    coordinator.await(executionId, maxWait);
    return ledger.get(executionId, ownerId);
  }

  public ExecutionRecord cancelExecution(UUID executionId, String ownerId) {
    var record = ledger.get(executionId, ownerId);
    if (record.getStatus().isTerminal()) {
      throw new InvalidStateException(
          "Execution finished",
          "Execution " + executionId + " is already " + record.getStatus());
    }
    if (!coordinator.cancel(executionId)) {
      log.warn("Execution {} is not active in this process, cannot cancel", executionId);
    }
    return ledger.get(executionId, ownerId);
  }

  /**
   * Returns a page of a completed execution's rows from the result cache.
   *
   * @param page 1-based page; {@code null} for the page the query asked for
   * @throws ResultsExpiredException if the rows are no longer cached
   */
  public ResultsPage getResults(UUID executionId, String ownerId, Integer page) {
    var record = ledger.get(executionId, ownerId);
    if (record.getStatus() != ExecutionStatus.COMPLETED) {
      throw new InvalidStateException(
          "Results not available",
          "Execution " + executionId + " is " + record.getStatus() + ", not COMPLETED");
    }
    var entry =
        resultCache
            .get(record.getQueryFingerprint())
            .orElseThrow(() -> new ResultsExpiredException(executionId));

    var stored = definitionMapper.fromDocument(record.getQueryDefinition());
    int pageSize =
        stored.pageSize() != null ? stored.pageSize() : queryProperties.defaultPageSize();
    int requestedPage = page != null ? page : (stored.page() != null ? stored.page() : 1);
    if (requestedPage < 1) {
      throw new InvalidStateException("Invalid page", "Page numbers start at 1");
    }
    int total = entry.rows().size();
    int from = (int) Math.min((long) (requestedPage - 1) * pageSize, total);
    int to = (int) Math.min((long) from + pageSize, total);
    return new ResultsPage(
        executionId,
        requestedPage,
        pageSize,
        total,
        entry.rows().subList(from, to),
        entry.groups(),
        entry.warnings(),
        entry.truncated(),
        entry.generatedAt());
  }

  public Page<ExecutionRecord> listHistory(
      String ownerId, ExecutionHistoryFilter filter, int page, int pageSize) {
    if (page < 1 || pageSize < 1 || pageSize > queryProperties.maxPageSize()) {
      throw new InvalidStateException(
          "Invalid page",
          "Page must be at least 1 and page size between 1 and " + queryProperties.maxPageSize());
    }
    return ledger.query(ownerId, filter, page, pageSize);
  }

  // --- Cache ---

  /** Drops cached results of one (source, credential) scope, or all results when both are null. */
  public void clearCache(SourceKind source, String credentialId) {
    if (source == null && credentialId == null) {
      resultCache.invalidateAll();
      return;
    }
    if (source == null || credentialId == null) {
      throw new InvalidStateException(
          "Incomplete cache scope", "Give both source and credential, or neither");
    }
    resultCache.invalidate(source, credentialId);
  }
}
