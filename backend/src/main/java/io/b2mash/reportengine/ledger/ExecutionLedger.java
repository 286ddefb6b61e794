package io.b2mash.reportengine.ledger;

import io.b2mash.reportengine.exception.ResourceNotFoundException;
import io.b2mash.reportengine.execution.ErrorKind;
import io.b2mash.reportengine.execution.ExecutionWarning;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistent history of executions. Records are created at submission and advanced through their
 * state machine; every terminal transition publishes an {@link ExecutionFinishedEvent}.
 */
@Service
public class ExecutionLedger {

  private static final Logger log = LoggerFactory.getLogger(ExecutionLedger.class);

  private final ExecutionRecordRepository repository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public ExecutionLedger(
      ExecutionRecordRepository repository,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.repository = repository;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional
  public ExecutionRecord start(
      String fingerprint,
      SourceKind source,
      String credentialId,
      String ownerId,
      UUID customReportId,
      Map<String, Object> queryDefinition) {
    var record =
        repository.save(
            new ExecutionRecord(
                fingerprint,
                source,
                credentialId,
                ownerId,
                customReportId,
                queryDefinition,
                clock.instant()));
    log.info(
        "Execution submitted: id={}, source={}, owner={}, fingerprint={}",
        record.getId(),
        source.slug(),
        ownerId,
        fingerprint);
    return record;
  }

  @Transactional
  public ExecutionRecord markRunning(UUID id) {
    var record = require(id);
    record.markRunning(clock.instant());
    return repository.save(record);
  }

  @Transactional
  public ExecutionRecord complete(
      UUID id, int rowCount, boolean truncated, List<ExecutionWarning> warnings, boolean cacheHit) {
    var record = require(id);
    record.complete(
        rowCount,
        truncated,
        warnings.stream().map(ExecutionWarning::toMap).toList(),
        cacheHit,
        clock.instant());
    return finish(record);
  }

  @Transactional
  public ExecutionRecord fail(UUID id, ErrorKind kind, String message) {
    var record = require(id);
    record.fail(kind, message, clock.instant());
    return finish(record);
  }

  @Transactional
  public ExecutionRecord cancel(UUID id, String message) {
    var record = require(id);
    record.cancel(message, clock.instant());
    return finish(record);
  }

  @Transactional(readOnly = true)
  public ExecutionRecord get(UUID id, String ownerId) {
    return repository
        .findByIdAndOwnerId(id, ownerId)
        .orElseThrow(() -> new ResourceNotFoundException("Execution", id));
  }

  @Transactional(readOnly = true)
  public Page<ExecutionRecord> query(
      String ownerId, ExecutionHistoryFilter filter, int page, int pageSize) {
    var criteria = filter != null ? filter : ExecutionHistoryFilter.none();
    return repository.findHistory(
        ownerId,
        criteria.source(),
        criteria.status(),
        criteria.customReportId(),
        criteria.submittedFrom(),
        criteria.submittedTo(),
        PageRequest.of(page - 1, pageSize));
  }

  private ExecutionRecord require(UUID id) {
    return repository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Execution", id));
  }

  private ExecutionRecord finish(ExecutionRecord record) {
    var saved = repository.save(record);
    log.info(
        "Execution finished: id={}, status={}, rows={}, cacheHit={}, errorKind={}",
        saved.getId(),
        saved.getStatus(),
        saved.getRowCount(),
        saved.isCacheHit(),
        saved.getErrorKind());
    eventPublisher.publishEvent(ExecutionFinishedEvent.of(saved));
    return saved;
  }
}
