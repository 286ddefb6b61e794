package io.b2mash.reportengine.customreport;

import io.b2mash.reportengine.engine.ExecutionRequest;
import io.b2mash.reportengine.engine.ReportQueryService;
import io.b2mash.reportengine.exception.InvalidStateException;
import io.b2mash.reportengine.exception.ResourceConflictException;
import io.b2mash.reportengine.exception.ResourceNotFoundException;
import io.b2mash.reportengine.ledger.ExecutionRecord;
import io.b2mash.reportengine.query.QueryDefinitionMapper;
import io.b2mash.reportengine.query.QueryValidationException;
import io.b2mash.reportengine.query.RawQueryRequest;
import io.b2mash.reportengine.query.ValidationError;
import io.b2mash.reportengine.source.SourceKind;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Saved query definitions, scoped to their owner. Definitions are stored as submitted so that
 * parameter placeholders survive; when a default credential is set they are validated against
 * its catalog first.
 */
@Service
public class CustomReportService {

  private static final Logger log = LoggerFactory.getLogger(CustomReportService.class);

  private final CustomReportRepository repository;
  private final ReportQueryService reportQueryService;
  private final QueryDefinitionMapper definitionMapper;
  private final ScheduledJobLookup scheduledJobLookup;
  private final Clock clock;

  public CustomReportService(
      CustomReportRepository repository,
      ReportQueryService reportQueryService,
      QueryDefinitionMapper definitionMapper,
      ScheduledJobLookup scheduledJobLookup,
      Clock clock) {
    this.repository = repository;
    this.reportQueryService = reportQueryService;
    this.definitionMapper = definitionMapper;
    this.scheduledJobLookup = scheduledJobLookup;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public CustomReport get(UUID id, String ownerId) {
    return repository
        .findByIdAndOwnerId(id, ownerId)
        .orElseThrow(() -> new ResourceNotFoundException("CustomReport", id));
  }

  @Transactional(readOnly = true)
  public List<CustomReport> list(String ownerId, String category) {
    return repository.findByOwner(ownerId, category);
  }

  @Transactional
  public CustomReport create(String ownerId, CustomReportRequest request) {
    var name = requireName(request.name());
    if (repository.existsByOwnerIdAndName(ownerId, name)) {
      throw ResourceConflictException.duplicateName("custom report", name);
    }
    if (request.query() == null) {
      throw new InvalidStateException("Missing query", "A custom report needs a query");
    }
    var source = checkDefinition(request.query(), request.credentialId());
    var now = clock.instant();
    var report =
        new CustomReport(ownerId, name, source, definitionMapper.toDocument(request.query()), now);
    report.updateDetails(
        request.description(), request.credentialId(), request.category(), request.tags(), now);
    report = repository.save(report);
    log.info(
        "Created custom report: id={}, owner={}, source={}, name={}",
        report.getId(),
        ownerId,
        source.slug(),
        name);
    return report;
  }

  @Transactional
  public CustomReport update(UUID id, String ownerId, CustomReportRequest request) {
    var report = get(id, ownerId);
    var now = clock.instant();
    var name = requireName(request.name());
    if (!name.equals(report.getName())) {
      if (repository.existsByOwnerIdAndNameAndIdNot(ownerId, name, id)) {
        throw ResourceConflictException.duplicateName("custom report", name);
      }
      report.rename(name, now);
    }
    var query =
        request.query() != null
            ? request.query()
            : definitionMapper.fromDocument(report.getQueryDefinition());
    var source = checkDefinition(query, request.credentialId());
    report.updateDefinition(source, definitionMapper.toDocument(query), now);
    report.updateDetails(
        request.description(), request.credentialId(), request.category(), request.tags(), now);
    return repository.save(report);
  }

  @Transactional
  public CustomReport setLocked(UUID id, String ownerId, boolean locked) {
    var report = get(id, ownerId);
    report.setLocked(locked, clock.instant());
    return repository.save(report);
  }

  /**
   * Deletes a report.
   *
   * @throws ReportInUseException if the report is locked or a scheduled job still runs it
   */
  @Transactional
  public void delete(UUID id, String ownerId) {
    var report = get(id, ownerId);
    if (report.isLocked()) {
      throw new ReportInUseException(id, "it is locked");
    }
    if (scheduledJobLookup.hasActiveJob(id)) {
      throw new ReportInUseException(id, "an active scheduled job runs it");
    }
    repository.delete(report);
    log.info("Deleted custom report: id={}, owner={}", id, ownerId);
  }

  /**
   * Runs the report with {@code parameters} layered over its stored ones.
   *
   * @param credentialId overrides the report's default credential when not {@code null}
   */
  public ExecutionRecord execute(
      UUID id,
      String ownerId,
      Map<String, Object> parameters,
      String credentialId,
      Duration timeout) {
    return reportQueryService.executeQuery(
        ExecutionRequest.forCustomReport(ownerId, id, parameters, credentialId, timeout));
  }

  private SourceKind checkDefinition(RawQueryRequest query, String credentialId) {
    if (credentialId != null) {
      return reportQueryService.validateAndCompile(query, credentialId).definition().source();
    }
    return SourceKind.fromSlug(query.source())
        .orElseThrow(
            () ->
                new QueryValidationException(
                    List.of(
                        new ValidationError(
                            ValidationError.Code.UNKNOWN_SOURCE,
                            "source",
                            "Unknown source '" + query.source() + "'"))));
  }

  private static String requireName(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidStateException("Missing name", "A custom report needs a name");
    }
    return name.strip();
  }
}
