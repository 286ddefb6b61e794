package io.b2mash.reportengine.ledger;

import io.b2mash.reportengine.source.SourceKind;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, UUID> {

  Optional<ExecutionRecord> findByIdAndOwnerId(UUID id, String ownerId);

  @Query(
      """
      SELECT r FROM ExecutionRecord r
      WHERE r.ownerId = :ownerId
        AND (:source IS NULL OR r.source = :source)
        AND (:status IS NULL OR r.status = :status)
        AND (:customReportId IS NULL OR r.customReportId = :customReportId)
        AND (:submittedFrom IS NULL OR r.submittedAt >= :submittedFrom)
        AND (:submittedTo IS NULL OR r.submittedAt < :submittedTo)
      ORDER BY r.submittedAt DESC
      """)
  Page<ExecutionRecord> findHistory(
      @Param("ownerId") String ownerId,
      @Param("source") SourceKind source,
      @Param("status") ExecutionStatus status,
      @Param("customReportId") UUID customReportId,
      @Param("submittedFrom") Instant submittedFrom,
      @Param("submittedTo") Instant submittedTo,
      Pageable pageable);
}
