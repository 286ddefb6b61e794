package io.b2mash.reportengine.customreport;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface CustomReportRepository extends JpaRepository<CustomReport, UUID> {

  Optional<CustomReport> findByIdAndOwnerId(UUID id, String ownerId);

  @Query(
      """
      SELECT r FROM CustomReport r
      WHERE r.ownerId = :ownerId
        AND (:category IS NULL OR r.category = :category)
      ORDER BY r.name ASC
      """)
  List<CustomReport> findByOwner(
      @Param("ownerId") String ownerId, @Param("category") String category);

  /** Counts a run. Leaves {@code updatedAt} alone, which tracks edits only. */
  @Modifying
  @Transactional
  @Query(
      """
      UPDATE CustomReport r
      SET r.executionCount = r.executionCount + 1, r.lastExecutedAt = :executedAt
      WHERE r.id = :id
      """)
  int recordExecution(@Param("id") UUID id, @Param("executedAt") Instant executedAt);

  boolean existsByOwnerIdAndName(String ownerId, String name);

  boolean existsByOwnerIdAndNameAndIdNot(String ownerId, String name, UUID id);
}
