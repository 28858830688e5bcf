package io.b2mash.tms.tendering.tender;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenderRepository extends JpaRepository<Tender, UUID> {

  /** Loads the tender under a row lock; every mutation of a tender or its offers goes through it. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Tender t WHERE t.id = :id")
  Optional<Tender> findByIdForUpdate(@Param("id") UUID id);

  List<Tender> findByStatusAndOfferDeadlineBefore(TenderStatus status, Instant now);

  List<Tender> findByCascadeRootIdOrderByTierAsc(UUID cascadeRootId);

  /** IDs only, so the caller can lock the child before loading it. */
  @Query(
      "SELECT t.id FROM Tender t WHERE t.parentTenderId = :parentTenderId AND t.mode = :mode"
          + " ORDER BY t.tier ASC")
  List<UUID> findChildIds(
      @Param("parentTenderId") UUID parentTenderId, @Param("mode") TenderMode mode);

  boolean existsByCascadeRootIdAndStatus(UUID cascadeRootId, TenderStatus status);

  /** Closed sequential tiers whose child tier is still DRAFT, i.e. escalation not yet applied. */
  @Query(
      """
      SELECT p.id FROM Tender p
      WHERE p.mode = io.b2mash.tms.tendering.tender.TenderMode.SEQUENTIAL
        AND p.status = io.b2mash.tms.tendering.tender.TenderStatus.CLOSED
        AND EXISTS (
          SELECT c.id FROM Tender c
          WHERE c.parentTenderId = p.id
            AND c.status = io.b2mash.tms.tendering.tender.TenderStatus.DRAFT)
      """)
  List<UUID> findClosedSequentialWithDraftChild();

  @Query(
      """
      SELECT t FROM Tender t
      WHERE (:orderId IS NULL OR t.orderId = :orderId)
        AND (:status IS NULL OR t.status = :status)
        AND (:mode IS NULL OR t.mode = :mode)
        AND (:tier IS NULL OR t.tier = :tier)
      ORDER BY t.createdAt DESC, t.tier ASC
      """)
  List<Tender> findFiltered(
      @Param("orderId") UUID orderId,
      @Param("status") TenderStatus status,
      @Param("mode") TenderMode mode,
      @Param("tier") Integer tier);
}
