package io.b2mash.tms.tendering.tender;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TenderOfferRepository extends JpaRepository<TenderOffer, UUID> {

  List<TenderOffer> findByTenderIdOrderByCreatedAtAsc(UUID tenderId);

  List<TenderOffer> findByTenderIdOrderByStatusAscPriceAmountAsc(UUID tenderId);

  List<TenderOffer> findByTenderIdAndStatus(UUID tenderId, OfferStatus status);

  Optional<TenderOffer> findByTenderIdAndCarrierId(UUID tenderId, UUID carrierId);

  List<TenderOffer> findByCarrierIdOrderByCreatedAtDesc(UUID carrierId);

  List<TenderOffer> findByCarrierIdAndStatusOrderByCreatedAtDesc(
      UUID carrierId, OfferStatus status);

  boolean existsByTenderIdAndStatus(UUID tenderId, OfferStatus status);

  /** Resolves the owning tender without loading the offer, so the tender can be locked first. */
  @Query("SELECT o.tenderId FROM TenderOffer o WHERE o.id = :offerId")
  Optional<UUID> findTenderIdByOfferId(@Param("offerId") UUID offerId);

  @Query(
      """
      SELECT COUNT(o) FROM TenderOffer o
      WHERE o.status = :status
        AND o.tenderId IN (SELECT t.id FROM Tender t WHERE t.cascadeRootId = :cascadeRootId)
      """)
  long countInCascadeByStatus(
      @Param("cascadeRootId") UUID cascadeRootId, @Param("status") OfferStatus status);
}
