package io.b2mash.tms.tendering.tender;

import io.b2mash.tms.tendering.event.TenderEventPublisher;
import io.b2mash.tms.tendering.event.TenderEventType;
import io.b2mash.tms.tendering.exception.InvalidStateException;
import io.b2mash.tms.tendering.exception.ResourceConflictException;
import io.b2mash.tms.tendering.exception.ResourceNotFoundException;
import io.b2mash.tms.tendering.hook.HookRegistry;
import io.b2mash.tms.tendering.hook.TenderHooks;
import io.b2mash.tms.tendering.logistics.ShipmentCarrierAssigner;
import io.b2mash.tms.tendering.tender.dto.AwardOutcome;
import io.b2mash.tms.tendering.tender.dto.AwardRequest;
import io.b2mash.tms.tendering.tender.dto.TenderResponse;
import java.util.ArrayList;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Awards a closed tender to one submitted offer.
 *
 * <p>The tender status, the winning and losing offers, the shipment assignment, the events and the
 * audit rows are written in one transaction: a failure in any step (including the shipment
 * collaborator) leaves the tender CLOSED with its offers untouched.
 */
@Service
public class TenderAwardService {

  private static final Logger log = LoggerFactory.getLogger(TenderAwardService.class);

  private final TenderRepository tenderRepository;
  private final TenderOfferRepository offerRepository;
  private final ShipmentCarrierAssigner shipmentCarrierAssigner;
  private final HookRegistry hookRegistry;
  private final TenderEventPublisher eventPublisher;

  public TenderAwardService(
      TenderRepository tenderRepository,
      TenderOfferRepository offerRepository,
      ShipmentCarrierAssigner shipmentCarrierAssigner,
      HookRegistry hookRegistry,
      TenderEventPublisher eventPublisher) {
    this.tenderRepository = tenderRepository;
    this.offerRepository = offerRepository;
    this.shipmentCarrierAssigner = shipmentCarrierAssigner;
    this.hookRegistry = hookRegistry;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public TenderResponse award(UUID tenderId, UUID offerId) {
    var tender =
        tenderRepository
            .findByIdForUpdate(tenderId)
            .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
    if (tender.getStatus() != TenderStatus.CLOSED) {
      throw InvalidStateException.forStatus("tender", "award", tender.getStatus());
    }
    var winner =
        offerRepository
            .findById(offerId)
            .filter(o -> o.getTenderId().equals(tenderId))
            .orElseThrow(
                () ->
                    ResourceNotFoundException.offerOnTender(offerId, tender.getTenderNumber()));
    if (winner.getStatus() != OfferStatus.SUBMITTED) {
      throw new ResourceConflictException(
          "Offer not awardable",
          "Offer " + offerId + " is " + winner.getStatus() + ", only SUBMITTED offers can win");
    }

    boolean otherAccepted =
        offerRepository.findByTenderIdAndStatus(tenderId, OfferStatus.ACCEPTED).stream()
            .anyMatch(o -> !o.getId().equals(offerId));
    if (otherAccepted) {
      throw ResourceConflictException.offerAlreadyAccepted(tender.getTenderNumber());
    }

    hookRegistry.runPre(
        TenderHooks.BEFORE_TENDER_AWARD,
        new AwardRequest(
            tenderId,
            tender.getTenderNumber(),
            offerId,
            winner.getCarrierId(),
            winner.getPriceAmount(),
            winner.getPriceCurrency()));

    // 1. Tender first, so listeners reacting to the offer events see it AWARDED
    tender.markAwarded(winner.getId(), winner.getCarrierId());
    var awarded = tenderRepository.save(tender);

    // 2. Winner
    winner.accept();
    winner = offerRepository.save(winner);

    // 3. Rivals that are still in the running
    var rejectedIds = new ArrayList<UUID>();
    var rejected = new ArrayList<TenderOffer>();
    for (var rival : offerRepository.findByTenderIdAndStatus(tenderId, OfferStatus.SUBMITTED)) {
      if (rival.getId().equals(winner.getId())) {
        continue;
      }
      rival.reject();
      rejected.add(offerRepository.save(rival));
      rejectedIds.add(rival.getId());
    }

    // 4. Shipment
    if (awarded.getShipmentId() != null) {
      shipmentCarrierAssigner.assignCarrier(awarded.getShipmentId(), winner.getCarrierId());
    }

    eventPublisher.tender(TenderEventType.TENDER_AWARDED, awarded);
    eventPublisher.offer(TenderEventType.OFFER_ACCEPTED, winner);
    rejected.forEach(o -> eventPublisher.offer(TenderEventType.OFFER_REJECTED, o));

    log.info(
        "Awarded tender {} to carrier {} at {} {}, {} rival offer(s) rejected",
        awarded.getTenderNumber(),
        winner.getCarrierId(),
        winner.getPriceAmount(),
        winner.getPriceCurrency(),
        rejectedIds.size());

    var response =
        TenderResponse.from(awarded, offerRepository.findByTenderIdOrderByCreatedAtAsc(tenderId));
    hookRegistry.publishPost(
        TenderHooks.AFTER_TENDER_AWARD,
        new AwardOutcome(response, winner.getId(), winner.getCarrierId(), rejectedIds));
    return response;
  }
}
