package io.b2mash.tms.tendering.tender;

import io.b2mash.tms.tendering.event.TenderEventPublisher;
import io.b2mash.tms.tendering.event.TenderEventType;
import io.b2mash.tms.tendering.exception.DeadlinePassedException;
import io.b2mash.tms.tendering.exception.ForbiddenException;
import io.b2mash.tms.tendering.exception.InvalidStateException;
import io.b2mash.tms.tendering.exception.ResourceConflictException;
import io.b2mash.tms.tendering.exception.ResourceNotFoundException;
import io.b2mash.tms.tendering.hook.HookRegistry;
import io.b2mash.tms.tendering.hook.TenderHooks;
import io.b2mash.tms.tendering.tender.dto.OfferDecision;
import io.b2mash.tms.tendering.tender.dto.OfferResponse;
import io.b2mash.tms.tendering.tender.dto.OfferSubmission;
import io.b2mash.tms.tendering.tender.dto.SubmitOfferRequest;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

/**
 * Offer transitions: carrier-side submit and withdraw, broker-side accept and reject. The owning
 * tender is locked first in every method.
 */
@Service
@Validated
public class TenderOfferService {

  private static final Logger log = LoggerFactory.getLogger(TenderOfferService.class);

  private final TenderRepository tenderRepository;
  private final TenderOfferRepository offerRepository;
  private final HookRegistry hookRegistry;
  private final TenderEventPublisher eventPublisher;

  public TenderOfferService(
      TenderRepository tenderRepository,
      TenderOfferRepository offerRepository,
      HookRegistry hookRegistry,
      TenderEventPublisher eventPublisher) {
    this.tenderRepository = tenderRepository;
    this.offerRepository = offerRepository;
    this.hookRegistry = hookRegistry;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Submits the carrier's bid on its PENDING placeholder.
   *
   * <p>Checks run in this order: deadline (whatever the tender status), tender OPEN, carrier
   * invited, offer still PENDING. Offer-submit pre hooks may then veto or rewrite the bid.
   */
  @Transactional
  public OfferResponse submitOffer(
      UUID tenderId, UUID carrierId, @Valid SubmitOfferRequest request) {
    var tender = lockTender(tenderId);
    var now = Instant.now();

    if (tender.isDeadlinePassed(now)) {
      throw new DeadlinePassedException(tenderId, tender.getOfferDeadline());
    }
    if (tender.getStatus() != TenderStatus.OPEN) {
      throw InvalidStateException.forStatus("tender", "submit offer to", tender.getStatus());
    }
    var offer =
        offerRepository
            .findByTenderIdAndCarrierId(tenderId, carrierId)
            .orElseThrow(() -> new ForbiddenException(carrierId, tender.getTenderNumber()));
    if (offer.getStatus() != OfferStatus.PENDING) {
      throw new ResourceConflictException(
          "Offer already submitted",
          "Offer of carrier " + carrierId + " is already " + offer.getStatus());
    }

    var submission =
        hookRegistry.runPre(
            TenderHooks.BEFORE_OFFER_SUBMIT, OfferSubmission.of(tenderId, carrierId, request));
    offer.submit(
        submission.priceAmount(),
        submission.priceCurrency(),
        submission.validUntil(),
        submission.conditions(),
        now);
    offer = offerRepository.save(offer);
    eventPublisher.carrierOffer(TenderEventType.OFFER_SUBMITTED, offer);
    log.info(
        "Carrier {} submitted {} {} on tender {}",
        carrierId,
        offer.getPriceAmount(),
        offer.getPriceCurrency(),
        tender.getTenderNumber());

    var response = OfferResponse.from(offer);
    hookRegistry.publishPost(TenderHooks.AFTER_OFFER_SUBMIT, response);
    return response;
  }

  @Transactional
  public OfferResponse withdrawOffer(UUID tenderId, UUID carrierId) {
    var tender = lockTender(tenderId);
    var offer =
        offerRepository
            .findByTenderIdAndCarrierId(tenderId, carrierId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.carrierOfferOnTender(
                        carrierId, tender.getTenderNumber()));
    offer.withdraw();
    offer = offerRepository.save(offer);
    eventPublisher.carrierOffer(TenderEventType.OFFER_WITHDRAWN, offer);
    log.info("Carrier {} withdrew its offer on tender {}", carrierId, tender.getTenderNumber());
    return OfferResponse.from(offer);
  }

  @Transactional
  public OfferResponse acceptOffer(UUID offerId) {
    var tender = lockOwningTender(offerId);
    var offer = loadDecidableOffer(tender, offerId, "accept");
    if (offerRepository.existsByTenderIdAndStatus(tender.getId(), OfferStatus.ACCEPTED)) {
      throw ResourceConflictException.offerAlreadyAccepted(tender.getTenderNumber());
    }

    hookRegistry.runPre(
        TenderHooks.BEFORE_OFFER_ACCEPT,
        new OfferDecision(tender.getId(), offer.getId(), offer.getCarrierId()));
    offer.accept();
    offer = offerRepository.save(offer);
    eventPublisher.offer(TenderEventType.OFFER_ACCEPTED, offer);
    log.info("Accepted offer {} on tender {}", offerId, tender.getTenderNumber());

    var response = OfferResponse.from(offer);
    hookRegistry.publishPost(TenderHooks.AFTER_OFFER_ACCEPT, response);
    return response;
  }

  @Transactional
  public OfferResponse rejectOffer(UUID offerId) {
    var tender = lockOwningTender(offerId);
    var offer = loadDecidableOffer(tender, offerId, "reject");

    offer.reject();
    offer = offerRepository.save(offer);
    eventPublisher.offer(TenderEventType.OFFER_REJECTED, offer);
    log.info("Rejected offer {} on tender {}", offerId, tender.getTenderNumber());
    return OfferResponse.from(offer);
  }

  private Tender lockTender(UUID tenderId) {
    return tenderRepository
        .findByIdForUpdate(tenderId)
        .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
  }

  private Tender lockOwningTender(UUID offerId) {
    var tenderId =
        offerRepository
            .findTenderIdByOfferId(offerId)
            .orElseThrow(() -> new ResourceNotFoundException("Offer", offerId));
    return lockTender(tenderId);
  }

  private TenderOffer loadDecidableOffer(Tender tender, UUID offerId, String action) {
    if (tender.isTerminal()) {
      throw new InvalidStateException(
          "Invalid tender state",
          "Cannot " + action + " offer on tender in status " + tender.getStatus());
    }
    var offer =
        offerRepository
            .findById(offerId)
            .orElseThrow(() -> new ResourceNotFoundException("Offer", offerId));
    if (offer.getStatus() != OfferStatus.SUBMITTED) {
      throw InvalidStateException.forStatus("offer", action, offer.getStatus());
    }
    return offer;
  }
}
