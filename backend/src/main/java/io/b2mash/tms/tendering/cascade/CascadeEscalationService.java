package io.b2mash.tms.tendering.cascade;

import io.b2mash.tms.tendering.audit.AuditSources;
import io.b2mash.tms.tendering.event.TenderEventPublisher;
import io.b2mash.tms.tendering.event.TenderEventType;
import io.b2mash.tms.tendering.exception.ResourceNotFoundException;
import io.b2mash.tms.tendering.tender.OfferStatus;
import io.b2mash.tms.tendering.tender.Tender;
import io.b2mash.tms.tendering.tender.TenderMode;
import io.b2mash.tms.tendering.tender.TenderOfferRepository;
import io.b2mash.tms.tendering.tender.TenderRepository;
import io.b2mash.tms.tendering.tender.TenderStatus;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Opens the next tier of a sequential cascade once a tier has closed with nothing left to award.
 *
 * <p>A closed tier escalates only when it holds no ACCEPTED and no SUBMITTED offer and the cascade
 * has not been resolved elsewhere. Only a DRAFT child is opened, which makes repeated calls for the
 * same tier harmless. Everything is decided from persisted state under the tender locks.
 */
@Service
public class CascadeEscalationService {

  private static final Logger log = LoggerFactory.getLogger(CascadeEscalationService.class);

  private final TenderRepository tenderRepository;
  private final TenderOfferRepository offerRepository;
  private final TenderEventPublisher eventPublisher;

  public CascadeEscalationService(
      TenderRepository tenderRepository,
      TenderOfferRepository offerRepository,
      TenderEventPublisher eventPublisher) {
    this.tenderRepository = tenderRepository;
    this.offerRepository = offerRepository;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Escalates from the given tier if the escalation rule holds.
   *
   * @return the ID of the tender that was opened, or empty if nothing opened
   */
  @Transactional
  public Optional<UUID> escalateFrom(UUID tenderId) {
    return escalateFrom(tenderId, AuditSources.INTERNAL);
  }

  /** As {@link #escalateFrom(UUID)}, auditing the opened tier with {@code source}. */
  @Transactional
  public Optional<UUID> escalateFrom(UUID tenderId, String source) {
    var tender =
        tenderRepository
            .findByIdForUpdate(tenderId)
            .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));

    if (tender.getMode() != TenderMode.SEQUENTIAL || tender.getStatus() != TenderStatus.CLOSED) {
      return Optional.empty();
    }
    if (offerRepository.existsByTenderIdAndStatus(tenderId, OfferStatus.ACCEPTED)
        || offerRepository.existsByTenderIdAndStatus(tenderId, OfferStatus.SUBMITTED)) {
      log.debug("Tender {} still has bids to award, not escalating", tender.getTenderNumber());
      return Optional.empty();
    }
    if (isCascadeResolved(tender)) {
      log.debug("Cascade of tender {} already resolved", tender.getTenderNumber());
      return Optional.empty();
    }

    var childIds = tenderRepository.findChildIds(tenderId, TenderMode.SEQUENTIAL);
    if (childIds.isEmpty()) {
      log.info("Cascade exhausted: tender {} was the last tier", tender.getTenderNumber());
      return Optional.empty();
    }

    var child =
        tenderRepository
            .findByIdForUpdate(childIds.get(0))
            .orElseThrow(() -> new ResourceNotFoundException("Tender", childIds.get(0)));
    if (child.getStatus() != TenderStatus.DRAFT) {
      log.debug(
          "Next tier {} is already {}, nothing to open", child.getTenderNumber(), child.getStatus());
      return Optional.empty();
    }

    child.open();
    child = tenderRepository.save(child);
    eventPublisher.tender(TenderEventType.TENDER_OPENED, child, source);
    log.info(
        "Escalated cascade from tender {} (tier {}) to {} (tier {})",
        tender.getTenderNumber(),
        tender.getTier(),
        child.getTenderNumber(),
        child.getTier());
    return Optional.of(child.getId());
  }

  private boolean isCascadeResolved(Tender tender) {
    var rootId = tender.getCascadeRootId();
    if (rootId == null) {
      return false;
    }
    return tenderRepository.existsByCascadeRootIdAndStatus(rootId, TenderStatus.AWARDED)
        || offerRepository.countInCascadeByStatus(rootId, OfferStatus.ACCEPTED) > 0;
  }
}
