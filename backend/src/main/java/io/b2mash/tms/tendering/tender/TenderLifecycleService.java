package io.b2mash.tms.tendering.tender;

import io.b2mash.tms.tendering.audit.AuditSources;
import io.b2mash.tms.tendering.event.TenderEventPublisher;
import io.b2mash.tms.tendering.event.TenderEventType;
import io.b2mash.tms.tendering.exception.ResourceNotFoundException;
import io.b2mash.tms.tendering.tender.dto.TenderResponse;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tender status transitions. Every method locks the tender row before reading its status.
 *
 * <p>Closing publishes {@link TenderEventType#TENDER_CLOSED} synchronously, so cascade escalation
 * runs in the closing transaction and a failed escalation rolls the close back.
 */
@Service
public class TenderLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(TenderLifecycleService.class);

  private final TenderRepository tenderRepository;
  private final TenderOfferRepository offerRepository;
  private final TenderEventPublisher eventPublisher;

  public TenderLifecycleService(
      TenderRepository tenderRepository,
      TenderOfferRepository offerRepository,
      TenderEventPublisher eventPublisher) {
    this.tenderRepository = tenderRepository;
    this.offerRepository = offerRepository;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public TenderResponse open(UUID tenderId) {
    var tender = lockTender(tenderId);
    tender.open();
    tender = tenderRepository.save(tender);
    eventPublisher.tender(TenderEventType.TENDER_OPENED, tender);
    log.info("Opened tender {} (tier {})", tender.getTenderNumber(), tender.getTier());
    return toResponse(tender);
  }

  @Transactional
  public TenderResponse close(UUID tenderId) {
    var tender = lockTender(tenderId);
    tender.close();
    tender = tenderRepository.save(tender);
    log.info("Closed tender {} (tier {})", tender.getTenderNumber(), tender.getTier());
    eventPublisher.tender(TenderEventType.TENDER_CLOSED, tender);
    return toResponse(tender);
  }

  @Transactional
  public TenderResponse cancel(UUID tenderId, String reason) {
    var tender = lockTender(tenderId);
    tender.cancel(reason);
    tender = tenderRepository.save(tender);
    eventPublisher.tender(TenderEventType.TENDER_CANCELLED, tender);
    log.info("Cancelled tender {}: {}", tender.getTenderNumber(), reason);
    return toResponse(tender);
  }

  /**
   * Pushes the offer deadline of a DRAFT or OPEN tender later, together with the validity of its
   * PENDING offers. Lets a waiting sequential tier outlive its original deadline.
   */
  @Transactional
  public TenderResponse extendDeadline(UUID tenderId, Instant newDeadline) {
    var tender = lockTender(tenderId);
    var previous = tender.getOfferDeadline();
    tender.extendDeadline(newDeadline, Instant.now());
    tender = tenderRepository.save(tender);

    for (var offer : offerRepository.findByTenderIdAndStatus(tenderId, OfferStatus.PENDING)) {
      offer.extendValidity(newDeadline);
      offerRepository.save(offer);
    }

    eventPublisher.tender(TenderEventType.TENDER_UPDATED, tender);
    log.info(
        "Extended deadline of tender {} from {} to {}",
        tender.getTenderNumber(),
        previous,
        newDeadline);
    return toResponse(tender);
  }

  /**
   * Closes the tender if it is still OPEN and its deadline is before {@code now}. Re-checked under
   * the lock, so a tender closed manually in the meantime is left alone.
   *
   * @return true if the tender was closed by this call
   */
  @Transactional
  public boolean closeIfExpired(UUID tenderId, Instant now) {
    var tender = lockTender(tenderId);
    if (tender.getStatus() != TenderStatus.OPEN || !tender.isDeadlinePassed(now)) {
      return false;
    }
    tender.close();
    tender = tenderRepository.save(tender);
    log.info(
        "Closed tender {} at deadline {}", tender.getTenderNumber(), tender.getOfferDeadline());
    eventPublisher.tender(TenderEventType.TENDER_CLOSED, tender, AuditSources.SWEEP);
    return true;
  }

  private Tender lockTender(UUID tenderId) {
    return tenderRepository
        .findByIdForUpdate(tenderId)
        .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
  }

  private TenderResponse toResponse(Tender tender) {
    return TenderResponse.from(
        tender, offerRepository.findByTenderIdOrderByCreatedAtAsc(tender.getId()));
  }
}
