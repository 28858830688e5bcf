package io.b2mash.tms.tendering.cascade;

import io.b2mash.tms.tendering.event.OfferEvent;
import io.b2mash.tms.tendering.event.TenderEvent;
import io.b2mash.tms.tendering.event.TenderEventType;
import io.b2mash.tms.tendering.exception.CascadeEscalationException;
import io.b2mash.tms.tendering.tender.TenderMode;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Drives sequential escalation inside the transaction that closed a tier, or that rejected or
 * withdrew the last bid of a closed tier. A failure rolls that transaction back.
 */
@Component
public class CascadeEscalationListener {

  private static final Logger log = LoggerFactory.getLogger(CascadeEscalationListener.class);

  private final CascadeEscalationService escalationService;

  public CascadeEscalationListener(CascadeEscalationService escalationService) {
    this.escalationService = escalationService;
  }

  @EventListener
  public void onTenderEvent(TenderEvent event) {
    if (event.type() == TenderEventType.TENDER_CLOSED && event.mode() == TenderMode.SEQUENTIAL) {
      escalate(event.tenderId());
    }
  }

  @EventListener
  public void onOfferEvent(OfferEvent event) {
    if (event.type() == TenderEventType.OFFER_REJECTED
        || event.type() == TenderEventType.OFFER_WITHDRAWN) {
      escalate(event.tenderId());
    }
  }

  private void escalate(UUID tenderId) {
    try {
      escalationService
          .escalateFrom(tenderId)
          .ifPresent(opened -> log.debug("Tender {} opened by escalation", opened));
    } catch (RuntimeException e) {
      throw new CascadeEscalationException(tenderId, e);
    }
  }
}
