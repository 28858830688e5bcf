package io.b2mash.tms.tendering.event;

import io.b2mash.tms.tendering.audit.AuditEventBuilder;
import io.b2mash.tms.tendering.audit.AuditService;
import io.b2mash.tms.tendering.audit.AuditSources;
import io.b2mash.tms.tendering.tender.Tender;
import io.b2mash.tms.tendering.tender.TenderOffer;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Appends the audit row for a transition and publishes the matching domain event, both inside the
 * caller's transaction.
 */
@Component
public class TenderEventPublisher {

  private static final Logger log = LoggerFactory.getLogger(TenderEventPublisher.class);

  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public TenderEventPublisher(
      AuditService auditService, ApplicationEventPublisher eventPublisher) {
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  public void tender(TenderEventType type, Tender tender) {
    tender(type, tender, AuditSources.INTERNAL);
  }

  /** Tender transition attributed to {@code source}, e.g. {@link AuditSources#SWEEP}. */
  public void tender(TenderEventType type, Tender tender, String source) {
    publish(TenderEvent.of(type, tender), null, null, source);
  }

  public void offer(TenderEventType type, TenderOffer offer) {
    publish(OfferEvent.of(type, offer), null, null, AuditSources.INTERNAL);
  }

  /** Offer transition performed by the carrier owning the offer, audited with it as the actor. */
  public void carrierOffer(TenderEventType type, TenderOffer offer) {
    publish(
        OfferEvent.of(type, offer),
        offer.getCarrierId(),
        AuditSources.ACTOR_CARRIER,
        AuditSources.INTERNAL);
  }

  private void publish(TenderDomainEvent event, UUID actorId, String actorType, String source) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(event.eventType())
            .entityType(event.entityType())
            .entityId(event.entityId())
            .actorId(actorId)
            .actorType(actorType)
            .source(source)
            .details(event.details())
            .build());
    log.debug("Publishing {} for {} {}", event.eventType(), event.entityType(), event.entityId());
    eventPublisher.publishEvent(event);
  }
}
