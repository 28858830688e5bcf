package io.b2mash.tms.tendering.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for tender and offer events published via Spring ApplicationEventPublisher.
 * Implementations are records holding IDs and values only, never JPA entities, so they stay valid
 * after the publishing transaction commits.
 */
public sealed interface TenderDomainEvent permits TenderEvent, OfferEvent {

  TenderEventType type();

  UUID entityId();

  Instant occurredAt();

  /** Flat snapshot written to the audit trail. */
  Map<String, Object> details();

  default String eventType() {
    return type().eventType();
  }

  default String entityType() {
    return type().entityType();
  }
}
