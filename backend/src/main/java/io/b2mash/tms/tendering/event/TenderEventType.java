package io.b2mash.tms.tendering.event;

/** Closed set of tender and offer transitions published as domain events. */
public enum TenderEventType {
  TENDER_CREATED("tender.created", "tender"),
  TENDER_OPENED("tender.opened", "tender"),
  TENDER_UPDATED("tender.updated", "tender"),
  TENDER_CLOSED("tender.closed", "tender"),
  TENDER_AWARDED("tender.awarded", "tender"),
  TENDER_CANCELLED("tender.cancelled", "tender"),
  TENDER_CASCADED("tender.cascaded", "tender"),
  OFFER_SUBMITTED("offer.submitted", "offer"),
  OFFER_ACCEPTED("offer.accepted", "offer"),
  OFFER_REJECTED("offer.rejected", "offer"),
  OFFER_WITHDRAWN("offer.withdrawn", "offer");

  private final String eventType;
  private final String entityType;

  TenderEventType(String eventType, String entityType) {
    this.eventType = eventType;
    this.entityType = entityType;
  }

  /** Dotted name used in the audit trail, e.g. "tender.closed". */
  public String eventType() {
    return eventType;
  }

  public String entityType() {
    return entityType;
  }
}
