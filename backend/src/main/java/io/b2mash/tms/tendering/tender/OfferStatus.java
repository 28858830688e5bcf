package io.b2mash.tms.tendering.tender;

/** Lifecycle status of a carrier's offer. ACCEPTED, REJECTED and WITHDRAWN are terminal. */
public enum OfferStatus {
  PENDING,
  SUBMITTED,
  ACCEPTED,
  REJECTED,
  WITHDRAWN
}
