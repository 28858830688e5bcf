package io.b2mash.tms.tendering.tender;

/** Lifecycle status of a tender. */
public enum TenderStatus {
  /** Created but not yet accepting offers (later tiers of a sequential cascade wait here). */
  DRAFT,

  /** Accepting offers until the offer deadline. */
  OPEN,

  /** No longer accepting offers; submitted offers await an award decision. */
  CLOSED,

  /** One offer accepted, rivals rejected. */
  AWARDED,

  /** Withdrawn by the broker. Reachable from any non-terminal status. */
  CANCELLED
}
