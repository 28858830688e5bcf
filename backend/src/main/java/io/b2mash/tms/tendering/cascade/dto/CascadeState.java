package io.b2mash.tms.tendering.cascade.dto;

/** Progress of a cascade, derived from the persisted state of its tenders. */
public enum CascadeState {
  /** Every tier is still DRAFT. */
  AWAITING_TIER_RESOLUTION,

  /** At least one tier is OPEN, or CLOSED with bids awaiting an award. */
  TIER_ACTIVE,

  /** A tier was awarded. */
  RESOLVED,

  /** Every tier finished without an award. */
  EXHAUSTED
}
