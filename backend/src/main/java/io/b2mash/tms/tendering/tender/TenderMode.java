package io.b2mash.tms.tendering.tender;

/** How the tiers of a cascade are activated. */
public enum TenderMode {
  /** One tier at a time; the next tier opens only when the previous one closes without a bid. */
  SEQUENTIAL,

  /** Every tier opens at creation and runs independently. */
  PARALLEL
}
